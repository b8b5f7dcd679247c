package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.SellerProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SellerProfileRepository extends JpaRepository<SellerProfile, Long> {
    boolean existsByBusinessName(String businessName);
}
