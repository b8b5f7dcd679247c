package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.BuyerProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BuyerProfileRepository extends JpaRepository<BuyerProfile, Long> {
}
