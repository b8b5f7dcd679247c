package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.ProductImage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProductImageRepository extends JpaRepository<ProductImage, Long> {
    List<ProductImage> findByProductIdOrderByCreatedAtAsc(Long productId);

    long countByProductId(Long productId);
}
