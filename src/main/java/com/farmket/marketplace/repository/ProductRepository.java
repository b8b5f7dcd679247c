package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {
    Optional<Product> findBySlug(String slug);

    boolean existsBySlug(String slug);

    // Same check, ignoring the row being re-saved
    boolean existsBySlugAndIdNot(String slug, Long id);
}
