package com.farmket.marketplace.repository;

import com.farmket.marketplace.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository extends JpaRepository<Category, Long>, JpaSpecificationExecutor<Category> {
    Optional<Category> findBySlug(String slug);

    List<Category> findByParent_IdOrderByNameAsc(Long parentId);
}
