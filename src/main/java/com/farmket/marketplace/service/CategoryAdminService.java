package com.farmket.marketplace.service;

import com.farmket.marketplace.model.Category;
import com.farmket.marketplace.repository.CategoryRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Service
@Transactional(readOnly = true)
public class CategoryAdminService {

    private final CategoryRepository categoryRepository;

    public CategoryAdminService(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    // Name/slug search with an optional parent filter, alphabetical
    public List<Category> search(String query, Long parentId) {
        Specification<Category> spec = Specification.where(matchesQuery(query)).and(hasParent(parentId));
        return categoryRepository.findAll(spec, Sort.by("name"));
    }

    private static Specification<Category> matchesQuery(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        String pattern = "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, cq, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern),
                cb.like(cb.lower(root.get("slug")), pattern));
    }

    private static Specification<Category> hasParent(Long parentId) {
        return parentId == null ? null : (root, cq, cb) -> cb.equal(root.get("parent").get("id"), parentId);
    }
}
