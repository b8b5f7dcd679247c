package com.farmket.marketplace.service;

import com.farmket.marketplace.exception.ErrorCode;
import com.farmket.marketplace.exception.ResourceNotFoundException;
import com.farmket.marketplace.exception.UniquenessViolationException;
import com.farmket.marketplace.exception.ValidationException;
import com.farmket.marketplace.model.Category;
import com.farmket.marketplace.repository.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final AuditService auditService;

    public CategoryService(CategoryRepository categoryRepository, AuditService auditService) {
        this.categoryRepository = categoryRepository;
        this.auditService = auditService;
    }

    /**
     * Writes the category, deriving its slug from the name when the slug is empty.
     * <p>
     * Unlike products, categories get no numeric suffix: two names that slugify alike collide
     * and the second save fails with {@link UniquenessViolationException}.
     */
    @Transactional
    public Category save(Category category) {
        if (category.getName() == null || category.getName().isBlank()) {
            throw new ValidationException("Category name is required");
        }
        if (category.getName().length() > Category.MAX_NAME_LENGTH) {
            throw new ValidationException("Category name must be at most " + Category.MAX_NAME_LENGTH + " characters");
        }
        category.assignSlug();
        log.debug("Saving category '{}' with slug '{}'", category.getName(), category.getSlug());

        try {
            return categoryRepository.saveAndFlush(category);
        } catch (DataIntegrityViolationException e) {
            throw new UniquenessViolationException("Category name '" + category.getName() + "' or slug '"
                    + category.getSlug() + "' is already in use", e);
        }
    }

    public Category get(Long id) {
        return categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category not found: " + id,
                        ErrorCode.CATEGORY_NOT_FOUND));
    }

    public List<Category> subcategories(Long parentId) {
        return categoryRepository.findByParent_IdOrderByNameAsc(parentId);
    }

    /**
     * Deletes the category. Subcategories and every product filed under the deleted tree go with it
     * through the cascading foreign keys.
     */
    @Transactional
    public void delete(Long id) {
        Category category = get(id);
        categoryRepository.delete(category);
        categoryRepository.flush();
        log.info("Deleted category {} ({})", id, category.getSlug());
        auditService.log("DELETE_CATEGORY", "Category ID: " + id + ", slug: " + category.getSlug());
    }
}
