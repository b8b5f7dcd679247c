package com.farmket.marketplace.service;

import com.farmket.marketplace.dto.ProductListRow;
import com.farmket.marketplace.model.Product;
import com.farmket.marketplace.model.ProductStatus;
import com.farmket.marketplace.model.SellerProfile;
import com.farmket.marketplace.model.User;
import com.farmket.marketplace.repository.ProductRepository;
import jakarta.persistence.criteria.Join;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Read side of the product admin screen: list rows with their display columns, free-text search
 * and the category/status/featured filters.
 */
@Service
@Transactional(readOnly = true)
public class ProductAdminService {

    private final ProductRepository productRepository;
    private final SettingsService settingsService;

    public ProductAdminService(ProductRepository productRepository, SettingsService settingsService) {
        this.productRepository = productRepository;
        this.settingsService = settingsService;
    }

    /**
     * Lists products newest first. {@code query} matches name, slug, sku, seller email and seller
     * business name, case-insensitively; {@code null} arguments do not filter.
     */
    public List<ProductListRow> search(String query, Long categoryId, ProductStatus status, Boolean featured) {
        Specification<Product> spec = Specification.where(matchesQuery(query))
                .and(inCategory(categoryId))
                .and(hasStatus(status))
                .and(isFeatured(featured));

        String currencySymbol = settingsService.getCurrencySymbol();
        return productRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt")).stream()
                .map(p -> new ProductListRow(
                        p.getId(),
                        p.getName(),
                        sellerBusinessName(p),
                        formatPrice(currencySymbol, p.getFinalPrice()),
                        p.getStockQuantity(),
                        p.getStatus(),
                        p.isFeatured(),
                        p.getCreatedAt()))
                .toList();
    }

    // "Price" column, e.g. $12.50
    public String formatFinalPrice(Product product) {
        return formatPrice(settingsService.getCurrencySymbol(), product.getFinalPrice());
    }

    public String sellerBusinessName(Product product) {
        SellerProfile seller = product.getSeller();
        return seller != null ? seller.getBusinessName() : null;
    }

    private static String formatPrice(String currencySymbol, BigDecimal amount) {
        return amount != null ? currencySymbol + amount.toPlainString() : "";
    }

    private static Specification<Product> matchesQuery(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        String pattern = "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, cq, cb) -> {
            Join<Product, SellerProfile> seller = root.join("seller");
            Join<SellerProfile, User> user = seller.join("user");
            return cb.or(
                    cb.like(cb.lower(root.get("name")), pattern),
                    cb.like(cb.lower(root.get("slug")), pattern),
                    cb.like(cb.lower(root.get("sku")), pattern),
                    cb.like(cb.lower(user.get("email")), pattern),
                    cb.like(cb.lower(seller.get("businessName")), pattern));
        };
    }

    private static Specification<Product> inCategory(Long categoryId) {
        return categoryId == null ? null : (root, cq, cb) -> cb.equal(root.get("category").get("id"), categoryId);
    }

    private static Specification<Product> hasStatus(ProductStatus status) {
        return status == null ? null : (root, cq, cb) -> cb.equal(root.get("status"), status);
    }

    private static Specification<Product> isFeatured(Boolean featured) {
        return featured == null ? null : (root, cq, cb) -> cb.equal(root.get("featured"), featured);
    }
}
