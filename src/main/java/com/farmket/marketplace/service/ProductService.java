package com.farmket.marketplace.service;

import com.farmket.marketplace.exception.ErrorCode;
import com.farmket.marketplace.exception.ResourceNotFoundException;
import com.farmket.marketplace.exception.UniquenessViolationException;
import com.farmket.marketplace.exception.ValidationException;
import com.farmket.marketplace.model.Product;
import com.farmket.marketplace.model.ProductImage;
import com.farmket.marketplace.repository.ProductImageRepository;
import com.farmket.marketplace.repository.ProductRepository;
import com.farmket.marketplace.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final ProductImageRepository imageRepository;
    private final AuditService auditService;

    public ProductService(ProductRepository productRepository, ProductImageRepository imageRepository,
            AuditService auditService) {
        this.productRepository = productRepository;
        this.imageRepository = imageRepository;
        this.auditService = auditService;
    }

    /**
     * Validates and writes the product, assigning a unique slug first when it has none.
     * <p>
     * The slug lookup and the insert are not atomic. If another writer takes the same slug in
     * between, the unique constraint rejects this row and a {@link UniquenessViolationException}
     * is thrown; clearing the slug and saving again picks the next free candidate.
     */
    @Transactional
    public Product save(Product product) {
        validate(product);
        assignSlug(product);

        try {
            return productRepository.saveAndFlush(product);
        } catch (DataIntegrityViolationException e) {
            throw new UniquenessViolationException("Product slug '" + product.getSlug() + "' or sku '"
                    + product.getSku() + "' is already in use", e);
        }
    }

    /**
     * Sets the slug to {@code slugify(name)}, or to the first of {@code base-1}, {@code base-2}, ...
     * that no other product holds. A slug that is already set is left untouched.
     */
    public void assignSlug(Product product) {
        if (!Slugs.isBlank(product.getSlug())) {
            return;
        }
        String base = Slugs.slugify(product.getName());
        String candidate = base;
        int counter = 1;
        while (slugTaken(candidate, product.getId())) {
            candidate = base + "-" + counter;
            counter++;
        }
        log.debug("Assigned slug '{}' to product '{}'", candidate, product.getName());
        product.setSlug(candidate);
    }

    private boolean slugTaken(String slug, Long ownId) {
        if (ownId == null) {
            return productRepository.existsBySlug(slug);
        }
        return productRepository.existsBySlugAndIdNot(slug, ownId);
    }

    private void validate(Product product) {
        if (product.getName() == null || product.getName().isBlank()) {
            throw new ValidationException("Product name is required");
        }
        if (product.getName().length() > Product.MAX_NAME_LENGTH) {
            throw new ValidationException("Product name must be at most " + Product.MAX_NAME_LENGTH + " characters");
        }
        if (product.getSku() == null || product.getSku().isBlank()) {
            throw new ValidationException("Product SKU is required");
        }
        if (product.getSku().length() > Product.MAX_SKU_LENGTH) {
            throw new ValidationException("Product SKU must be at most " + Product.MAX_SKU_LENGTH + " characters");
        }
        if (product.getSeller() == null) {
            throw new ValidationException("Product must belong to a seller");
        }
        if (product.getCategory() == null) {
            throw new ValidationException("Product must have a category");
        }
        if (product.getPrice() == null) {
            throw new ValidationException("Product price is required");
        }
        requireNotNegative(product.getPrice(), "Price");
        if (product.getDiscountPrice() != null) {
            requireNotNegative(product.getDiscountPrice(), "Discount price");
        }
        if (product.getStockQuantity() < 0 || product.getTotalReviews() < 0 || product.getTotalSold() < 0) {
            throw new ValidationException("Stock quantity and counters must not be negative", ErrorCode.NEGATIVE_AMOUNT);
        }
        BigDecimal rating = product.getAverageRating();
        if (rating == null || rating.signum() < 0 || rating.compareTo(Product.MAX_RATING) > 0) {
            throw new ValidationException("Average rating must be between 0 and " + Product.MAX_RATING);
        }
    }

    private static void requireNotNegative(BigDecimal amount, String label) {
        if (amount.signum() < 0) {
            throw new ValidationException(label + " must not be negative, got " + amount.toPlainString(),
                    ErrorCode.NEGATIVE_AMOUNT);
        }
    }

    public Product get(Long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + id,
                        ErrorCode.PRODUCT_NOT_FOUND));
    }

    public Product findBySlug(String slug) {
        return productRepository.findBySlug(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + slug,
                        ErrorCode.PRODUCT_NOT_FOUND));
    }

    @Transactional
    public ProductImage addImage(Long productId, String image, String altText) {
        if (image == null || image.isBlank()) {
            throw new ValidationException("Image reference is required");
        }
        ProductImage productImage = new ProductImage();
        productImage.setProduct(get(productId));
        productImage.setImage(image);
        productImage.setAltText(altText != null ? altText : "");
        return imageRepository.save(productImage);
    }

    public List<ProductImage> images(Long productId) {
        return imageRepository.findByProductIdOrderByCreatedAtAsc(productId);
    }

    // Images are removed by the cascading foreign key
    @Transactional
    public void delete(Long id) {
        Product product = get(id);
        productRepository.delete(product);
        productRepository.flush();
        log.info("Deleted product {} ({})", id, product.getSlug());
        auditService.log("DELETE_PRODUCT", "Product ID: " + id + ", sku: " + product.getSku());
    }
}
