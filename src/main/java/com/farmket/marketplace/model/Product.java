package com.farmket.marketplace.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_product_slug", columnList = "slug"),
        @Index(name = "idx_product_name", columnList = "name"),
        @Index(name = "idx_product_category", columnList = "category_id"),
        @Index(name = "idx_product_status", columnList = "status"),
        @Index(name = "idx_product_featured", columnList = "featured"),
        @Index(name = "idx_product_seller", columnList = "seller_id"),
        @Index(name = "idx_product_stock", columnList = "stock_quantity"),
        @Index(name = "idx_product_total_sold", columnList = "total_sold"),
        @Index(name = "idx_product_rating", columnList = "average_rating")
})
@Data
public class Product {

    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_SLUG_LENGTH = 255;
    public static final int MAX_SKU_LENGTH = 50;
    public static final BigDecimal MAX_RATING = new BigDecimal("9.99");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "seller_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SellerProfile seller;

    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;

    @Column(unique = true, nullable = false, length = MAX_SLUG_LENGTH)
    private String slug;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Category category;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(precision = 10, scale = 2)
    private BigDecimal discountPrice; // sale price when set

    @Column(name = "stock_quantity")
    private int stockQuantity = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private UnitOfMeasure unit = UnitOfMeasure.KG;

    @Column(unique = true, nullable = false, length = MAX_SKU_LENGTH)
    private String sku;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProductStatus status = ProductStatus.AVAILABLE;

    private boolean featured = false;

    @Column(name = "average_rating", nullable = false, precision = 3, scale = 2)
    private BigDecimal averageRating = new BigDecimal("0.00");

    private int totalReviews = 0;

    @Column(name = "total_sold")
    private int totalSold = 0;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Percentage knocked off {@link #price} by {@link #discountPrice}, rounded to 2 places.
     * A discount price above the list price yields a negative percentage.
     * A discount price of 0.00 counts as set and gives 100.00.
     */
    public BigDecimal getDiscountPercentage() {
        if (discountPrice != null && price != null && price.signum() > 0) {
            return price.subtract(discountPrice)
                    .multiply(HUNDRED)
                    .divide(price, 2, RoundingMode.HALF_EVEN);
        }
        return BigDecimal.ZERO.setScale(2);
    }

    /**
     * The price a buyer pays: the discount price whenever one is set, even if it is higher than the list price.
     * Only {@code null} means unset, so a 0.00 discount price is the final price.
     */
    public BigDecimal getFinalPrice() {
        return discountPrice != null ? discountPrice : price;
    }

    // Not tied to status, an AVAILABLE product can have zero stock
    public boolean isInStock() {
        return stockQuantity > 0;
    }

    @Override
    public String toString() {
        String businessName = seller != null ? seller.getBusinessName() : null;
        return name + " - " + businessName;
    }
}
