package com.farmket.marketplace.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Business details of a seller. Shares its primary key with the owning {@link User} and is
 * removed together with it.
 */
@Entity
@Table(name = "seller_profiles", indexes = {
        @Index(name = "idx_seller_rating_verified", columnList = "rating, verified_seller"),
        @Index(name = "idx_seller_business_name", columnList = "business_name")
})
@Data
public class SellerProfile {

    public static final int MAX_BUSINESS_NAME_LENGTH = 200;

    @Id
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @MapsId
    @JoinColumn(name = "user_id")
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "business_name", unique = true, nullable = false, length = MAX_BUSINESS_NAME_LENGTH)
    private String businessName;

    @Column(columnDefinition = "text")
    private String businessDescription;

    private String businessLogo;

    // Tax and legal
    @Column(length = 50)
    private String taxId;
    @Column(length = 100)
    private String businessLicense;

    // Payout account
    @Column(length = MAX_BUSINESS_NAME_LENGTH)
    private String bankAccountName;
    @Column(length = 50)
    private String bankAccountNumber;
    @Column(length = 100)
    private String bankName;
    @Column(length = 50)
    private String bankRoutingNumber;

    @Column(nullable = false, precision = 3, scale = 2)
    private BigDecimal rating = new BigDecimal("0.00");

    private int totalSales = 0;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalRevenue = new BigDecimal("0.00");

    @Column(name = "verified_seller")
    private boolean verifiedSeller = false;

    private LocalDateTime verificationDate;

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
}
