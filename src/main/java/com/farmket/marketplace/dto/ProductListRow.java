package com.farmket.marketplace.dto;

import com.farmket.marketplace.model.ProductStatus;

import java.time.LocalDateTime;

public record ProductListRow(
        Long productId,
        String name,
        String sellerBusinessName,
        String finalPrice,
        int stockQuantity,
        ProductStatus status,
        boolean featured,
        LocalDateTime createdAt) {
}
