package com.farmket.marketplace.exception;

/**
 * Error codes carried by {@link ApplicationException}s. Each code has a default message for logs.
 */
public enum ErrorCode {
    // Validation
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    EMAIL_REQUIRED("EMAIL_REQUIRED", "Users must have an email address"),
    INVALID_PHONE_NUMBER("INVALID_PHONE_NUMBER", "Phone number does not match the expected format"),
    NEGATIVE_AMOUNT("NEGATIVE_AMOUNT", "Amount must not be negative"),

    // Uniqueness
    DUPLICATE_VALUE("DUPLICATE_VALUE", "Value already in use"),
    EMAIL_ALREADY_EXISTS("EMAIL_ALREADY_EXISTS", "Email already registered"),

    // Configuration
    INVALID_SUPERUSER_FLAGS("INVALID_SUPERUSER_FLAGS", "Contradictory superuser flags"),

    // Lookups
    CATEGORY_NOT_FOUND("CATEGORY_NOT_FOUND", "Category not found"),
    PRODUCT_NOT_FOUND("PRODUCT_NOT_FOUND", "Product not found"),
    USER_NOT_FOUND("USER_NOT_FOUND", "User not found");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
