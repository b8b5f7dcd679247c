package com.farmket.marketplace.exception;

/**
 * A required value is missing or a value is outside its declared bounds.
 * Examples: empty email, negative price, malformed phone number.
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message) {
        this(message, ErrorCode.VALIDATION_ERROR);
    }

    public ValidationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
