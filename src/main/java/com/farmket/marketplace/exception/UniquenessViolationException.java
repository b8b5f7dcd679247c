package com.farmket.marketplace.exception;

/**
 * A slug, sku, email or business name collided with an existing row.
 * <p>
 * For product slugs this can still happen after the collision check when two writers race; the
 * caller may clear the slug and save again to get a fresh candidate.
 */
public class UniquenessViolationException extends ApplicationException {
    public UniquenessViolationException(String message) {
        this(message, ErrorCode.DUPLICATE_VALUE);
    }

    public UniquenessViolationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public UniquenessViolationException(String message, Throwable cause) {
        super(message, ErrorCode.DUPLICATE_VALUE, cause);
    }
}
