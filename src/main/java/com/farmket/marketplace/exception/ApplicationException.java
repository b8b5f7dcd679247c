package com.farmket.marketplace.exception;

/**
 * Base class of the marketplace's unchecked exceptions. Every subclass carries an {@link ErrorCode}
 * so callers can tell failures apart without parsing messages.
 */
public abstract class ApplicationException extends RuntimeException {
    private final ErrorCode errorCode;

    protected ApplicationException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ApplicationException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
