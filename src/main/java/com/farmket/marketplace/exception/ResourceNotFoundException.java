package com.farmket.marketplace.exception;

public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }
}
