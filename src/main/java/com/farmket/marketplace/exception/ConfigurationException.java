package com.farmket.marketplace.exception;

// Thrown for contradictory account flags, e.g. a superuser with staff=false
public class ConfigurationException extends ApplicationException {
    public ConfigurationException(String message) {
        super(message, ErrorCode.INVALID_SUPERUSER_FLAGS);
    }
}
