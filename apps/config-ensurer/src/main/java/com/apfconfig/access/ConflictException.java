package com.apfconfig.access;

public class ConflictException extends ConfigurationException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
