package com.wallet.monitor.service;

/**
 * Rejected caller input. Rendered as 400 with the offending field name.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String message, String field) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
