package com.zatca.fatoora.exception;

/**
 * Validation exception class
 */
public class ValidationException extends FatooraException {
    private final String field;

    public ValidationException(String message) {
        this(message, "VALIDATION_ERROR", null);
    }

    public ValidationException(String message, String field) {
        this(message, "VALIDATION_ERROR", field);
    }
    
    public ValidationException(String message, String code, String field) {
        this(message, code, field, null);
    }

    public ValidationException(String message, String code, String field, Throwable cause) {
        super(message, code, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
