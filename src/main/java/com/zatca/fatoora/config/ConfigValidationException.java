package com.zatca.fatoora.config;

import com.zatca.fatoora.exception.ValidationException;

/**
 * Configuration validation exception
 */
public class ConfigValidationException extends ValidationException {
    
    private static final String CODE = "CONFIG_VALIDATION_ERROR";
    
    public ConfigValidationException(String message) {
        super(message, CODE, null);
    }
    
    public ConfigValidationException(String message, String field) {
        super(message, CODE, field);
    }
}
