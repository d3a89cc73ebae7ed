package com.zatca.fatoora.submission;

/**
 * Overall regulator verdict in {@code validationResults.status}.
 */
public enum ValidationStatus {
    PASS,
    WARNING,
    ERROR;

    /**
     * A missing status maps to {@code PASS}; an unrecognised one to {@code ERROR}.
     */
    public static ValidationStatus fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return PASS;
        }
        for (ValidationStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return ERROR;
    }
}
