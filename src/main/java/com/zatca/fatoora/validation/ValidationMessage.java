package com.zatca.fatoora.validation;

import java.util.Objects;

/**
 * A single local validation finding, e.g. {@code SEL-002} on
 * {@code seller.vatNumber}.
 */
public final class ValidationMessage {

    private final String code;
    private final String category;
    private final String field;
    private final String message;

    public ValidationMessage(String code, String category, String field, String message) {
        this.code = code;
        this.category = category;
        this.field = field;
        this.message = message;
    }

    public String getCode() { return code; }
    public String getCategory() { return category; }
    public String getField() { return field; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationMessage that = (ValidationMessage) o;
        return Objects.equals(code, that.code)
            && Objects.equals(category, that.category)
            && Objects.equals(field, that.field)
            && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, category, field, message);
    }

    @Override
    public String toString() {
        return code + " [" + field + "]: " + message;
    }
}
