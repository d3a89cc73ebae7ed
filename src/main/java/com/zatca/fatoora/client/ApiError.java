package com.zatca.fatoora.client;

import java.util.Objects;

/**
 * One entry in the {@code errors}/{@code warnings} lists of a protocol
 * result. Transport failures, HTTP failures and regulator validation
 * messages all share this shape and differ only by {@link Type}.
 */
public final class ApiError {

    public enum Type {
        /** No HTTP response was received */
        NETWORK,
        /** Non-2xx response without regulator validation messages */
        API,
        /** Rejected locally before any call, e.g. expired credential */
        VALIDATION,
        ERROR,
        WARNING,
        INFO
    }

    public static final String FETCH_ERROR = "FETCH_ERROR";
    public static final String CSID_EXPIRED = "CSID_EXPIRED";

    private final Type type;
    private final String code;
    private final String category;
    private final String message;

    public ApiError(Type type, String code, String category, String message) {
        this.type = Objects.requireNonNull(type, "type");
        this.code = code;
        this.category = category;
        this.message = message;
    }

    public static ApiError network(String networkCode, String message) {
        return new ApiError(Type.NETWORK, FETCH_ERROR, networkCode, message);
    }

    public static ApiError validation(String code, String category, String message) {
        return new ApiError(Type.VALIDATION, code, category, message);
    }

    public Type getType() { return type; }
    public String getCode() { return code; }
    public String getCategory() { return category; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApiError apiError = (ApiError) o;
        return type == apiError.type
            && Objects.equals(code, apiError.code)
            && Objects.equals(category, apiError.category)
            && Objects.equals(message, apiError.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, code, category, message);
    }

    @Override
    public String toString() {
        return type + "/" + code + (category != null ? " (" + category + ")" : "") + ": " + message;
    }
}
