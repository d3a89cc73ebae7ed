package com.zatca.fatoora.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts {@link ApiError} entries from a failed response body.
 *
 * <p>Order of preference: {@code validationResults.errorMessages}, then an
 * {@code errors} array, then a top-level {@code code}/{@code message}.
 * When none is present a generic HTTP error is synthesized from the status.
 */
public final class ApiErrors {

    private ApiErrors() {
    }

    public static List<ApiError> fromResponse(JsonNode body, int status) {
        List<ApiError> errors = new ArrayList<>();

        if (body != null && body.isObject()) {
            JsonNode errorMessages = body.path("validationResults").path("errorMessages");
            if (errorMessages.isArray()) {
                for (JsonNode message : errorMessages) {
                    errors.add(fromMessage(ApiError.Type.ERROR, message));
                }
            }

            if (errors.isEmpty() && body.path("errors").isArray()) {
                for (JsonNode error : body.get("errors")) {
                    if (error.isTextual()) {
                        errors.add(new ApiError(ApiError.Type.API, "HTTP_" + status, null, error.asText()));
                    } else {
                        errors.add(fromMessage(ApiError.Type.API, error));
                    }
                }
            }

            if (errors.isEmpty() && (body.hasNonNull("code") || body.hasNonNull("message"))) {
                errors.add(new ApiError(ApiError.Type.API,
                    text(body, "code", "HTTP_" + status),
                    text(body, "category", null),
                    text(body, "message", "HTTP error: " + status)));
            }
        }

        if (errors.isEmpty()) {
            errors.add(new ApiError(ApiError.Type.API, "HTTP_" + status, null, "HTTP error: " + status));
        }
        return errors;
    }

    /**
     * Map one regulator message object ({@code type, code, category, message}).
     */
    public static ApiError fromMessage(ApiError.Type type, JsonNode message) {
        return new ApiError(type,
            text(message, "code", null),
            text(message, "category", null),
            text(message, "message", null));
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : fallback;
    }
}
