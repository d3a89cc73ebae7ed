package com.zatca.fatoora.config;

import org.bouncycastle.jce.ECNamedCurveTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fatoora configuration validator
 * Collects every violation instead of stopping at the first one
 */
public class ConfigValidator {
    
    private static final Pattern URL_PATTERN = Pattern.compile("^https?://.*$");
    
    /**
     * Validation error detail
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final Object value;
        
        public ValidationError(String field, String message) {
            this(field, message, null);
        }
        
        public ValidationError(String field, String message, Object value) {
            this.field = field;
            this.message = message;
            this.value = value;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getValue() { return value; }
        
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
    
    /**
     * Validation result
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        
        public ValidationResult(boolean valid, List<ValidationError> errors) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
        }
        
        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
    }
    
    /**
     * Validate the configuration
     * 
     * @param config the configuration to validate
     * @return the validation result
     */
    public ValidationResult validate(FatooraConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateRequired(config, errors);
        validateUrls(config, errors);
        validateRanges(config, errors);
        validateSigningCurve(config, errors);
        
        return new ValidationResult(errors.isEmpty(), errors);
    }
    
    /**
     * Validate and throw exception if invalid
     * 
     * @param config the configuration to validate
     * @throws ConfigValidationException if validation fails
     */
    public void validateOrThrow(FatooraConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            StringBuilder sb = new StringBuilder("Configuration validation failed: ");
            List<ValidationError> errors = result.getErrors();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) sb.append("; ");
                sb.append(errors.get(i));
            }
            throw new ConfigValidationException(sb.toString(), errors.get(0).getField());
        }
    }
    
    private void validateRequired(FatooraConfig config, List<ValidationError> errors) {
        if (config.getEnvironment() == null) {
            errors.add(new ValidationError("environment", "environment is required"));
        }
    }
    
    private void validateUrls(FatooraConfig config, List<ValidationError> errors) {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put("baseUrl", config.getBaseUrl());
        urls.put("complianceApiUrl", config.getComplianceApiUrl());
        urls.put("complianceInvoicesApiUrl", config.getComplianceInvoicesApiUrl());
        urls.put("clearanceApiUrl", config.getClearanceApiUrl());
        urls.put("reportingApiUrl", config.getReportingApiUrl());
        urls.put("productionCsidApiUrl", config.getProductionCsidApiUrl());
        
        urls.forEach((field, url) -> {
            if (url == null || !URL_PATTERN.matcher(url).matches()) {
                errors.add(new ValidationError(field, field + " must be a valid HTTP/HTTPS URL", url));
            }
        });
    }
    
    private void validateRanges(FatooraConfig config, List<ValidationError> errors) {
        int timeout = config.getTimeout();
        if (timeout <= 0) {
            errors.add(new ValidationError("timeout", "timeout must be a positive number (milliseconds)", timeout));
        } else if (timeout < FatooraConfigConstants.MIN_TIMEOUT) {
            errors.add(new ValidationError("timeout", 
                "timeout should be at least " + FatooraConfigConstants.MIN_TIMEOUT + "ms for reliable operation", timeout));
        } else if (timeout > FatooraConfigConstants.MAX_TIMEOUT) {
            errors.add(new ValidationError("timeout", 
                "timeout should not exceed " + FatooraConfigConstants.MAX_TIMEOUT + "ms (5 minutes)", timeout));
        }
        
        int retryAttempts = config.getRetryAttempts();
        if (retryAttempts < FatooraConfigConstants.MIN_RETRY_ATTEMPTS) {
            errors.add(new ValidationError("retryAttempts", "retryAttempts must be a non-negative integer", retryAttempts));
        } else if (retryAttempts > FatooraConfigConstants.MAX_RETRY_ATTEMPTS) {
            errors.add(new ValidationError("retryAttempts", 
                "retryAttempts should not exceed " + FatooraConfigConstants.MAX_RETRY_ATTEMPTS, retryAttempts));
        }
        
        int retryDelay = config.getRetryDelay();
        if (retryDelay <= 0) {
            errors.add(new ValidationError("retryDelay", "retryDelay must be a positive number (milliseconds)", retryDelay));
        } else if (retryDelay > FatooraConfigConstants.MAX_RETRY_DELAY) {
            errors.add(new ValidationError("retryDelay", 
                "retryDelay should not exceed " + FatooraConfigConstants.MAX_RETRY_DELAY + "ms (1 minute)", retryDelay));
        }
        
        if (config.getCsidRenewalWindowDays() < 0) {
            errors.add(new ValidationError("csidRenewalWindowDays",
                "csidRenewalWindowDays must be a non-negative integer", config.getCsidRenewalWindowDays()));
        }
    }
    
    private void validateSigningCurve(FatooraConfig config, List<ValidationError> errors) {
        String curve = config.getSigningCurve();
        if (curve == null || curve.trim().isEmpty()) {
            errors.add(new ValidationError("signingCurve", "signingCurve is required"));
        } else if (ECNamedCurveTable.getParameterSpec(curve) == null) {
            errors.add(new ValidationError("signingCurve", "signingCurve is not a known EC named curve", curve));
        }
    }
}
