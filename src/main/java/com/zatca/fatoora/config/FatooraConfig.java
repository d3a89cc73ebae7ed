package com.zatca.fatoora.config;

import java.util.Objects;

/**
 * Fatoora configuration class
 * Defines all configuration options for the e-invoicing engine
 * Use the Builder pattern to construct instances
 */
public class FatooraConfig {

    // Environment and endpoints
    private final FatooraEnvironment environment;
    private final String baseUrl;
    private final String complianceApiUrl;
    private final String complianceInvoicesApiUrl;
    private final String clearanceApiUrl;
    private final String reportingApiUrl;
    private final String productionCsidApiUrl;

    // Transport
    private final int timeout;
    private final int retryAttempts;
    private final int retryDelay;
    private final boolean enableAuditLog;

    // Crypto and credential lifecycle
    private final String signingCurve;
    private final int csidRenewalWindowDays;

    private FatooraConfig(Builder builder) {
        this.environment = builder.environment;
        this.baseUrl = resolveBaseUrl(builder.baseUrl, builder.environment);
        this.complianceApiUrl = resolveEndpoint(builder.complianceApiUrl, FatooraConfigConstants.COMPLIANCE_PATH);
        this.complianceInvoicesApiUrl = resolveEndpoint(builder.complianceInvoicesApiUrl,
            FatooraConfigConstants.COMPLIANCE_INVOICES_PATH);
        this.clearanceApiUrl = resolveEndpoint(builder.clearanceApiUrl, FatooraConfigConstants.CLEARANCE_PATH);
        this.reportingApiUrl = resolveEndpoint(builder.reportingApiUrl, FatooraConfigConstants.REPORTING_PATH);
        this.productionCsidApiUrl = resolveEndpoint(builder.productionCsidApiUrl,
            FatooraConfigConstants.PRODUCTION_CSID_PATH);
        this.timeout = builder.timeout;
        this.retryAttempts = builder.retryAttempts;
        this.retryDelay = builder.retryDelay;
        this.enableAuditLog = builder.enableAuditLog;
        this.signingCurve = builder.signingCurve;
        this.csidRenewalWindowDays = builder.csidRenewalWindowDays;
    }

    private String resolveBaseUrl(String customBaseUrl, FatooraEnvironment env) {
        if (customBaseUrl != null && !customBaseUrl.isEmpty()) {
            return stripTrailingSlash(customBaseUrl);
        }
        return FatooraConfigConstants.getBaseUrl(env);
    }

    private String resolveEndpoint(String customUrl, String path) {
        if (customUrl != null && !customUrl.isEmpty()) {
            return customUrl;
        }
        return baseUrl + path;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Getters

    public FatooraEnvironment getEnvironment() {
        return environment;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getComplianceApiUrl() {
        return complianceApiUrl;
    }

    public String getComplianceInvoicesApiUrl() {
        return complianceInvoicesApiUrl;
    }

    public String getClearanceApiUrl() {
        return clearanceApiUrl;
    }

    public String getReportingApiUrl() {
        return reportingApiUrl;
    }

    public String getProductionCsidApiUrl() {
        return productionCsidApiUrl;
    }

    public int getTimeout() {
        return timeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public int getRetryDelay() {
        return retryDelay;
    }

    public boolean isEnableAuditLog() {
        return enableAuditLog;
    }

    public String getSigningCurve() {
        return signingCurve;
    }

    public int getCsidRenewalWindowDays() {
        return csidRenewalWindowDays;
    }

    /**
     * Create a new Builder instance
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a Builder initialized with this config's values
     *
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .environment(this.environment)
            .baseUrl(this.baseUrl)
            .complianceApiUrl(this.complianceApiUrl)
            .complianceInvoicesApiUrl(this.complianceInvoicesApiUrl)
            .clearanceApiUrl(this.clearanceApiUrl)
            .reportingApiUrl(this.reportingApiUrl)
            .productionCsidApiUrl(this.productionCsidApiUrl)
            .timeout(this.timeout)
            .retryAttempts(this.retryAttempts)
            .retryDelay(this.retryDelay)
            .enableAuditLog(this.enableAuditLog)
            .signingCurve(this.signingCurve)
            .csidRenewalWindowDays(this.csidRenewalWindowDays);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FatooraConfig that = (FatooraConfig) o;
        return timeout == that.timeout &&
               retryAttempts == that.retryAttempts &&
               retryDelay == that.retryDelay &&
               enableAuditLog == that.enableAuditLog &&
               csidRenewalWindowDays == that.csidRenewalWindowDays &&
               environment == that.environment &&
               Objects.equals(baseUrl, that.baseUrl) &&
               Objects.equals(complianceApiUrl, that.complianceApiUrl) &&
               Objects.equals(complianceInvoicesApiUrl, that.complianceInvoicesApiUrl) &&
               Objects.equals(clearanceApiUrl, that.clearanceApiUrl) &&
               Objects.equals(reportingApiUrl, that.reportingApiUrl) &&
               Objects.equals(productionCsidApiUrl, that.productionCsidApiUrl) &&
               Objects.equals(signingCurve, that.signingCurve);
    }

    @Override
    public int hashCode() {
        return Objects.hash(environment, baseUrl, complianceApiUrl, complianceInvoicesApiUrl,
            clearanceApiUrl, reportingApiUrl, productionCsidApiUrl, timeout, retryAttempts,
            retryDelay, enableAuditLog, signingCurve, csidRenewalWindowDays);
    }

    @Override
    public String toString() {
        return "FatooraConfig{" +
               "environment=" + environment +
               ", baseUrl='" + baseUrl + '\'' +
               ", clearanceApiUrl='" + clearanceApiUrl + '\'' +
               ", reportingApiUrl='" + reportingApiUrl + '\'' +
               ", timeout=" + timeout +
               ", retryAttempts=" + retryAttempts +
               ", signingCurve='" + signingCurve + '\'' +
               '}';
    }

    /**
     * Builder for FatooraConfig
     */
    public static class Builder {
        private FatooraEnvironment environment = FatooraConfigConstants.DEFAULT_ENVIRONMENT;
        private String baseUrl;
        private String complianceApiUrl;
        private String complianceInvoicesApiUrl;
        private String clearanceApiUrl;
        private String reportingApiUrl;
        private String productionCsidApiUrl;
        private int timeout = FatooraConfigConstants.DEFAULT_TIMEOUT;
        private int retryAttempts = FatooraConfigConstants.DEFAULT_RETRY_ATTEMPTS;
        private int retryDelay = FatooraConfigConstants.DEFAULT_RETRY_DELAY;
        private boolean enableAuditLog = FatooraConfigConstants.DEFAULT_ENABLE_AUDIT_LOG;
        private String signingCurve = FatooraConfigConstants.DEFAULT_SIGNING_CURVE;
        private int csidRenewalWindowDays = FatooraConfigConstants.DEFAULT_CSID_RENEWAL_WINDOW_DAYS;

        public Builder environment(FatooraEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder complianceApiUrl(String complianceApiUrl) {
            this.complianceApiUrl = complianceApiUrl;
            return this;
        }

        public Builder complianceInvoicesApiUrl(String complianceInvoicesApiUrl) {
            this.complianceInvoicesApiUrl = complianceInvoicesApiUrl;
            return this;
        }

        public Builder clearanceApiUrl(String clearanceApiUrl) {
            this.clearanceApiUrl = clearanceApiUrl;
            return this;
        }

        public Builder reportingApiUrl(String reportingApiUrl) {
            this.reportingApiUrl = reportingApiUrl;
            return this;
        }

        public Builder productionCsidApiUrl(String productionCsidApiUrl) {
            this.productionCsidApiUrl = productionCsidApiUrl;
            return this;
        }

        public Builder timeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(int retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder enableAuditLog(boolean enableAuditLog) {
            this.enableAuditLog = enableAuditLog;
            return this;
        }

        public Builder signingCurve(String signingCurve) {
            this.signingCurve = signingCurve;
            return this;
        }

        public Builder csidRenewalWindowDays(int csidRenewalWindowDays) {
            this.csidRenewalWindowDays = csidRenewalWindowDays;
            return this;
        }

        /**
         * Build and validate the FatooraConfig
         *
         * @return the validated FatooraConfig
         * @throws ConfigValidationException if validation fails
         */
        public FatooraConfig build() {
            FatooraConfig config = new FatooraConfig(this);
            ConfigValidator validator = new ConfigValidator();
            validator.validateOrThrow(config);
            return config;
        }

        /**
         * Build without validation
         *
         * @return the FatooraConfig (unvalidated)
         */
        public FatooraConfig buildUnchecked() {
            return new FatooraConfig(this);
        }
    }
}
