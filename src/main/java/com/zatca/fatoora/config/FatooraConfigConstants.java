package com.zatca.fatoora.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Fatoora configuration constants and defaults
 */
public final class FatooraConfigConstants {
    
    private FatooraConfigConstants() {
        // Utility class
    }
    
    // Fatoora base URLs
    public static final String SANDBOX_URL = "https://gw-fatoora.zatca.gov.sa/e-invoicing/developer-portal";
    public static final String SIMULATION_URL = "https://gw-fatoora.zatca.gov.sa/e-invoicing/simulation";
    public static final String PRODUCTION_URL = "https://gw-fatoora.zatca.gov.sa/e-invoicing/core";
    
    // Endpoint paths, relative to the base URL
    public static final String COMPLIANCE_PATH = "/compliance";
    public static final String COMPLIANCE_INVOICES_PATH = "/compliance/invoices";
    public static final String PRODUCTION_CSID_PATH = "/production/csids";
    public static final String CLEARANCE_PATH = "/invoices/clearance/single";
    public static final String REPORTING_PATH = "/invoices/reporting/single";
    
    // Default values
    public static final FatooraEnvironment DEFAULT_ENVIRONMENT = FatooraEnvironment.SANDBOX;
    public static final int DEFAULT_TIMEOUT = 30000;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_RETRY_DELAY = 1000;
    public static final boolean DEFAULT_ENABLE_AUDIT_LOG = true;
    public static final String DEFAULT_SIGNING_CURVE = "secp256k1";
    public static final int DEFAULT_CSID_RENEWAL_WINDOW_DAYS = 30;
    
    // Validation limits
    public static final int MIN_TIMEOUT = 1000;
    public static final int MAX_TIMEOUT = 300000;
    public static final int MIN_RETRY_ATTEMPTS = 0;
    public static final int MAX_RETRY_ATTEMPTS = 10;
    public static final int MAX_RETRY_DELAY = 60000;
    
    // Environment variable names
    public static final String ENV_ENVIRONMENT = "FATOORA_ENVIRONMENT";
    public static final String ENV_BASE_URL = "FATOORA_BASE_URL";
    public static final String ENV_COMPLIANCE_API_URL = "FATOORA_COMPLIANCE_API_URL";
    public static final String ENV_COMPLIANCE_INVOICES_API_URL = "FATOORA_COMPLIANCE_INVOICES_API_URL";
    public static final String ENV_CLEARANCE_API_URL = "FATOORA_CLEARANCE_API_URL";
    public static final String ENV_REPORTING_API_URL = "FATOORA_REPORTING_API_URL";
    public static final String ENV_PRODUCTION_CSID_API_URL = "FATOORA_PRODUCTION_CSID_API_URL";
    public static final String ENV_TIMEOUT = "FATOORA_TIMEOUT";
    public static final String ENV_RETRY_ATTEMPTS = "FATOORA_RETRY_ATTEMPTS";
    public static final String ENV_RETRY_DELAY = "FATOORA_RETRY_DELAY";
    public static final String ENV_ENABLE_AUDIT_LOG = "FATOORA_ENABLE_AUDIT_LOG";
    public static final String ENV_SIGNING_CURVE = "FATOORA_SIGNING_CURVE";
    public static final String ENV_CSID_RENEWAL_WINDOW_DAYS = "FATOORA_CSID_RENEWAL_WINDOW_DAYS";
    
    /**
     * Environment variable to config field mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;
    
    static {
        Map<String, String> map = new HashMap<>();
        map.put(ENV_ENVIRONMENT, "environment");
        map.put(ENV_BASE_URL, "baseUrl");
        map.put(ENV_COMPLIANCE_API_URL, "complianceApiUrl");
        map.put(ENV_COMPLIANCE_INVOICES_API_URL, "complianceInvoicesApiUrl");
        map.put(ENV_CLEARANCE_API_URL, "clearanceApiUrl");
        map.put(ENV_REPORTING_API_URL, "reportingApiUrl");
        map.put(ENV_PRODUCTION_CSID_API_URL, "productionCsidApiUrl");
        map.put(ENV_TIMEOUT, "timeout");
        map.put(ENV_RETRY_ATTEMPTS, "retryAttempts");
        map.put(ENV_RETRY_DELAY, "retryDelay");
        map.put(ENV_ENABLE_AUDIT_LOG, "enableAuditLog");
        map.put(ENV_SIGNING_CURVE, "signingCurve");
        map.put(ENV_CSID_RENEWAL_WINDOW_DAYS, "csidRenewalWindowDays");
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
    
    /**
     * Fatoora base URLs by environment
     */
    public static final Map<FatooraEnvironment, String> BASE_URLS;
    
    static {
        Map<FatooraEnvironment, String> map = new HashMap<>();
        map.put(FatooraEnvironment.SANDBOX, SANDBOX_URL);
        map.put(FatooraEnvironment.SIMULATION, SIMULATION_URL);
        map.put(FatooraEnvironment.PRODUCTION, PRODUCTION_URL);
        BASE_URLS = Collections.unmodifiableMap(map);
    }
    
    /**
     * Certificate template names requested in the CSR, by environment
     */
    public static final Map<FatooraEnvironment, String> CERTIFICATE_TEMPLATES;
    
    static {
        Map<FatooraEnvironment, String> map = new HashMap<>();
        map.put(FatooraEnvironment.SANDBOX, "TSTZATCA-Code-Signing");
        map.put(FatooraEnvironment.SIMULATION, "PREZATCA-Code-Signing");
        map.put(FatooraEnvironment.PRODUCTION, "ZATCA-Code-Signing");
        CERTIFICATE_TEMPLATES = Collections.unmodifiableMap(map);
    }
    
    /**
     * Get the base URL for a given environment
     * 
     * @param environment the Fatoora environment
     * @return the base URL
     */
    public static String getBaseUrl(FatooraEnvironment environment) {
        return BASE_URLS.getOrDefault(environment, SANDBOX_URL);
    }
    
    public static String getCertificateTemplate(FatooraEnvironment environment) {
        return CERTIFICATE_TEMPLATES.getOrDefault(environment, CERTIFICATE_TEMPLATES.get(FatooraEnvironment.SANDBOX));
    }
}
