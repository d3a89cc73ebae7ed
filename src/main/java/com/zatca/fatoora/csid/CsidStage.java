package com.zatca.fatoora.csid;

/**
 * Lifecycle stage of a CSID credential.
 */
public enum CsidStage {
    /** Issued against a CSR and OTP; valid only for compliance-phase test invoices */
    COMPLIANCE,
    /** Issued against a completed compliance request; valid for clearance and reporting */
    PRODUCTION
}
