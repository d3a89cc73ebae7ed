package com.zatca.fatoora.csid;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the compliance CSID request, also used for production renewal.
 */
public final class ComplianceCsidRequest {

    private final String csr;

    public ComplianceCsidRequest(String csr) {
        this.csr = csr;
    }

    @JsonProperty("csr")
    public String getCsr() {
        return csr;
    }
}
