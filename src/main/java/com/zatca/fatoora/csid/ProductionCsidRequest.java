package com.zatca.fatoora.csid;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the production CSID request
 */
public final class ProductionCsidRequest {

    private final String complianceRequestId;

    public ProductionCsidRequest(String complianceRequestId) {
        this.complianceRequestId = complianceRequestId;
    }

    @JsonProperty("complianceRequestId")
    public String getComplianceRequestId() {
        return complianceRequestId;
    }
}
