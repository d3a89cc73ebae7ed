package com.zatca.fatoora.csid;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful CSID issuance response
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CsidResponse {

    @JsonProperty("requestID")
    private String requestId;

    @JsonProperty("binarySecurityToken")
    private String binarySecurityToken;

    @JsonProperty("secret")
    private String secret;

    @JsonProperty("tokenExpiry")
    @JsonAlias("expiresAt")
    private String tokenExpiry;

    @JsonProperty("dispositionMessage")
    private String dispositionMessage;

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getBinarySecurityToken() { return binarySecurityToken; }
    public void setBinarySecurityToken(String binarySecurityToken) { this.binarySecurityToken = binarySecurityToken; }

    public String getSecret() { return secret; }
    public void setSecret(String secret) { this.secret = secret; }

    public String getTokenExpiry() { return tokenExpiry; }
    public void setTokenExpiry(String tokenExpiry) { this.tokenExpiry = tokenExpiry; }

    public String getDispositionMessage() { return dispositionMessage; }
    public void setDispositionMessage(String dispositionMessage) { this.dispositionMessage = dispositionMessage; }
}
