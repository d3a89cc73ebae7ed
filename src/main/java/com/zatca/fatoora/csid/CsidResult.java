package com.zatca.fatoora.csid;

import com.zatca.fatoora.client.ApiError;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a CSID operation: a credential on success, error entries
 * otherwise. Never both.
 */
public final class CsidResult {

    private final boolean success;
    private final CsidCredential credential;
    private final String dispositionMessage;
    private final boolean renewed;
    private final List<ApiError> errors;

    private CsidResult(boolean success, CsidCredential credential, String dispositionMessage,
                       boolean renewed, List<ApiError> errors) {
        this.success = success;
        this.credential = credential;
        this.dispositionMessage = dispositionMessage;
        this.renewed = renewed;
        this.errors = errors;
    }

    public static CsidResult success(CsidCredential credential, String dispositionMessage) {
        return new CsidResult(true, credential, dispositionMessage, true, Collections.emptyList());
    }

    /**
     * Success without a call: the existing credential is still valid.
     */
    public static CsidResult unchanged(CsidCredential credential) {
        return new CsidResult(true, credential, null, false, Collections.emptyList());
    }

    public static CsidResult failure(List<ApiError> errors) {
        return new CsidResult(false, null, null, false, List.copyOf(errors));
    }

    public static CsidResult failure(ApiError error) {
        return failure(List.of(error));
    }

    public boolean isSuccess() { return success; }
    public CsidCredential getCredential() { return credential; }
    public String getDispositionMessage() { return dispositionMessage; }
    public List<ApiError> getErrors() { return errors; }

    /**
     * False when {@code renewIfExpiring} returned the existing credential.
     */
    public boolean isRenewed() { return renewed; }

    @Override
    public String toString() {
        return success
            ? "CsidResult{success=true, credential=" + credential + '}'
            : "CsidResult{success=false, errors=" + errors + '}';
    }
}
