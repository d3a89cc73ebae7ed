package com.zatca.fatoora.exception;

/**
 * Raised when the per-organization invoice chain cannot be advanced safely,
 * e.g. another writer moved the chain between read and write.
 */
public class ChainIntegrityException extends FatooraException {

    public static final String VERSION_CONFLICT = "CHAIN01";
    public static final String BROKEN_CHAIN = "CHAIN02";

    private final String organizationId;

    public ChainIntegrityException(String message, String code, String organizationId) {
        super(message, code);
        this.organizationId = organizationId;
    }

    public ChainIntegrityException(String message, String code, String organizationId, Throwable cause) {
        super(message, code, cause);
        this.organizationId = organizationId;
    }

    public String getOrganizationId() {
        return organizationId;
    }
}
