package com.zatca.fatoora.csid;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * Immutable CSID credential pair as issued by the platform.
 *
 * <p>The {@code csid} is the binary security token; together with the
 * {@code secret} it forms the Basic credentials for authenticated calls.
 * A credential without {@code expiresAt} never reports itself expired.
 */
public final class CsidCredential {

    private final CsidStage stage;
    private final String requestId;
    private final String csid;
    private final String secret;
    private final Instant expiresAt;

    public CsidCredential(CsidStage stage, String requestId, String csid, String secret, Instant expiresAt) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.requestId = requestId;
        this.csid = Objects.requireNonNull(csid, "csid");
        this.secret = Objects.requireNonNull(secret, "secret");
        this.expiresAt = expiresAt;
    }

    public CsidStage getStage() { return stage; }
    public String getRequestId() { return requestId; }
    public String getCsid() { return csid; }
    public String getSecret() { return secret; }
    public Instant getExpiresAt() { return expiresAt; }

    public boolean isExpired(Clock clock) {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    /**
     * True if the credential expires within {@code days} days from now,
     * or already has.
     */
    public boolean expiresWithin(int days, Clock clock) {
        return expiresAt != null && !clock.instant().plus(Duration.ofDays(days)).isBefore(expiresAt);
    }

    /**
     * @return {@code Basic base64(csid:secret)}
     */
    public String basicAuthHeader() {
        return basicAuthHeader(csid, secret);
    }

    public static String basicAuthHeader(String csid, String secret) {
        String token = csid + ":" + secret;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CsidCredential that = (CsidCredential) o;
        return stage == that.stage
            && Objects.equals(requestId, that.requestId)
            && csid.equals(that.csid)
            && secret.equals(that.secret)
            && Objects.equals(expiresAt, that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, requestId, csid, secret, expiresAt);
    }

    @Override
    public String toString() {
        return "CsidCredential{stage=" + stage + ", requestId='" + requestId
            + "', secret=[REDACTED], expiresAt=" + expiresAt + '}';
    }
}
