package com.zatca.fatoora.client;

import java.time.Instant;
import java.util.Map;

/**
 * One attempt of a regulator call, as handed to the audit callback.
 * Credential headers and body fields are already redacted.
 */
public final class HttpAuditEntry {

    private final Instant timestamp;
    private final String requestId;
    private final String method;
    private final String url;
    private final int attempt;
    private final Map<String, String> headers;
    private final Object body;
    private final Integer responseStatus;
    private final long durationMillis;
    private final String error;

    HttpAuditEntry(Instant timestamp, String requestId, String method, String url, int attempt,
                   Map<String, String> headers, Object body, Integer responseStatus,
                   long durationMillis, String error) {
        this.timestamp = timestamp;
        this.requestId = requestId;
        this.method = method;
        this.url = url;
        this.attempt = attempt;
        this.headers = headers;
        this.body = body;
        this.responseStatus = responseStatus;
        this.durationMillis = durationMillis;
        this.error = error;
    }

    public Instant getTimestamp() { return timestamp; }
    public String getRequestId() { return requestId; }
    public String getMethod() { return method; }
    public String getUrl() { return url; }
    public int getAttempt() { return attempt; }
    public Map<String, String> getHeaders() { return headers; }
    public Object getBody() { return body; }
    public Integer getResponseStatus() { return responseStatus; }
    public long getDurationMillis() { return durationMillis; }
    public String getError() { return error; }

    /** A response below 400 arrived */
    public boolean isSuccess() {
        return error == null && responseStatus != null && responseStatus < 400;
    }

    @Override
    public String toString() {
        return method + " " + url + " #" + attempt + " -> "
            + (responseStatus != null ? responseStatus : error) + " (" + durationMillis + "ms)";
    }
}
