package com.zatca.fatoora.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.exception.FatooraException;
import com.zatca.fatoora.exception.NetworkException;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * JSON-over-HTTPS transport shared by the CSID and submission clients.
 *
 * <p>Every call carries {@code Accept-Version: V2} and a fresh
 * {@code X-Request-ID}. The body is serialized once and the same bytes are
 * resent on each retry. Once retries are spent, a non-2xx response is handed
 * back as is so the caller can read the regulator's {@code validationResults};
 * only a call that got no response at all throws {@link NetworkException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClient client = new HttpClient(config);
 * HttpResponse<JsonNode> response = client.post(config.getClearanceApiUrl(), body,
 *     Map.of("Authorization", credential.basicAuthHeader(), "Clearance-Status", "1"));
 * }</pre>
 */
public class HttpClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HttpClient.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final Set<String> METHODS = Set.of("POST", "PATCH");
    private static final String REDACTED = "[REDACTED]";

    public static final String ACCEPT_VERSION = "V2";

    /** Matched case-insensitively as substrings of header names and body keys */
    private static final List<String> SECRET_KEYS = List.of(
        "authorization", "otp", "secret", "csr", "privatekey", "private_key",
        "password", "binarysecuritytoken", "certificate"
    );

    private final FatooraConfig config;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private volatile Consumer<HttpAuditEntry> auditLogCallback;

    /**
     * Final response of a call. {@code data} is null when the body was empty,
     * or when a non-2xx body was not JSON.
     */
    public static class HttpResponse<T> {
        private final T data;
        private final String rawBody;
        private final int status;
        private final String requestId;

        public HttpResponse(T data, String rawBody, int status, String requestId) {
            this.data = data;
            this.rawBody = rawBody;
            this.status = status;
            this.requestId = requestId;
        }

        public T getData() { return data; }
        public String getRawBody() { return rawBody; }
        public int getStatus() { return status; }
        public String getRequestId() { return requestId; }

        public boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }

    public HttpClient(FatooraConfig config) {
        this(config, RetryPolicy.fromConfig(config), CircuitBreaker.withDefaults());
    }

    public HttpClient(FatooraConfig config, RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
        this.config = Objects.requireNonNull(config, "Config must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "Retry policy must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "Circuit breaker must not be null");

        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Duration timeout = Duration.ofMillis(config.getTimeout());
        this.okHttpClient = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .addInterceptor(HttpClient::withProtocolHeaders)
            .retryOnConnectionFailure(false)
            .build();
    }

    private static Response withProtocolHeaders(Interceptor.Chain chain) throws IOException {
        Request request = chain.request();
        Request.Builder builder = request.newBuilder()
            .header("Accept", "application/json")
            .header("Accept-Version", ACCEPT_VERSION);
        if (request.header("Content-Type") == null) {
            builder.header("Content-Type", "application/json");
        }
        return chain.proceed(builder.build());
    }

    /**
     * Receive one entry per attempt. Nothing is produced unless
     * {@code enableAuditLog} is set.
     */
    public void setAuditLogCallback(Consumer<HttpAuditEntry> callback) {
        this.auditLogCallback = callback;
    }

    public HttpResponse<JsonNode> post(String url, Object body, Map<String, String> headers) {
        return execute("POST", url, body, headers, JsonNode.class);
    }

    public <T> HttpResponse<T> patch(String url, Object body, Map<String, String> headers, Class<T> responseType) {
        return execute("PATCH", url, body, headers, responseType);
    }

    /**
     * Send a JSON request, retrying per the {@link RetryPolicy}.
     *
     * @param method {@code POST} or {@code PATCH}
     * @return the last response received, successful or not
     * @throws NetworkException if no response was received or the circuit is open
     * @throws FatooraException if the body cannot be serialized or a 2xx body is not valid JSON
     */
    public <T> HttpResponse<T> execute(String method, String url, Object body,
                                       Map<String, String> headers, Class<T> responseType) {
        String verb = method.toUpperCase();
        if (!METHODS.contains(verb)) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
        circuitBreaker.acquirePermission();

        Map<String, String> callHeaders = headers != null ? headers : Collections.emptyMap();
        String payload = body != null ? serialize(body) : "";
        int maxAttempts = retryPolicy.getMaxAttempts();

        for (int attempt = 0; ; attempt++) {
            String requestId = newRequestId();
            long started = System.currentTimeMillis();

            Request.Builder request = new Request.Builder()
                .url(url)
                .header("X-Request-ID", requestId)
                .method(verb, RequestBody.create(payload, JSON));
            callHeaders.forEach(request::header);

            int status;
            String rawBody;
            try (Response response = okHttpClient.newCall(request.build()).execute()) {
                status = response.code();
                ResponseBody responseBody = response.body();
                rawBody = responseBody != null ? responseBody.string() : "";
            } catch (IOException e) {
                NetworkException failure = classify(e, url);
                circuitBreaker.recordFailure();
                audit(verb, url, callHeaders, body, requestId, started, attempt, null, failure.getMessage());
                if (retryPolicy.shouldRetry(attempt) && retryPolicy.isRetryable(failure)) {
                    pause(attempt, maxAttempts, failure.getMessage());
                    continue;
                }
                throw failure;
            }

            audit(verb, url, callHeaders, body, requestId, started, attempt, status, null);
            if (status >= 500) {
                circuitBreaker.recordFailure();
            } else {
                circuitBreaker.recordSuccess();
            }

            if (retryPolicy.isRetryableStatusCode(status) && retryPolicy.shouldRetry(attempt)) {
                pause(attempt, maxAttempts, "HTTP " + status);
                continue;
            }
            return new HttpResponse<>(parse(rawBody, status, responseType), rawBody, status, requestId);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        okHttpClient.dispatcher().executorService().shutdown();
        okHttpClient.connectionPool().evictAll();
    }

    private static String newRequestId() {
        return "fatoora-" + Long.toHexString(System.currentTimeMillis()) + "-"
            + UUID.randomUUID().toString().substring(0, 8);
    }

    private String serialize(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new FatooraException("Failed to serialize request body", "SERIALIZATION_ERROR", e);
        }
    }

    private <T> T parse(String rawBody, int status, Class<T> responseType) {
        if (rawBody == null || rawBody.isEmpty()) {
            return null;
        }
        try {
            if (responseType == String.class) {
                return responseType.cast(rawBody);
            }
            return objectMapper.readValue(rawBody, responseType);
        } catch (JsonProcessingException e) {
            if (status >= 200 && status < 300) {
                throw new FatooraException("Invalid JSON in response body", "INVALID_RESPONSE", status, e);
            }
            // Gateways answer 5xx with HTML; the raw body is still returned
            logger.debug("Non-JSON body on HTTP {} response: {}", status, e.getOriginalMessage());
            return null;
        }
    }

    private static NetworkException classify(IOException e, String url) {
        if (e instanceof UnknownHostException) {
            return NetworkException.dnsLookupFailed(e.getMessage() != null ? e.getMessage() : url, e);
        }
        if (e instanceof ConnectException) {
            return NetworkException.connectionRefused("Connection refused: " + url, e);
        }
        if (e instanceof SSLException) {
            return NetworkException.sslError("TLS handshake failed: " + e.getMessage(), e);
        }
        if (e instanceof InterruptedIOException) {
            return NetworkException.timeout("Request timed out: " + url, e);
        }
        return NetworkException.unknown("Network error: " + e.getMessage(), e);
    }

    private void pause(int attempt, int maxAttempts, String reason) {
        long delay = retryPolicy.calculateDelay(attempt);
        logger.warn("Attempt {}/{} failed ({}), retrying in {}ms", attempt + 1, maxAttempts, reason, delay);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Retry interrupted", null,
                NetworkException.NetworkErrorCode.REQUEST_ABORTED.getCode(), false, ie);
        }
    }

    private void audit(String method, String url, Map<String, String> headers, Object body, String requestId,
                       long started, int attempt, Integer status, String error) {
        Consumer<HttpAuditEntry> callback = auditLogCallback;
        if (!config.isEnableAuditLog() || callback == null) {
            return;
        }
        Map<String, String> safeHeaders = new LinkedHashMap<>();
        headers.forEach((name, value) -> safeHeaders.put(name, isSecret(name) ? REDACTED : value));
        Object safeBody = body != null ? redact(objectMapper.convertValue(body, Object.class)) : null;

        callback.accept(new HttpAuditEntry(Instant.now(), requestId, method, url, attempt, safeHeaders, safeBody,
            status, System.currentTimeMillis() - started, error));
    }

    private static boolean isSecret(String key) {
        String lower = key.toLowerCase();
        return SECRET_KEYS.stream().anyMatch(lower::contains);
    }

    /** Copy of a JSON tree (maps and lists) with secret keys masked at any depth */
    private static Object redact(Object node) {
        if (node instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> field : ((Map<?, ?>) node).entrySet()) {
                String key = String.valueOf(field.getKey());
                copy.put(key, isSecret(key) ? REDACTED : redact(field.getValue()));
            }
            return copy;
        }
        if (node instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) node) {
                copy.add(redact(item));
            }
            return copy;
        }
        return node;
    }
}
