package com.zatca.fatoora.exception;

/**
 * Network exception for HTTP transport layer failures
 * 
 * <p>Represents failures where no usable HTTP response was received
 * (DNS, timeout, connection refused, TLS). Protocol clients catch it at
 * their boundary and turn it into a {@code NETWORK} result entry.
 */
public class NetworkException extends FatooraException {
    
    /**
     * Network error codes
     */
    public enum NetworkErrorCode {
        TIMEOUT("NET01", "Request timed out"),
        CONNECTION_REFUSED("NET02", "Connection refused"),
        DNS_LOOKUP_FAILED("NET03", "DNS lookup failed"),
        SSL_ERROR("NET04", "SSL/TLS error"),
        CIRCUIT_BREAKER_OPEN("NET05", "Circuit breaker is open"),
        NO_RESPONSE("NET06", "No response received"),
        REQUEST_ABORTED("NET07", "Request was aborted"),
        UNKNOWN("NET10", "Unknown network error");
        
        private final String code;
        private final String defaultMessage;
        
        NetworkErrorCode(String code, String defaultMessage) {
            this.code = code;
            this.defaultMessage = defaultMessage;
        }
        
        public String getCode() {
            return code;
        }
        
        public String getDefaultMessage() {
            return defaultMessage;
        }
    }
    
    private final String networkCode;
    private final boolean retryable;
    
    public NetworkException(String message) {
        this(message, null, NetworkErrorCode.UNKNOWN.getCode(), true);
    }
    
    /**
     * Create a network exception with full details
     * 
     * @param message Error message
     * @param statusCode HTTP status code, if any
     * @param networkCode Network error code
     * @param retryable Whether the error is retryable
     */
    public NetworkException(String message, Integer statusCode, String networkCode, boolean retryable) {
        this(message, statusCode, networkCode, retryable, null);
    }
    
    public NetworkException(String message, Integer statusCode, String networkCode, boolean retryable,
                            Throwable cause) {
        super(message, networkCode, statusCode, cause);
        this.networkCode = networkCode;
        this.retryable = retryable;
    }
    
    public String getNetworkCode() {
        return networkCode;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
    
    public static NetworkException timeout(String message, Throwable cause) {
        return new NetworkException(
            message != null ? message : NetworkErrorCode.TIMEOUT.getDefaultMessage(),
            null,
            NetworkErrorCode.TIMEOUT.getCode(),
            true,
            cause
        );
    }
    
    public static NetworkException connectionRefused(String message, Throwable cause) {
        return new NetworkException(
            message != null ? message : NetworkErrorCode.CONNECTION_REFUSED.getDefaultMessage(),
            null,
            NetworkErrorCode.CONNECTION_REFUSED.getCode(),
            true,
            cause
        );
    }
    
    /**
     * Create a circuit breaker open error
     * 
     * @param retryAfterSeconds Seconds until retry is allowed
     * @return NetworkException for circuit breaker open
     */
    public static NetworkException circuitBreakerOpen(int retryAfterSeconds) {
        return new NetworkException(
            String.format("Circuit breaker is open. Retry after %d seconds", retryAfterSeconds),
            503,
            NetworkErrorCode.CIRCUIT_BREAKER_OPEN.getCode(),
            false
        );
    }
    
    public static NetworkException sslError(String message, Throwable cause) {
        return new NetworkException(
            message != null ? message : NetworkErrorCode.SSL_ERROR.getDefaultMessage(),
            null,
            NetworkErrorCode.SSL_ERROR.getCode(),
            false,
            cause
        );
    }
    
    /**
     * Create a DNS lookup failed error
     * 
     * @param hostname The hostname that failed to resolve
     * @param cause underlying failure
     * @return NetworkException for DNS lookup failure
     */
    public static NetworkException dnsLookupFailed(String hostname, Throwable cause) {
        return new NetworkException(
            String.format("DNS lookup failed for host: %s", hostname),
            null,
            NetworkErrorCode.DNS_LOOKUP_FAILED.getCode(),
            true,
            cause
        );
    }
    
    public static NetworkException unknown(String message, Throwable cause) {
        return new NetworkException(
            message != null ? message : NetworkErrorCode.UNKNOWN.getDefaultMessage(),
            null,
            NetworkErrorCode.UNKNOWN.getCode(),
            true,
            cause
        );
    }
}
