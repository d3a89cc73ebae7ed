package com.zatca.fatoora.client;

import com.zatca.fatoora.config.FatooraConfig;
import com.zatca.fatoora.exception.NetworkException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Retry policy configuration for HTTP requests
 * 
 * <p>Configures how the HTTP client handles retries for failed requests.
 * Supports exponential backoff with configurable parameters. Retries always
 * resend the payload serialized for the first attempt; a retry never
 * rebuilds the invoice, its UUID or its hash.
 * 
 * <p>Example usage:
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(3)
 *     .baseDelay(1000)
 *     .maxDelay(16000)
 *     .retryableStatusCodes(Set.of(429, 500, 502, 503, 504))
 *     .build();
 * }</pre>
 */
public class RetryPolicy {
    
    private final int maxAttempts;
    private final long baseDelay; // milliseconds
    private final long maxDelay; // milliseconds
    private final Set<Integer> retryableStatusCodes;
    private final Predicate<Exception> retryablePredicate;
    private final boolean retryOnConnectionFailure;
    private final boolean retryOnTimeout;
    
    /**
     * Default retryable HTTP status codes. 4xx validation rejections are
     * never retried: they need corrected invoice data.
     */
    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(
        408, // Request Timeout
        429, // Too Many Requests
        500, // Internal Server Error
        502, // Bad Gateway
        503, // Service Unavailable
        504  // Gateway Timeout
    );
    
    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.retryableStatusCodes = builder.retryableStatusCodes;
        this.retryablePredicate = builder.retryablePredicate;
        this.retryOnConnectionFailure = builder.retryOnConnectionFailure;
        this.retryOnTimeout = builder.retryOnTimeout;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }
    
    /**
     * Derive a policy from the engine configuration:
     * {@code retryAttempts} retries on top of the initial attempt, starting
     * at {@code retryDelay} milliseconds
     */
    public static RetryPolicy fromConfig(FatooraConfig config) {
        return builder()
            .maxAttempts(config.getRetryAttempts() + 1)
            .baseDelay(config.getRetryDelay())
            .build();
    }
    
    public static RetryPolicy noRetry() {
        return builder()
            .maxAttempts(1)
            .build();
    }
    
    /**
     * Calculate delay for a given attempt using exponential backoff
     * 
     * @param attempt The current attempt number (0-based)
     * @return The delay in milliseconds
     */
    public long calculateDelay(int attempt) {
        long delay = (long) (baseDelay * Math.pow(2, attempt));
        return Math.min(delay, maxDelay);
    }
    
    public boolean isRetryableStatusCode(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }
    
    /**
     * Check if a transport failure is retryable
     * 
     * @param exception The exception to check
     * @return true if the exception is retryable
     */
    public boolean isRetryable(Exception exception) {
        if (retryablePredicate != null) {
            return retryablePredicate.test(exception);
        }
        
        if (exception instanceof NetworkException) {
            NetworkException networkException = (NetworkException) exception;
            if (!networkException.isRetryable()) {
                return false;
            }
            if (NetworkException.NetworkErrorCode.TIMEOUT.getCode().equals(networkException.getNetworkCode())) {
                return retryOnTimeout;
            }
            return retryOnConnectionFailure;
        }
        
        if (exception instanceof InterruptedIOException) {
            return retryOnTimeout;
        }
        
        if (exception instanceof ConnectException) {
            return retryOnConnectionFailure;
        }
        
        return retryOnConnectionFailure && exception instanceof IOException;
    }
    
    /**
     * Check if another retry attempt should be made
     * 
     * @param currentAttempt The current attempt number (0-based)
     * @return true if another attempt should be made
     */
    public boolean shouldRetry(int currentAttempt) {
        return currentAttempt < maxAttempts - 1;
    }
    
    // Getters
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    public long getBaseDelay() {
        return baseDelay;
    }
    
    public long getMaxDelay() {
        return maxDelay;
    }
    
    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }
    
    public boolean isRetryOnConnectionFailure() {
        return retryOnConnectionFailure;
    }
    
    public boolean isRetryOnTimeout() {
        return retryOnTimeout;
    }
    
    /**
     * Builder for RetryPolicy
     */
    public static class Builder {
        private int maxAttempts = 4; // 3 retries + 1 initial attempt
        private long baseDelay = 1000;
        private long maxDelay = 16000;
        private Set<Integer> retryableStatusCodes = DEFAULT_RETRYABLE_STATUS_CODES;
        private Predicate<Exception> retryablePredicate;
        private boolean retryOnConnectionFailure = true;
        private boolean retryOnTimeout = true;
        
        /**
         * @param maxAttempts Number of attempts including the first (1 = no retries)
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }
        
        public Builder baseDelay(long baseDelay) {
            if (baseDelay < 0) {
                throw new IllegalArgumentException("baseDelay must be non-negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder maxDelay(long maxDelay) {
            if (maxDelay < 0) {
                throw new IllegalArgumentException("maxDelay must be non-negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder retryableStatusCodes(Set<Integer> statusCodes) {
            this.retryableStatusCodes = statusCodes;
            return this;
        }
        
        /**
         * Replace the default exception classification
         */
        public Builder retryablePredicate(Predicate<Exception> predicate) {
            this.retryablePredicate = predicate;
            return this;
        }
        
        public Builder retryOnConnectionFailure(boolean retry) {
            this.retryOnConnectionFailure = retry;
            return this;
        }
        
        public Builder retryOnTimeout(boolean retry) {
            this.retryOnTimeout = retry;
            return this;
        }
        
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
