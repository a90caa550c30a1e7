package com.delta.adinsights.search.provider;

/**
 * A failed provider exchange. {@code statusCode} is {@code null} when no HTTP status was
 * received (timeouts, I/O failures) or when a successful response could not be decoded.
 */
public class ProviderException extends RuntimeException {
    private final Integer statusCode;

    public ProviderException(Integer statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
