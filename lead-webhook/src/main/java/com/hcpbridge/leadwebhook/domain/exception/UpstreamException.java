package com.hcpbridge.leadwebhook.domain.exception;

/**
 * A call to the customer platform failed. {@code statusCode} is the HTTP status returned by the platform,
 * or {@code 0} when no response was received.
 */
public class UpstreamException extends RuntimeException {

    private final int statusCode;

    public UpstreamException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
