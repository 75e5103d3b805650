package com.policysonar.errors;

/**
 * ExternalServiceException - an analysis or indicator service call failed
 * (non-2xx status, malformed payload, I/O error or timeout).
 * Never retried inside the engine.
 */
public class ExternalServiceException extends Exception {

    private final int statusCode;

    public ExternalServiceException(String message) {
        this(message, -1, null);
    }

    public ExternalServiceException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ExternalServiceException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the failed call, or -1 when the call never produced a response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
