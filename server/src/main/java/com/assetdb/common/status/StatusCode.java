package com.assetdb.common.status;

/**
 * Status codes shared by the access engine and the request handlers that consume it. Each code
 * carries the HTTP status a handler should answer with.
 */
public enum StatusCode {
    OK(200),
    CANCELLED(499),          // owning request went away
    INVALID_ARGUMENT(400),
    NOT_FOUND(404),
    PERMISSION_DENIED(403),  // Forbidden
    FAILED_PRECONDITION(500),// broken configuration, e.g. a malformed access group record
    INTERNAL(500),
    UNAVAILABLE(503);        // retryable: pool exhausted, timeout, connection lost

    private final int httpCode;

    StatusCode(int httpCode) {
        this.httpCode = httpCode;
    }

    /**
     * Returns the corresponding HTTP status code.
     */
    public int getHttpCode() {
        return httpCode;
    }

    /**
     * Returns whether a client may retry the operation that produced this code.
     */
    public boolean isRetryable() {
        return this == UNAVAILABLE;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return this != OK;
    }
}
