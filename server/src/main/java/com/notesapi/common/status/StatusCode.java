package com.notesapi.common.status;

/**
 * The closed set of outcomes an operation can report. Every failure observed anywhere in the
 * server is mapped onto exactly one of these codes before it reaches the REST layer.
 */
public enum StatusCode {
    OK(200),                 // 200 OK
    INVALID_ARGUMENT(400),   // 400 Bad Request (malformed id, failed validation, undecodable document)
    NOT_FOUND(404),          // 404 Not Found
    ALREADY_EXISTS(409),     // 409 Conflict (unique field collision)
    INTERNAL(500),           // 500 Internal Server Error
    UNAVAILABLE(503);        // 503 Service Unavailable (database unreachable or timed out)

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
     * Returns whether this status code represents a successful operation.
     */
    public boolean isSuccess() {
        return this == OK;
    }

    /**
     * Returns whether this status code represents an error.
     */
    public boolean isError() {
        return !isSuccess();
    }
}
