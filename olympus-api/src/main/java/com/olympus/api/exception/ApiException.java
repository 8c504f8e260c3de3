package com.olympus.api.exception;

/**
 * A failed API call. Carries the error type and, for server-returned errors,
 * the HTTP status code and raw response body.
 */
public class ApiException extends Exception {

    private final ApiErrorType type;
    private final Integer statusCode;
    private final String responseBody;

    public ApiException(ApiErrorType type, String message) {
        this(type, message, null, null, null);
    }

    public ApiException(ApiErrorType type, String message, Throwable cause) {
        this(type, message, null, null, cause);
    }

    public ApiException(ApiErrorType type, String message, Integer statusCode, String responseBody) {
        this(type, message, statusCode, responseBody, null);
    }

    public ApiException(ApiErrorType type, String message, Integer statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public ApiErrorType getType() {
        return type;
    }

    /** HTTP status code, or null for transport-level failures. */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    @Override
    public String toString() {
        return "ApiException: " + getMessage() + " (" + type + (statusCode != null ? ", " + statusCode : "") + ")";
    }
}
