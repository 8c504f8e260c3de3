package com.olympus.api.exception;

/**
 * Classification of a failed API call, derived from the transport outcome or the HTTP status.
 */
public enum ApiErrorType {
    TIMEOUT("Connection timeout. Please check your internet connection."),
    NO_CONNECTION("Unable to connect to server. Please check your network."),
    BAD_REQUEST("The request was invalid."),
    UNAUTHORIZED("Authentication failed. Please login again."),
    FORBIDDEN("Access denied. You don't have permission for this action."),
    NOT_FOUND("Requested resource not found."),
    VALIDATION_ERROR("The request failed validation."),
    SERVER_ERROR("Server error. Please try again later."),
    CANCELLED("Request was cancelled."),
    UNKNOWN("An unexpected error occurred.");

    private final String defaultMessage;

    ApiErrorType(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Map a non-2xx HTTP status code to an error type.
     */
    public static ApiErrorType fromStatus(int statusCode) {
        return switch (statusCode) {
            case 400 -> BAD_REQUEST;
            case 401 -> UNAUTHORIZED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 422 -> VALIDATION_ERROR;
            default -> statusCode >= 500 ? SERVER_ERROR : UNKNOWN;
        };
    }
}
