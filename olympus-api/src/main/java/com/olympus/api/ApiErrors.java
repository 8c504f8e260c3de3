package com.olympus.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olympus.api.exception.ApiErrorType;
import com.olympus.api.exception.ApiException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * Turns transport failures and error responses into {@link ApiException}s.
 */
final class ApiErrors {

    private static final String[] MESSAGE_FIELDS = {"error", "message", "detail", "error_description"};

    private ApiErrors() {
    }

    static ApiException fromResponse(ApiResponse response, ObjectMapper mapper) {
        ApiErrorType type = ApiErrorType.fromStatus(response.statusCode());
        String body = response.bodyAsString();
        String message = extractMessage(body, mapper);
        return new ApiException(type, message != null ? message : type.getDefaultMessage(),
            response.statusCode(), body);
    }

    static ApiException fromIOException(IOException e, boolean cancelled) {
        ApiErrorType type;
        if (cancelled) {
            type = ApiErrorType.CANCELLED;
        } else if (e instanceof SocketTimeoutException || e instanceof InterruptedIOException) {
            type = ApiErrorType.TIMEOUT;
        } else if (e instanceof ConnectException || e instanceof UnknownHostException
                || e instanceof NoRouteToHostException || e instanceof SocketException) {
            type = ApiErrorType.NO_CONNECTION;
        } else {
            type = ApiErrorType.UNKNOWN;
        }
        return new ApiException(type, type.getDefaultMessage(), e);
    }

    /**
     * Pull a human-readable message out of an error body: a JSON object's
     * error/message/detail/error_description field, or the body itself if it is plain text.
     */
    static String extractMessage(String body, ObjectMapper mapper) {
        if (body == null || body.isBlank()) {
            return null;
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return trimmed.startsWith("[") || trimmed.startsWith("<") ? null : trimmed;
        }
        try {
            JsonNode node = mapper.readTree(trimmed);
            for (String field : MESSAGE_FIELDS) {
                JsonNode value = node.get(field);
                if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                    return value.asText();
                }
            }
        } catch (IOException e) {
            return null;
        }
        return null;
    }
}
