package com.olympus.api;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * A completed HTTP exchange with its body fully read.
 */
public record ApiResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public ApiResponse {
        headers = headers != null ? headers : Map.of();
        body = body != null ? body : new byte[0];
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    /** First value of a header (case-insensitive), or null. */
    public String header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
