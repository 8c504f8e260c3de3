package com.olympus.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One logical API call: method, path relative to the base URL, query, body and extra headers.
 * The body is serialized as JSON unless it is already an OkHttp request body.
 */
public record ApiRequest(
    HttpMethod method,
    String path,
    Map<String, String> query,
    Object body,
    Map<String, String> headers
) {
    public ApiRequest {
        query = query != null ? Collections.unmodifiableMap(new LinkedHashMap<>(query)) : Map.of();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    public static Builder get(String path) { return builder(HttpMethod.GET, path); }
    public static Builder post(String path) { return builder(HttpMethod.POST, path); }
    public static Builder put(String path) { return builder(HttpMethod.PUT, path); }
    public static Builder patch(String path) { return builder(HttpMethod.PATCH, path); }
    public static Builder delete(String path) { return builder(HttpMethod.DELETE, path); }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder().method(method).path(path);
    }

    public static class Builder {
        private HttpMethod method = HttpMethod.GET;
        private String path;
        private final Map<String, String> query = new LinkedHashMap<>();
        private Object body;
        private final Map<String, String> headers = new LinkedHashMap<>();

        public Builder method(HttpMethod method) { this.method = method; return this; }
        public Builder path(String path) { this.path = path; return this; }
        public Builder query(String name, Object value) {
            if (value != null) query.put(name, String.valueOf(value));
            return this;
        }
        public Builder query(Map<String, ?> params) {
            if (params != null) params.forEach(this::query);
            return this;
        }
        public Builder body(Object body) { this.body = body; return this; }
        public Builder header(String name, String value) { headers.put(name, value); return this; }

        public ApiRequest build() {
            if (method == null) throw new IllegalArgumentException("method is required");
            if (path == null || path.isEmpty()) throw new IllegalArgumentException("path is required");
            return new ApiRequest(method, path, query, body, headers);
        }
    }
}
