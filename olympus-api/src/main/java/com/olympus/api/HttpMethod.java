package com.olympus.api;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    public boolean requiresBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
