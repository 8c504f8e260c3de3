package com.olympus.api;

import okhttp3.Interceptor;
import okhttp3.MultipartBody;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs each HTTP exchange at DEBUG. Bodies are logged only when enabled;
 * the Authorization header is never logged.
 */
class RequestLogInterceptor implements Interceptor {
    private static final Logger LOG = LoggerFactory.getLogger(RequestLogInterceptor.class);
    private static final long MAX_LOGGED_BODY = 16 * 1024;

    private final boolean logBodies;

    RequestLogInterceptor(boolean logBodies) {
        this.logBodies = logBodies;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        if (!LOG.isDebugEnabled()) {
            return chain.proceed(request);
        }

        boolean authenticated = request.header("Authorization") != null;
        if (logBodies && request.body() != null && !(request.body() instanceof MultipartBody)
                && !request.body().isOneShot()) {
            LOG.debug("--> {} {} (auth={}) {}", request.method(), request.url(), authenticated, requestBody(request));
        } else {
            LOG.debug("--> {} {} (auth={})", request.method(), request.url(), authenticated);
        }

        long start = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            LOG.debug("<-- FAILED {} {}: {}", request.method(), request.url(), e.toString());
            throw e;
        }
        long tookMs = (System.nanoTime() - start) / 1_000_000;

        if (logBodies) {
            LOG.debug("<-- {} {} ({}ms) {}", response.code(), request.url(), tookMs,
                response.peekBody(MAX_LOGGED_BODY).string());
        } else {
            LOG.debug("<-- {} {} ({}ms)", response.code(), request.url(), tookMs);
        }
        return response;
    }

    private static String requestBody(Request request) throws IOException {
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        if (buffer.size() > MAX_LOGGED_BODY) {
            return buffer.readString(MAX_LOGGED_BODY, StandardCharsets.UTF_8) + "...";
        }
        return buffer.readString(StandardCharsets.UTF_8);
    }
}
