package com.olympus.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olympus.api.exception.ApiErrorType;
import com.olympus.api.exception.ApiException;
import com.olympus.core.auth.CredentialStore;
import com.olympus.core.config.ClientConfig;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Authenticated HTTP client for the Olympus API.
 *
 * Every call carries the stored access token as a bearer token. A 401 response triggers a
 * single-flight token refresh ({@link TokenRefresher}) followed by exactly one retry of the
 * original call. Every other failure is classified and thrown as an {@link ApiException}
 * without retry.
 */
public class ApiClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ApiClient.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int UNAUTHORIZED = 401;

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final CredentialStore credentials;
    private final TokenRefresher tokenRefresher;
    private final ExecutorService asyncExecutor;

    public ApiClient(ClientConfig.ApiConfig config, CredentialStore credentials) {
        this(config, credentials, new ObjectMapper());
    }

    public ApiClient(ClientConfig.ApiConfig config, CredentialStore credentials, ObjectMapper mapper) {
        this.baseUrl = stripTrailingSlash(config.getBaseUrl());
        this.credentials = credentials;
        this.mapper = mapper;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(config.getConnectTimeoutMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(config.getReadTimeoutMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(config.getWriteTimeoutMillis(), TimeUnit.MILLISECONDS)
            .addInterceptor(new RequestLogInterceptor(config.isLogBodies()))
            .build();
        this.tokenRefresher = new TokenRefresher(httpClient, resolve(config.getRefreshPath(), Map.of()),
            mapper, credentials);

        AtomicInteger threadCount = new AtomicInteger();
        this.asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ApiClient-Async-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Verb helpers ====================

    public ApiResponse get(String path) throws ApiException {
        return execute(ApiRequest.get(path).build());
    }

    public ApiResponse get(String path, Map<String, ?> query) throws ApiException {
        return execute(ApiRequest.get(path).query(query).build());
    }

    public ApiResponse post(String path, Object body) throws ApiException {
        return execute(ApiRequest.post(path).body(body).build());
    }

    public ApiResponse post(String path, Object body, Map<String, ?> query) throws ApiException {
        return execute(ApiRequest.post(path).query(query).body(body).build());
    }

    public ApiResponse put(String path, Object body) throws ApiException {
        return execute(ApiRequest.put(path).body(body).build());
    }

    public ApiResponse put(String path, Object body, Map<String, ?> query) throws ApiException {
        return execute(ApiRequest.put(path).query(query).body(body).build());
    }

    public ApiResponse patch(String path, Object body) throws ApiException {
        return execute(ApiRequest.patch(path).body(body).build());
    }

    public ApiResponse patch(String path, Object body, Map<String, ?> query) throws ApiException {
        return execute(ApiRequest.patch(path).query(query).body(body).build());
    }

    public ApiResponse delete(String path) throws ApiException {
        return execute(ApiRequest.delete(path).build());
    }

    public ApiResponse delete(String path, Map<String, ?> query) throws ApiException {
        return execute(ApiRequest.delete(path).query(query).build());
    }

    // ==================== Execution ====================

    /**
     * Execute a request, refreshing the access token and retrying once on 401.
     *
     * @throws com.olympus.api.exception.SessionExpiredException if the token refresh failed
     * @throws ApiException for every other failure, including a failed retry
     */
    public ApiResponse execute(ApiRequest request) throws ApiException {
        String token = credentials.getAccessToken();
        ApiResponse response = send(request, token);
        if (response.statusCode() != UNAUTHORIZED) {
            return requireSuccess(response);
        }

        LOG.debug("{} {} rejected with 401, refreshing access token", request.method(), request.path());
        String refreshedToken = tokenRefresher.refresh(token);

        // One retry only: a second 401 is surfaced as-is
        return requireSuccess(send(request, refreshedToken));
    }

    /**
     * Execute a request and decode its JSON body.
     */
    public <T> T execute(ApiRequest request, Class<T> responseType) throws ApiException {
        ApiResponse response = execute(request);
        try {
            return mapper.readValue(response.body(), responseType);
        } catch (IOException e) {
            throw new ApiException(ApiErrorType.UNKNOWN,
                "Failed to decode " + responseType.getSimpleName() + " response", response.statusCode(),
                response.bodyAsString(), e);
        }
    }

    /**
     * Execute a request on a background thread. The future fails with a
     * {@link CompletionException} wrapping the {@link ApiException}.
     */
    public CompletableFuture<ApiResponse> executeAsync(ApiRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return execute(request);
            } catch (ApiException e) {
                throw new CompletionException(e);
            }
        }, asyncExecutor);
    }

    // ==================== Files ====================

    /**
     * Upload a file as multipart/form-data, with optional extra form fields.
     */
    public ApiResponse uploadFile(String path, Path file, String fieldName, Map<String, String> fields)
            throws ApiException {
        if (!Files.isRegularFile(file)) {
            throw new ApiException(ApiErrorType.BAD_REQUEST, "Not a file: " + file);
        }
        String contentType = URLConnection.guessContentTypeFromName(file.getFileName().toString());
        MediaType mediaType = MediaType.parse(contentType != null ? contentType : "application/octet-stream");

        MultipartBody.Builder multipart = new MultipartBody.Builder().setType(MultipartBody.FORM);
        if (fields != null) {
            fields.forEach(multipart::addFormDataPart);
        }
        multipart.addFormDataPart(fieldName != null ? fieldName : "file", file.getFileName().toString(),
            RequestBody.create(file.toFile(), mediaType));

        return execute(ApiRequest.post(path).body(multipart.build()).build());
    }

    /**
     * Download a resource to a local file, replacing it if present.
     */
    public Path downloadFile(String path, Path target) throws ApiException {
        ApiResponse response = execute(ApiRequest.get(path).build());
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, response.body());
            LOG.debug("Downloaded {} bytes to {}", response.body().length, target);
            return target;
        } catch (IOException e) {
            throw new ApiException(ApiErrorType.UNKNOWN, "Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Cancel every call in flight. Cancelled calls fail with {@link ApiErrorType#CANCELLED}.
     */
    public void cancelAll() {
        httpClient.dispatcher().cancelAll();
    }

    @Override
    public void close() {
        asyncExecutor.shutdownNow();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    public TokenRefresher getTokenRefresher() {
        return tokenRefresher;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    // ==================== Internals ====================

    private ApiResponse send(ApiRequest request, String accessToken) throws ApiException {
        Request.Builder builder = new Request.Builder()
            .url(resolve(request.path(), request.query()))
            .header("Accept", "application/json");
        request.headers().forEach(builder::header);
        if (accessToken != null && !accessToken.isEmpty()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        builder.method(request.method().name(), toRequestBody(request));

        Call call = httpClient.newCall(builder.build());
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            return new ApiResponse(response.code(), response.headers().toMultimap(),
                body != null ? body.bytes() : new byte[0]);
        } catch (IOException e) {
            LOG.debug("{} {} failed: {}", request.method(), request.path(), e.toString());
            throw ApiErrors.fromIOException(e, call.isCanceled());
        }
    }

    private ApiResponse requireSuccess(ApiResponse response) throws ApiException {
        if (response.isSuccessful()) {
            return response;
        }
        throw ApiErrors.fromResponse(response, mapper);
    }

    private RequestBody toRequestBody(ApiRequest request) throws ApiException {
        Object body = request.body();
        if (body instanceof RequestBody requestBody) {
            return requestBody;
        }
        if (body == null) {
            return request.method().requiresBody() ? RequestBody.create(new byte[0], JSON) : null;
        }
        try {
            byte[] bytes = body instanceof String s ? s.getBytes(StandardCharsets.UTF_8)
                : mapper.writeValueAsBytes(body);
            return RequestBody.create(bytes, JSON);
        } catch (JsonProcessingException e) {
            throw new ApiException(ApiErrorType.BAD_REQUEST, "Failed to encode request body: " + e.getMessage(), e);
        }
    }

    private HttpUrl resolve(String path, Map<String, String> query) {
        String url = path.startsWith("http://") || path.startsWith("https://")
            ? path
            : baseUrl + (path.startsWith("/") ? path : "/" + path);
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }
        if (query.isEmpty()) {
            return parsed;
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        query.forEach(builder::addQueryParameter);
        return builder.build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
