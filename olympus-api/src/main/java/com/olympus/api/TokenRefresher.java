package com.olympus.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.olympus.api.exception.ApiErrorType;
import com.olympus.api.exception.ApiException;
import com.olympus.api.exception.SessionExpiredException;
import com.olympus.core.auth.CredentialStore;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Single-flight access token refresh.
 *
 * At most one refresh call is in flight at any time. Callers that hit a 401 while a
 * refresh is running wait for that same refresh instead of starting another one.
 * A caller whose rejected token has already been replaced gets the stored token
 * without any refresh call.
 */
public class TokenRefresher {
    private static final Logger LOG = LoggerFactory.getLogger(TokenRefresher.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final HttpUrl refreshUrl;
    private final ObjectMapper mapper;
    private final CredentialStore credentials;

    private final Object lock = new Object();
    // Guarded by lock
    private CompletableFuture<String> inFlight;

    public TokenRefresher(OkHttpClient httpClient, HttpUrl refreshUrl, ObjectMapper mapper,
                          CredentialStore credentials) {
        this.httpClient = httpClient;
        this.refreshUrl = refreshUrl;
        this.mapper = mapper;
        this.credentials = credentials;
    }

    /**
     * Obtain an access token to replace one the server rejected.
     *
     * @param rejectedToken the token the failed request was sent with (null if none)
     * @return the new access token
     * @throws SessionExpiredException if the refresh failed; credentials have been cleared
     * @throws ApiException of type CANCELLED if the refresh call was cancelled; credentials are kept
     */
    public String refresh(String rejectedToken) throws ApiException {
        CompletableFuture<String> operation;
        boolean owner = false;

        synchronized (lock) {
            if (inFlight != null) {
                operation = inFlight;
            } else {
                String current = credentials.getAccessToken();
                if (current != null && !current.equals(rejectedToken)) {
                    LOG.debug("Access token already refreshed, reusing it");
                    return current;
                }
                if (current == null && rejectedToken != null) {
                    // Cleared by a failed refresh after this request was sent
                    throw new SessionExpiredException("Session is no longer valid");
                }
                operation = new CompletableFuture<>();
                inFlight = operation;
                owner = true;
            }
        }

        if (owner) {
            runRefresh(operation);
        }
        return await(operation);
    }

    /**
     * Whether a refresh call is currently in flight.
     */
    public boolean isRefreshing() {
        synchronized (lock) {
            return inFlight != null;
        }
    }

    private void runRefresh(CompletableFuture<String> operation) {
        try {
            String refreshToken = credentials.getRefreshToken();
            if (refreshToken == null || refreshToken.isEmpty()) {
                throw new SessionExpiredException("No refresh token available");
            }

            TokenResponse tokens = callRefreshEndpoint(refreshToken);
            credentials.setAccessToken(tokens.accessToken());
            if (tokens.refreshToken() != null && !tokens.refreshToken().isEmpty()) {
                credentials.setRefreshToken(tokens.refreshToken());
            }
            LOG.info("Access token refreshed");
            operation.complete(tokens.accessToken());
        } catch (ApiException e) {
            if (e.getType() == ApiErrorType.CANCELLED) {
                // Cancelled, not rejected: the stored tokens are still valid
                LOG.info("Token refresh cancelled");
                operation.completeExceptionally(e);
                return;
            }
            expire(operation, e);
        } catch (RuntimeException e) {
            expire(operation, e);
        } finally {
            synchronized (lock) {
                if (inFlight == operation) {
                    inFlight = null;
                }
            }
        }
    }

    private void expire(CompletableFuture<String> operation, Exception e) {
        LOG.warn("Token refresh failed, clearing credentials: {}", e.getMessage());
        credentials.clear();
        operation.completeExceptionally(e instanceof SessionExpiredException
            ? e
            : new SessionExpiredException("Token refresh failed: " + e.getMessage(), e));
    }

    private TokenResponse callRefreshEndpoint(String refreshToken) throws ApiException {
        Call call;
        try {
            Request request = new Request.Builder()
                .url(refreshUrl)
                .post(RequestBody.create(mapper.writeValueAsBytes(Map.of("refresh_token", refreshToken)), JSON))
                .header("Accept", "application/json")
                .build();
            call = httpClient.newCall(request);
        } catch (IOException e) {
            throw new ApiException(ApiErrorType.UNKNOWN, "Failed to encode refresh request", e);
        }

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            if (!response.isSuccessful()) {
                throw ApiErrors.fromResponse(
                    new ApiResponse(response.code(), response.headers().toMultimap(), bytes), mapper);
            }

            TokenResponse tokens = mapper.readValue(bytes, TokenResponse.class);
            if (tokens.accessToken() == null || tokens.accessToken().isEmpty()) {
                throw new ApiException(ApiErrorType.UNKNOWN, "Refresh response has no access_token");
            }
            return tokens;
        } catch (ApiException e) {
            throw e;
        } catch (IOException e) {
            throw ApiErrors.fromIOException(e, call.isCanceled());
        }
    }

    private String await(CompletableFuture<String> operation) throws ApiException {
        try {
            return operation.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ApiException apiException && apiException.getType() == ApiErrorType.CANCELLED) {
                throw new ApiException(ApiErrorType.CANCELLED, apiException.getMessage(), apiException);
            }
            throw new SessionExpiredException(cause != null ? cause.getMessage() : "Token refresh failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ApiErrorType.CANCELLED, "Interrupted while waiting for token refresh", e);
        }
    }
}
