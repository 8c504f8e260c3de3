package com.olympus.api;

import com.olympus.api.exception.ApiErrorType;
import com.olympus.api.exception.ApiException;
import com.olympus.api.exception.SessionExpiredException;
import com.olympus.core.config.ClientConfig;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the 401 -> single-flight refresh -> retry-once path.
 */
@Timeout(30)
class TokenRefreshTest {

    private static final String REFRESH_PATH = "/api/v1/auth/refresh";

    private MockWebServer server;
    private CountingCredentialStore credentials;
    private ApiClient client;

    private final AtomicInteger refreshCalls = new AtomicInteger();
    private final AtomicInteger requestsWithNewToken = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        credentials = new CountingCredentialStore("access-old", "refresh-1");

        ClientConfig.ApiConfig config = new ClientConfig.ApiConfig();
        config.setBaseUrl(server.url("/api/v1").toString());
        config.setReadTimeoutMillis(10_000);
        client = new ApiClient(config, credentials);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    /**
     * Server that accepts only "access-new" and hands it out from the refresh endpoint.
     */
    private Dispatcher rotatingTokenServer(MockResponse refreshResponse, long refreshDelayMillis) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                if (REFRESH_PATH.equals(request.getPath())) {
                    refreshCalls.incrementAndGet();
                    Thread.sleep(refreshDelayMillis);
                    return refreshResponse;
                }
                if ("Bearer access-new".equals(request.getHeader("Authorization"))) {
                    requestsWithNewToken.incrementAndGet();
                    return new MockResponse().setBody("{\"ok\":true}");
                }
                return new MockResponse().setResponseCode(401).setBody("{\"error\":\"token expired\"}");
            }
        };
    }

    private static MockResponse tokens(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    @DisplayName("401 triggers a refresh, the new token is stored and the call is retried once")
    void refreshesAndRetries() throws Exception {
        server.setDispatcher(rotatingTokenServer(tokens("{\"access_token\":\"access-new\"}"), 0));

        ApiResponse response = client.get("/orders");

        assertEquals(200, response.statusCode());
        assertEquals("access-new", credentials.getAccessToken());
        assertEquals("refresh-1", credentials.getRefreshToken(), "Refresh token kept when not rotated");
        assertEquals(1, refreshCalls.get());
        assertEquals(3, server.getRequestCount(), "original + refresh + retry");

        RecordedRequest original = server.takeRequest();
        RecordedRequest refresh = server.takeRequest();
        RecordedRequest retry = server.takeRequest();
        assertEquals("Bearer access-old", original.getHeader("Authorization"));
        assertEquals(REFRESH_PATH, refresh.getPath());
        assertNull(refresh.getHeader("Authorization"), "Refresh call carries no bearer token");
        assertEquals("{\"refresh_token\":\"refresh-1\"}", refresh.getBody().readUtf8());
        assertEquals("/api/v1/orders", retry.getPath());
        assertEquals("Bearer access-new", retry.getHeader("Authorization"));
    }

    @Test
    @DisplayName("A rotated refresh token returned by the server is stored")
    void storesRotatedRefreshToken() throws Exception {
        server.setDispatcher(rotatingTokenServer(
            tokens("{\"access_token\":\"access-new\",\"refresh_token\":\"refresh-2\",\"expires_in\":900}"), 0));

        client.get("/orders");

        assertEquals("access-new", credentials.getAccessToken());
        assertEquals("refresh-2", credentials.getRefreshToken());
    }

    @Test
    @DisplayName("A retry that fails again with 401 is surfaced without a second refresh")
    void retryFailureDoesNotRefreshAgain() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (REFRESH_PATH.equals(request.getPath())) {
                    refreshCalls.incrementAndGet();
                    return tokens("{\"access_token\":\"access-new\"}");
                }
                return new MockResponse().setResponseCode(401);
            }
        });

        ApiException e = assertThrows(ApiException.class, () -> client.get("/orders"));

        assertFalse(e instanceof SessionExpiredException, "Retry failure is the retry's own error");
        assertEquals(ApiErrorType.UNAUTHORIZED, e.getType());
        assertEquals(1, refreshCalls.get());
        assertEquals(3, server.getRequestCount());
        assertEquals(0, credentials.clearCount.get(), "Credentials survive a failed retry");
    }

    @Test
    @DisplayName("A retry that fails with another status surfaces that status")
    void retryServerErrorIsSurfaced() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (REFRESH_PATH.equals(request.getPath())) {
                    return tokens("{\"access_token\":\"access-new\"}");
                }
                if ("Bearer access-new".equals(request.getHeader("Authorization"))) {
                    return new MockResponse().setResponseCode(503);
                }
                return new MockResponse().setResponseCode(401);
            }
        });

        ApiException e = assertThrows(ApiException.class, () -> client.get("/orders"));

        assertEquals(ApiErrorType.SERVER_ERROR, e.getType());
        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("A failed refresh clears credentials and surfaces session expiry without retry")
    void refreshFailureExpiresSession() {
        server.setDispatcher(rotatingTokenServer(new MockResponse().setResponseCode(401), 0));

        assertThrows(SessionExpiredException.class, () -> client.get("/orders"));

        assertNull(credentials.getAccessToken());
        assertNull(credentials.getRefreshToken());
        assertEquals(1, credentials.clearCount.get());
        assertEquals(2, server.getRequestCount(), "original + refresh, no retry");
    }

    @Test
    @DisplayName("Missing refresh token expires the session without calling the refresh endpoint")
    void missingRefreshToken() {
        credentials.setRefreshToken(null);
        server.setDispatcher(rotatingTokenServer(tokens("{\"access_token\":\"access-new\"}"), 0));

        assertThrows(SessionExpiredException.class, () -> client.get("/orders"));

        assertEquals(0, refreshCalls.get());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("Malformed refresh response is a refresh failure")
    void malformedRefreshResponse() {
        server.setDispatcher(rotatingTokenServer(tokens("{\"token\":\"where-is-access_token\"}"), 0));

        assertThrows(SessionExpiredException.class, () -> client.get("/orders"));
        assertEquals(1, credentials.clearCount.get());
    }

    @Test
    @DisplayName("A request rejected after the session was cleared fails without refreshing")
    void requestAfterClearedSession() {
        server.setDispatcher(rotatingTokenServer(new MockResponse().setResponseCode(500), 0));
        assertThrows(SessionExpiredException.class, () -> client.get("/orders"));
        int refreshesBefore = refreshCalls.get();

        // Rejected token no longer stored, nothing to refresh with
        ApiException e = assertThrows(ApiException.class, () -> client.getTokenRefresher().refresh("access-old"));

        assertInstanceOf(SessionExpiredException.class, e);
        assertEquals(refreshesBefore, refreshCalls.get());
        assertEquals(1, credentials.clearCount.get());
    }

    @Test
    @DisplayName("Concurrent 401s share exactly one refresh call")
    void concurrentUnauthorizedShareOneRefresh() throws Exception {
        int callers = 5;
        CountDownLatch allArrived = new CountDownLatch(callers);
        Dispatcher tokenServer = rotatingTokenServer(tokens("{\"access_token\":\"access-new\"}"), 300);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                if ("Bearer access-old".equals(request.getHeader("Authorization"))) {
                    // Hold every original request until all of them are in flight
                    allArrived.countDown();
                    allArrived.await(10, TimeUnit.SECONDS);
                }
                return tokenServer.dispatch(request);
            }
        });

        List<CompletableFuture<ApiResponse>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(client.executeAsync(ApiRequest.get("/orders/" + i).build()));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(20, TimeUnit.SECONDS);

        for (CompletableFuture<ApiResponse> future : futures) {
            assertEquals(200, future.get().statusCode());
        }
        assertEquals(1, refreshCalls.get(), "Exactly one refresh for all concurrent 401s");
        assertEquals(callers, requestsWithNewToken.get(), "Each caller retried once with the new token");
        assertEquals(1, credentials.accessTokenWrites.get());
        assertFalse(client.getTokenRefresher().isRefreshing());
    }

    @Test
    @DisplayName("Concurrent waiters all see session expiry when the shared refresh fails; store cleared once")
    void concurrentRefreshFailure() throws Exception {
        int callers = 4;
        CountDownLatch allArrived = new CountDownLatch(callers);
        Dispatcher tokenServer = rotatingTokenServer(new MockResponse().setResponseCode(500), 300);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                if ("Bearer access-old".equals(request.getHeader("Authorization"))) {
                    allArrived.countDown();
                    allArrived.await(10, TimeUnit.SECONDS);
                }
                return tokenServer.dispatch(request);
            }
        });

        List<CompletableFuture<ApiResponse>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(client.executeAsync(ApiRequest.get("/orders/" + i).build()));
        }

        for (CompletableFuture<ApiResponse> future : futures) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(20, TimeUnit.SECONDS));
            assertInstanceOf(SessionExpiredException.class, e.getCause());
        }
        assertEquals(1, refreshCalls.get());
        assertEquals(1, credentials.clearCount.get(), "clear() invoked exactly once");
        assertEquals(0, requestsWithNewToken.get(), "No retries after a failed refresh");
    }

    @Test
    @DisplayName("cancelAll() during a refresh surfaces CANCELLED and keeps the stored tokens")
    void cancelledRefreshKeepsCredentials() throws Exception {
        CountDownLatch releaseRefresh = new CountDownLatch(1);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                if (REFRESH_PATH.equals(request.getPath())) {
                    refreshCalls.incrementAndGet();
                    releaseRefresh.await(10, TimeUnit.SECONDS);
                    return tokens("{\"access_token\":\"access-new\"}");
                }
                return new MockResponse().setResponseCode(401);
            }
        });

        try {
            CompletableFuture<ApiResponse> future = client.executeAsync(ApiRequest.get("/orders").build());
            long deadline = System.currentTimeMillis() + 5000;
            while (refreshCalls.get() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, refreshCalls.get(), "Refresh call reached the server");

            client.cancelAll();

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            ApiException cause = assertInstanceOf(ApiException.class, e.getCause());
            assertFalse(cause instanceof SessionExpiredException, "Cancellation is not session expiry");
            assertEquals(ApiErrorType.CANCELLED, cause.getType());
            assertEquals(0, credentials.clearCount.get());
            assertEquals("access-old", credentials.getAccessToken());
            assertEquals("refresh-1", credentials.getRefreshToken());
        } finally {
            releaseRefresh.countDown();
        }
    }
}
