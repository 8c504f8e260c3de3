package com.olympus.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.olympus.api.ApiClient;
import com.olympus.core.auth.CredentialStore;
import com.olympus.core.config.ClientConfig;
import com.olympus.realtime.ConnectionState;
import com.olympus.realtime.RealtimeChannel;
import com.olympus.realtime.TopicRouter;
import com.olympus.realtime.transport.JavaWebSocketConnector;
import com.olympus.realtime.transport.SocketConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point wiring the HTTP pipeline and the real-time channel to one credential store.
 *
 * <pre>
 * try (OlympusClient client = OlympusClient.create(ClientConfig.load(ClientConfig.defaultPath()), store)) {
 *     client.topics().orderUpdates().subscribe(update -> ...);
 *     client.realtime().connect();
 *     client.topics().subscribeToOrder("o-1");
 *     ApiResponse orders = client.api().get("/orders");
 * }
 * </pre>
 */
public class OlympusClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(OlympusClient.class);

    private final ApiClient api;
    private final RealtimeChannel realtime;
    private final TopicRouter topics;
    private final ExecutorService dispatchExecutor;
    private final CredentialStore credentials;

    private OlympusClient(ClientConfig config, CredentialStore credentials, SocketConnector connector) {
        ObjectMapper mapper = new ObjectMapper();
        AtomicInteger threadCount = new AtomicInteger();
        this.dispatchExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Realtime-Dispatch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.credentials = credentials;
        this.api = new ApiClient(config.getApi(), credentials, mapper);
        this.realtime = new RealtimeChannel(config.getRealtime(), credentials, connector, mapper, dispatchExecutor);
        this.topics = new TopicRouter(realtime, mapper, dispatchExecutor);
    }

    public static OlympusClient create(ClientConfig config, CredentialStore credentials) {
        return create(config, credentials,
            new JavaWebSocketConnector(config.getRealtime().getConnectionLostTimeoutSeconds(),
                config.getRealtime().getConnectTimeoutMillis()));
    }

    public static OlympusClient create(ClientConfig config, CredentialStore credentials, SocketConnector connector) {
        LOG.info("Creating client for {} / {}", config.getApi().getBaseUrl(), config.getRealtime().getUrl());
        return new OlympusClient(config, credentials, connector);
    }

    /**
     * Create a client from the default config file ({@code ~/.olympus/client.yaml}).
     */
    public static OlympusClient createDefault(CredentialStore credentials) throws IOException {
        return create(ClientConfig.load(ClientConfig.defaultPath()), credentials);
    }

    public ApiClient api() {
        return api;
    }

    public RealtimeChannel realtime() {
        return realtime;
    }

    public TopicRouter topics() {
        return topics;
    }

    public CredentialStore credentials() {
        return credentials;
    }

    /**
     * Drop the real-time connection, cancel in-flight calls and forget the stored tokens.
     */
    public void logout() {
        realtime.disconnect();
        api.cancelAll();
        credentials.clear();
        LOG.info("Logged out");
    }

    public ConnectionState getConnectionState() {
        return realtime.getState();
    }

    @Override
    public void close() {
        topics.close();
        realtime.close();
        api.close();
        dispatchExecutor.shutdownNow();
    }
}
