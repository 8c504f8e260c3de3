package com.olympus.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.olympus.core.auth.CredentialStore;
import com.olympus.core.config.ClientConfig;
import com.olympus.realtime.transport.ChannelSocket;
import com.olympus.realtime.transport.SocketConnector;
import com.olympus.realtime.transport.SocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Persistent real-time connection with heartbeats and bounded reconnection.
 *
 * All state lives on one channel thread: connection attempts, socket callbacks, heartbeat
 * and reconnect timers are all executed there. Callbacks from a socket that has since been
 * replaced or closed are ignored.
 *
 * State changes are published on {@link #connectionStatus()} in the order they happen.
 * Inbound text frames are handed to message listeners on the channel thread.
 */
public class RealtimeChannel implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RealtimeChannel.class);
    private static final Map<String, String> PING = Map.of("type", "ping");

    private final ClientConfig.RealtimeConfig config;
    private final CredentialStore credentials;
    private final SocketConnector connector;
    private final ObjectMapper mapper;
    private final ReconnectPolicy reconnectPolicy;
    private final Topic<ConnectionState> statusTopic;
    private final Set<Consumer<String>> messageListeners = ConcurrentHashMap.newKeySet();
    private final Set<Consumer<ConnectionState>> stateListeners = ConcurrentHashMap.newKeySet();

    private volatile Thread channelThread;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "RealtimeChannel-Scheduler");
        t.setDaemon(true);
        channelThread = t;
        return t;
    });

    // Written on the channel thread only
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile ChannelSocket socket;
    private volatile long generation;
    private volatile Instant lastHeartbeatAck;
    private boolean reconnectEnabled = true;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;

    public RealtimeChannel(ClientConfig.RealtimeConfig config, CredentialStore credentials,
                           SocketConnector connector, ObjectMapper mapper, Executor dispatchExecutor) {
        this.config = config;
        this.credentials = credentials;
        this.connector = connector;
        this.mapper = mapper;
        this.reconnectPolicy = new ReconnectPolicy(config.getReconnectDelayMillis(), config.getMaxReconnectAttempts());
        this.statusTopic = new Topic<>("connection-status", dispatchExecutor);
    }

    // ==================== Lifecycle ====================

    /**
     * Start connecting. Returns immediately; the future completes with the state reached
     * once the first attempt settles (CONNECTED, RECONNECTING or FAILED).
     *
     * A no-op if already connected or connecting. From FAILED, DISCONNECTED or RECONNECTING
     * the attempt counter is reset and reconnection re-enabled. Without an access token
     * nothing happens and the future completes with the current state.
     */
    public CompletableFuture<ConnectionState> connect() {
        CompletableFuture<ConnectionState> result = new CompletableFuture<>();
        if (!post(() -> startConnect(result))) {
            LOG.warn("Cannot connect - channel is closed");
            result.complete(state);
        }
        return result;
    }

    /**
     * Close the connection and stop reconnecting. Waits until the channel thread has
     * cancelled its timers, so nothing fires after this returns.
     */
    public void disconnect() {
        runAndWait(this::stop);
    }

    /**
     * Disconnect, stop the channel thread and complete the status stream.
     */
    @Override
    public void close() {
        disconnect();
        scheduler.shutdownNow();
        statusTopic.close();
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state.isConnected();
    }

    /**
     * Connection-status stream. Subscribers see transitions that happen after they subscribe.
     */
    public Topic<ConnectionState> connectionStatus() {
        return statusTopic;
    }

    /**
     * Listen for state changes on the channel thread, before they are published on
     * {@link #connectionStatus()}. Listeners must not block.
     */
    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(Consumer<ConnectionState> listener) {
        stateListeners.remove(listener);
    }

    public int getReconnectAttempts() {
        return reconnectPolicy.getAttempts();
    }

    // ==================== Messaging ====================

    /**
     * Send a JSON message.
     *
     * @return false if not connected (nothing is sent or queued) or the send failed
     */
    public boolean sendMessage(Map<String, ?> message) {
        ChannelSocket current = socket;
        if (state != ConnectionState.CONNECTED || current == null || !current.isOpen()) {
            LOG.debug("Not connected, dropping outbound '{}' message", message.get("type"));
            return false;
        }
        try {
            current.send(mapper.writeValueAsString(message));
            return true;
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to encode outbound message: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            LOG.warn("Failed to send outbound '{}' message: {}", message.get("type"), e.getMessage());
            return false;
        }
    }

    /**
     * Receive every inbound text frame from the current socket.
     */
    public void addMessageListener(Consumer<String> listener) {
        messageListeners.add(listener);
    }

    public void removeMessageListener(Consumer<String> listener) {
        messageListeners.remove(listener);
    }

    /**
     * Record a heartbeat acknowledgement from the server.
     */
    public void recordHeartbeatAck() {
        lastHeartbeatAck = Instant.now();
    }

    /**
     * @return time of the last heartbeat acknowledgement, or null if none yet
     */
    public Instant getLastHeartbeatAck() {
        return lastHeartbeatAck;
    }

    // ==================== State machine (channel thread) ====================

    private void startConnect(CompletableFuture<ConnectionState> result) {
        if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
            LOG.debug("Already {}", state.getDisplayName());
            result.complete(state);
            return;
        }
        if (!credentials.hasAccessToken()) {
            LOG.warn("Cannot connect - no access token available");
            result.complete(state);
            return;
        }

        cancelReconnect();
        reconnectEnabled = true;
        reconnectPolicy.reset();
        transition(ConnectionState.CONNECTING);
        attemptConnect(result);
    }

    private void attemptConnect(CompletableFuture<ConnectionState> result) {
        String token = credentials.getAccessToken();
        if (token == null || token.isEmpty()) {
            LOG.warn("Access token no longer available, giving up reconnecting");
            transition(ConnectionState.DISCONNECTED);
            complete(result);
            return;
        }

        long attemptGeneration = ++generation;
        URI uri = buildUri(token);
        LOG.info("Connecting to {} (attempt {}/{})", config.getUrl(),
            reconnectPolicy.getAttempts(), reconnectPolicy.getMaxAttempts());

        CompletableFuture<ChannelSocket> opening;
        try {
            opening = connector.connect(uri, new CurrentSocketListener(attemptGeneration));
        } catch (RuntimeException e) {
            opening = CompletableFuture.failedFuture(e);
        }
        opening.whenComplete((opened, error) -> {
            boolean posted = post(() -> {
                if (error != null) {
                    onAttemptFailed(attemptGeneration, error, result);
                } else {
                    onOpened(attemptGeneration, opened, result);
                }
            });
            if (!posted && opened != null) {
                opened.close();
            }
        });
    }

    private void onOpened(long attemptGeneration, ChannelSocket opened, CompletableFuture<ConnectionState> result) {
        if (attemptGeneration != generation) {
            LOG.debug("Closing socket from a superseded attempt");
            opened.close();
            complete(result);
            return;
        }
        socket = opened;
        reconnectPolicy.reset();
        LOG.info("Connected to {}", config.getUrl());
        transition(ConnectionState.CONNECTED);
        startHeartbeat();
        complete(result);
    }

    private void onAttemptFailed(long attemptGeneration, Throwable error, CompletableFuture<ConnectionState> result) {
        if (attemptGeneration == generation) {
            LOG.warn("Connection attempt failed: {}", error.getMessage());
            scheduleReconnect();
        }
        complete(result);
    }

    private void onSocketClosed(long socketGeneration, int code, String reason, boolean remote) {
        if (socketGeneration != generation || state != ConnectionState.CONNECTED) {
            return;
        }
        LOG.warn("Connection closed (code={}, reason={}, remote={})", code, reason, remote);
        stopHeartbeat();
        socket = null;
        scheduleReconnect();
    }

    private void onSocketError(long socketGeneration, Exception error) {
        if (socketGeneration != generation) {
            return;
        }
        LOG.warn("WebSocket error: {}", error.getMessage());
        ChannelSocket current = socket;
        if (state == ConnectionState.CONNECTED && current != null && !current.isOpen()) {
            onSocketClosed(socketGeneration, -1, error.getMessage(), false);
        }
    }

    private void onSocketMessage(long socketGeneration, String text) {
        if (socketGeneration != generation) {
            return;
        }
        for (Consumer<String> listener : messageListeners) {
            try {
                listener.accept(text);
            } catch (RuntimeException e) {
                LOG.warn("Message listener threw: {}", e.getMessage(), e);
            }
        }
    }

    private void scheduleReconnect() {
        if (!reconnectEnabled) {
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        if (reconnectPolicy.isExhausted()) {
            LOG.error("Giving up after {} reconnect attempts", reconnectPolicy.getMaxAttempts());
            transition(ConnectionState.FAILED);
            return;
        }

        int attempt = reconnectPolicy.nextAttempt();
        LOG.info("Reconnecting in {}ms (attempt {}/{})", reconnectPolicy.getDelayMillis(), attempt,
            reconnectPolicy.getMaxAttempts());
        transition(ConnectionState.RECONNECTING);
        reconnectTask = scheduler.schedule(() -> {
            reconnectTask = null;
            if (state == ConnectionState.RECONNECTING) {
                attemptConnect(null);
            }
        }, reconnectPolicy.getDelayMillis(), TimeUnit.MILLISECONDS);
    }

    private void stop() {
        reconnectEnabled = false;
        generation++;
        cancelReconnect();
        stopHeartbeat();
        ChannelSocket current = socket;
        socket = null;
        if (current != null) {
            current.close();
        }
        if (state != ConnectionState.DISCONNECTED) {
            LOG.info("Disconnected");
        }
        transition(ConnectionState.DISCONNECTED);
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        // Every reconnect attempt is reported, repeated RECONNECTING included
        if (previous != next || next == ConnectionState.RECONNECTING) {
            LOG.debug("State {} -> {}", previous, next);
            for (Consumer<ConnectionState> listener : stateListeners) {
                try {
                    listener.accept(next);
                } catch (RuntimeException e) {
                    LOG.warn("State listener threw: {}", e.getMessage(), e);
                }
            }
            statusTopic.publish(next);
        }
    }

    // ==================== Timers ====================

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = config.getHeartbeatIntervalMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(() -> {
            if (state == ConnectionState.CONNECTED) {
                LOG.trace("Sending heartbeat");
                sendMessage(PING);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    // ==================== Internals ====================

    private URI buildUri(String token) {
        String url = config.getUrl();
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + "token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }

    private void complete(CompletableFuture<ConnectionState> result) {
        if (result != null) {
            result.complete(state);
        }
    }

    /**
     * Run a task on the channel thread.
     *
     * @return false if the channel has been closed
     */
    private boolean post(Runnable task) {
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.error("Unexpected error on channel thread", e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void runAndWait(Runnable task) {
        if (Thread.currentThread() == channelThread) {
            task.run();
            return;
        }
        try {
            Future<?> future = scheduler.submit(task);
            future.get();
        } catch (RejectedExecutionException e) {
            LOG.debug("Channel already closed");
        } catch (ExecutionException e) {
            LOG.error("Error on channel thread: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the channel thread");
        }
    }

    /**
     * Socket callbacks tagged with the attempt that opened the socket.
     */
    private class CurrentSocketListener implements SocketListener {

        private final long socketGeneration;

        CurrentSocketListener(long socketGeneration) {
            this.socketGeneration = socketGeneration;
        }

        @Override
        public void onMessage(String text) {
            post(() -> onSocketMessage(socketGeneration, text));
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            post(() -> onSocketClosed(socketGeneration, code, reason, remote));
        }

        @Override
        public void onError(Exception error) {
            post(() -> onSocketError(socketGeneration, error));
        }
    }
}
