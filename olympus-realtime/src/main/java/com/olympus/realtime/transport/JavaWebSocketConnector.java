package com.olympus.realtime.transport;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.Socket;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link SocketConnector} backed by Java-WebSocket. One {@link WebSocketClient} per attempt.
 *
 * The returned future fails with a {@link java.util.concurrent.TimeoutException} when the
 * TCP connect and upgrade handshake do not finish within the connect timeout; the
 * half-open socket is then closed.
 */
public class JavaWebSocketConnector implements SocketConnector {
    private static final Logger LOG = LoggerFactory.getLogger(JavaWebSocketConnector.class);

    private final int connectionLostTimeoutSeconds;
    private final int connectTimeoutMillis;

    /**
     * @param connectionLostTimeoutSeconds ping/pong liveness check interval of an open socket
     * @param connectTimeoutMillis limit for connect plus handshake; 0 waits forever
     */
    public JavaWebSocketConnector(int connectionLostTimeoutSeconds, long connectTimeoutMillis) {
        this.connectionLostTimeoutSeconds = connectionLostTimeoutSeconds;
        this.connectTimeoutMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(0, connectTimeoutMillis));
    }

    @Override
    public CompletableFuture<ChannelSocket> connect(URI uri, SocketListener listener) {
        CompletableFuture<ChannelSocket> opened = new CompletableFuture<>();
        ClientSocket socket = new ClientSocket(uri, listener, opened, connectTimeoutMillis);
        socket.setConnectionLostTimeout(connectionLostTimeoutSeconds);
        if (connectTimeoutMillis > 0) {
            opened.orTimeout(connectTimeoutMillis, TimeUnit.MILLISECONDS);
        }
        opened.whenComplete((ignored, error) -> {
            if (error != null) {
                socket.abort();
            }
        });
        socket.connect();
        return opened;
    }

    private static class ClientSocket extends WebSocketClient implements ChannelSocket {

        private final SocketListener listener;
        private final CompletableFuture<ChannelSocket> opened;

        ClientSocket(URI serverUri, SocketListener listener, CompletableFuture<ChannelSocket> opened,
                     int connectTimeoutMillis) {
            super(serverUri, new Draft_6455(), null, connectTimeoutMillis);
            this.listener = listener;
            this.opened = opened;
        }

        /**
         * Tear down an attempt that never opened. The raw socket is closed as well so the
         * reader thread blocked on a silent server exits.
         */
        void abort() {
            close();
            Socket raw = getSocket();
            if (raw == null) {
                return;
            }
            try {
                raw.close();
            } catch (IOException e) {
                LOG.debug("Closing abandoned socket to {} failed: {}", getURI().getHost(), e.getMessage());
            }
        }

        private boolean isEstablished() {
            return opened.isDone() && !opened.isCompletedExceptionally();
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            LOG.debug("WebSocket open: {} (status {})", getURI().getHost(), handshake.getHttpStatus());
            opened.complete(this);
        }

        @Override
        public void onMessage(String message) {
            if (isEstablished()) {
                listener.onMessage(message);
            }
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            if (isEstablished()) {
                listener.onClose(code, reason, remote);
            } else {
                opened.completeExceptionally(
                    new ConnectException("Connection closed before open: code=" + code + ", reason=" + reason));
            }
        }

        @Override
        public void onError(Exception ex) {
            if (isEstablished()) {
                listener.onError(ex);
            } else {
                opened.completeExceptionally(ex);
            }
        }
    }
}
