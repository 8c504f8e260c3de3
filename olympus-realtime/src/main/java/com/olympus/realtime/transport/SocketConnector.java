package com.olympus.realtime.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens sockets for the real-time channel.
 */
public interface SocketConnector {

    /**
     * Start opening a connection. The future completes with the socket once the handshake
     * succeeds, or exceptionally if the connection is refused or fails before opening.
     * The listener only receives events after a successful open.
     */
    CompletableFuture<ChannelSocket> connect(URI uri, SocketListener listener);
}
