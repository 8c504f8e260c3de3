package com.olympus.realtime.transport;

/**
 * An open duplex text connection.
 */
public interface ChannelSocket {

    /**
     * Send a text frame.
     *
     * @throws RuntimeException if the socket is no longer open
     */
    void send(String text);

    void close();

    boolean isOpen();
}
