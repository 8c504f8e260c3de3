package com.olympus.realtime.transport;

/**
 * Callbacks for an opened socket. Invoked on the transport's own thread.
 */
public interface SocketListener {

    void onMessage(String text);

    void onClose(int code, String reason, boolean remote);

    void onError(Exception error);
}
