package com.olympus.realtime;

/**
 * Lifecycle state of a {@link RealtimeChannel}.
 */
public enum ConnectionState {
    DISCONNECTED("Disconnected"),
    CONNECTING("Connecting..."),
    CONNECTED("Connected"),
    RECONNECTING("Reconnecting..."),
    FAILED("Connection Failed");

    private final String displayName;

    ConnectionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isConnected() {
        return this == CONNECTED;
    }
}
