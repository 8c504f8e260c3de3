package com.olympus.realtime;

/**
 * Server-side channels a client can ask to be subscribed to, with the field that carries
 * the subscription key in control messages.
 */
public enum SubscriptionChannel {
    ORDER("order", "id"),
    INVENTORY("inventory", "location_id"),
    NOTIFICATIONS("notifications", "user_id");

    private final String wireName;
    private final String keyField;

    SubscriptionChannel(String wireName, String keyField) {
        this.wireName = wireName;
        this.keyField = keyField;
    }

    public String getWireName() {
        return wireName;
    }

    public String getKeyField() {
        return keyField;
    }
}
