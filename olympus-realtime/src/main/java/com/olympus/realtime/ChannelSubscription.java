package com.olympus.realtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A server-side subscription: a channel plus its key (order id, location id or user id).
 */
public record ChannelSubscription(SubscriptionChannel channel, String key) {

    public ChannelSubscription {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(key, "key");
    }

    /**
     * Control message announcing this subscription, e.g.
     * {@code {"type":"subscribe","channel":"order","id":"o-1"}}.
     */
    public Map<String, Object> toControlMessage(String action) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", action);
        message.put("channel", channel.getWireName());
        message.put(channel.getKeyField(), key);
        return message;
    }
}
