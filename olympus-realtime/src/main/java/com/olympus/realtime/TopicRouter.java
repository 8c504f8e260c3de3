package com.olympus.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Routes inbound channel messages to per-type topics and manages server-side subscriptions.
 *
 * Inbound frames are {@code {"type": ..., "data": ...}}. The {@code data} payload of
 * order, inventory and notification messages is published on the matching topic.
 * Heartbeat traffic is handled here and never reaches a topic. Anything else is dropped.
 *
 * Server-side subscriptions only tell the server what to push; they do not filter what
 * local subscribers receive. Subscriptions that were sent are announced again each time
 * the channel reconnects.
 */
public class TopicRouter implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TopicRouter.class);
    private static final Map<String, String> PONG = Map.of("type", "pong");

    private final RealtimeChannel realtimeChannel;
    private final ObjectMapper mapper;
    private final Topic<JsonNode> orderUpdates;
    private final Topic<JsonNode> inventoryUpdates;
    private final Topic<JsonNode> notifications;
    private final Set<ChannelSubscription> activeSubscriptions = ConcurrentHashMap.newKeySet();
    private final Consumer<String> messageListener = this::dispatch;
    private final Consumer<ConnectionState> stateListener = state -> {
        if (state == ConnectionState.CONNECTED) {
            resubscribe();
        }
    };

    public TopicRouter(RealtimeChannel realtimeChannel, ObjectMapper mapper, Executor dispatchExecutor) {
        this.realtimeChannel = realtimeChannel;
        this.mapper = mapper;
        this.orderUpdates = new Topic<>("order-updates", dispatchExecutor);
        this.inventoryUpdates = new Topic<>("inventory-updates", dispatchExecutor);
        this.notifications = new Topic<>("notifications", dispatchExecutor);

        realtimeChannel.addMessageListener(messageListener);
        realtimeChannel.addStateListener(stateListener);
    }

    // ==================== Topics ====================

    public Topic<JsonNode> orderUpdates() {
        return orderUpdates;
    }

    public Topic<JsonNode> inventoryUpdates() {
        return inventoryUpdates;
    }

    public Topic<JsonNode> notifications() {
        return notifications;
    }

    // ==================== Inbound ====================

    /**
     * Route one inbound text frame. Never throws.
     */
    public void dispatch(String text) {
        JsonNode message;
        try {
            message = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.warn("Dropping undecodable message: {}", e.getOriginalMessage());
            return;
        }
        if (message == null || !message.isObject()) {
            LOG.warn("Dropping message that is not a JSON object");
            return;
        }

        String typeName = message.path("type").asText("");
        MessageType type = MessageType.fromWireName(typeName);
        if (type == null) {
            LOG.debug("Dropping message of unknown type '{}'", typeName);
            return;
        }

        JsonNode data = message.hasNonNull("data") ? message.get("data") : NullNode.getInstance();
        switch (type) {
            case ORDER_UPDATE -> orderUpdates.publish(data);
            case INVENTORY_UPDATE -> inventoryUpdates.publish(data);
            case NOTIFICATION -> notifications.publish(data);
            case PONG -> realtimeChannel.recordHeartbeatAck();
            case PING -> realtimeChannel.sendMessage(PONG);
        }
    }

    // ==================== Server-side subscriptions ====================

    /**
     * Ask the server to push updates for a channel key.
     *
     * @return false if the channel is not connected; nothing is sent or remembered
     */
    public boolean subscribe(SubscriptionChannel channel, String key) {
        ChannelSubscription subscription = new ChannelSubscription(channel, key);
        boolean sent = realtimeChannel.sendMessage(subscription.toControlMessage("subscribe"));
        if (sent) {
            activeSubscriptions.add(subscription);
        }
        return sent;
    }

    /**
     * Ask the server to stop pushing updates for a channel key. The subscription is
     * forgotten even if the channel is not connected.
     */
    public boolean unsubscribe(SubscriptionChannel channel, String key) {
        ChannelSubscription subscription = new ChannelSubscription(channel, key);
        activeSubscriptions.remove(subscription);
        return realtimeChannel.sendMessage(subscription.toControlMessage("unsubscribe"));
    }

    public boolean subscribeToOrder(String orderId) {
        return subscribe(SubscriptionChannel.ORDER, orderId);
    }

    public boolean unsubscribeFromOrder(String orderId) {
        return unsubscribe(SubscriptionChannel.ORDER, orderId);
    }

    public boolean subscribeToInventory(String locationId) {
        return subscribe(SubscriptionChannel.INVENTORY, locationId);
    }

    public boolean unsubscribeFromInventory(String locationId) {
        return unsubscribe(SubscriptionChannel.INVENTORY, locationId);
    }

    public boolean subscribeToNotifications(String userId) {
        return subscribe(SubscriptionChannel.NOTIFICATIONS, userId);
    }

    public boolean unsubscribeFromNotifications(String userId) {
        return unsubscribe(SubscriptionChannel.NOTIFICATIONS, userId);
    }

    public Set<ChannelSubscription> getActiveSubscriptions() {
        return Set.copyOf(activeSubscriptions);
    }

    private void resubscribe() {
        if (activeSubscriptions.isEmpty()) {
            return;
        }
        LOG.info("Re-subscribing to {} channel(s) after reconnect", activeSubscriptions.size());
        for (ChannelSubscription subscription : activeSubscriptions) {
            if (!realtimeChannel.sendMessage(subscription.toControlMessage("subscribe"))) {
                LOG.warn("Failed to re-subscribe to {} {}", subscription.channel().getWireName(), subscription.key());
            }
        }
    }

    /**
     * Stop routing and complete every topic.
     */
    @Override
    public void close() {
        realtimeChannel.removeMessageListener(messageListener);
        realtimeChannel.removeStateListener(stateListener);
        orderUpdates.close();
        inventoryUpdates.close();
        notifications.close();
    }
}
