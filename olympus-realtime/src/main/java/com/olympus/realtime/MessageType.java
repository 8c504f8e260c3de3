package com.olympus.realtime;

/**
 * Inbound message types understood by the {@link TopicRouter}.
 */
public enum MessageType {
    ORDER_UPDATE("order_update"),
    INVENTORY_UPDATE("inventory_update"),
    NOTIFICATION("notification"),
    PING("ping"),
    PONG("pong");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @return the matching type, or null if the name is not recognised
     */
    public static MessageType fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
