package com.olympus.realtime;

/**
 * Handle for a listener registered on a {@link Topic}. Closing it stops delivery.
 */
public interface TopicSubscription extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
