package com.olympus.realtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A named broadcast stream. Every current subscriber receives every item, in publish order,
 * on the supplied executor.
 *
 * Each subscriber has its own unbounded queue drained by at most one task at a time, so a
 * slow subscriber delays only itself and never loses items. Publishing never blocks.
 *
 * @param <T> item type
 */
public class Topic<T> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Topic.class);

    private final String name;
    private final Executor executor;
    private final List<ListenerSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public Topic(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    /**
     * Register a listener. Items published after this call returns are delivered to it.
     * Exceptions thrown by the listener are logged and do not end the subscription.
     */
    public TopicSubscription subscribe(Consumer<? super T> listener) {
        ListenerSubscription subscription = new ListenerSubscription(listener);
        if (closed) {
            subscription.complete();
            return subscription;
        }
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Publish to all current subscribers. A no-op once the topic is closed.
     */
    public void publish(T item) {
        Objects.requireNonNull(item, "item");
        if (closed) {
            return;
        }
        for (ListenerSubscription subscription : subscriptions) {
            subscription.enqueue(item);
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Complete every subscription. Items already published are still delivered;
     * later publishes are ignored.
     */
    @Override
    public void close() {
        closed = true;
        for (ListenerSubscription subscription : subscriptions) {
            subscription.complete();
        }
        subscriptions.clear();
    }

    private class ListenerSubscription implements TopicSubscription {

        private final Consumer<? super T> listener;
        private final Queue<T> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean cancelled;
        private volatile boolean completed;

        ListenerSubscription(Consumer<? super T> listener) {
            this.listener = listener;
        }

        void enqueue(T item) {
            if (cancelled || completed) {
                return;
            }
            pending.add(item);
            scheduleDrain();
        }

        void complete() {
            completed = true;
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                LOG.debug("Topic '{}' executor rejected delivery: {}", name, e.toString());
            }
        }

        private void drain() {
            try {
                T item;
                while (!cancelled && (item = pending.poll()) != null) {
                    try {
                        listener.accept(item);
                    } catch (RuntimeException e) {
                        LOG.warn("Listener on topic '{}' threw: {}", name, e.getMessage(), e);
                    }
                }
            } finally {
                draining.set(false);
            }
            // An item enqueued after the last poll but before the flag was reset
            if (!cancelled && !pending.isEmpty()) {
                scheduleDrain();
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            pending.clear();
            subscriptions.remove(this);
        }

        @Override
        public boolean isActive() {
            return !cancelled && !completed;
        }
    }
}
