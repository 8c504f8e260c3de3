package com.olympus.realtime;

import com.olympus.realtime.transport.ChannelSocket;
import com.olympus.realtime.transport.SocketConnector;
import com.olympus.realtime.transport.SocketListener;

import java.net.ConnectException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory connector. Each attempt either opens a {@link FakeSocket} or is refused,
 * depending on {@link #setAccepting(boolean)}.
 */
class FakeSocketConnector implements SocketConnector {

    final List<URI> attempts = new CopyOnWriteArrayList<>();
    final BlockingQueue<FakeSocket> opened = new LinkedBlockingQueue<>();
    private volatile boolean accepting = true;

    void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    @Override
    public CompletableFuture<ChannelSocket> connect(URI uri, SocketListener listener) {
        attempts.add(uri);
        if (!accepting) {
            return CompletableFuture.failedFuture(new ConnectException("Connection refused"));
        }
        FakeSocket socket = new FakeSocket(listener);
        opened.add(socket);
        return CompletableFuture.completedFuture(socket);
    }

    FakeSocket nextSocket() throws InterruptedException {
        FakeSocket socket = opened.poll(5, TimeUnit.SECONDS);
        if (socket == null) {
            throw new AssertionError("No socket opened within 5s");
        }
        return socket;
    }

    static class FakeSocket implements ChannelSocket {

        final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
        private final SocketListener listener;
        private volatile boolean open = true;

        FakeSocket(SocketListener listener) {
            this.listener = listener;
        }

        @Override
        public void send(String text) {
            if (!open) {
                throw new IllegalStateException("closed");
            }
            sent.add(text);
        }

        @Override
        public void close() {
            open = false;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        /** Simulate a frame from the server. */
        void receive(String text) {
            listener.onMessage(text);
        }

        /** Simulate the server dropping the connection. */
        void drop() {
            open = false;
            listener.onClose(1006, "abnormal closure", true);
        }

        String nextSent() throws InterruptedException {
            String text = sent.poll(5, TimeUnit.SECONDS);
            if (text == null) {
                throw new AssertionError("Nothing sent within 5s");
            }
            return text;
        }
    }
}
