package com.olympus.core.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCredentialStoreTest {

    @Test
    void saveAndClear() {
        InMemoryCredentialStore store = new InMemoryCredentialStore();
        assertFalse(store.hasAccessToken());

        store.saveTokens("access-1", "refresh-1");
        assertEquals("access-1", store.getAccessToken());
        assertEquals("refresh-1", store.getRefreshToken());
        assertTrue(store.hasAccessToken());

        store.setAccessToken("access-2");
        assertEquals("access-2", store.getAccessToken());
        assertEquals("refresh-1", store.getRefreshToken(), "Refresh token untouched by access token update");

        store.clear();
        assertNull(store.getAccessToken());
        assertNull(store.getRefreshToken());
    }

    @Test
    void emptyTokenIsNotAnAccessToken() {
        InMemoryCredentialStore store = new InMemoryCredentialStore("", "refresh");
        assertFalse(store.hasAccessToken());
    }

    @Test
    @Timeout(10)
    @DisplayName("Single-token setters wait for a pair update in progress")
    void settersShareTheStoreLock() throws Exception {
        InMemoryCredentialStore store = new InMemoryCredentialStore("access-1", "refresh-1");
        CountDownLatch accessDone = new CountDownLatch(1);
        CountDownLatch refreshDone = new CountDownLatch(1);

        Thread writer;
        synchronized (store) {
            writer = new Thread(() -> {
                store.setAccessToken("access-2");
                accessDone.countDown();
                store.setRefreshToken("refresh-2");
                refreshDone.countDown();
            }, "credential-writer");
            writer.start();

            assertFalse(accessDone.await(200, TimeUnit.MILLISECONDS), "setAccessToken ran while the store was locked");
            assertEquals("access-1", store.getAccessToken());
        }

        assertTrue(refreshDone.await(5, TimeUnit.SECONDS));
        writer.join();
        assertEquals("access-2", store.getAccessToken());
        assertEquals("refresh-2", store.getRefreshToken());
    }
}
