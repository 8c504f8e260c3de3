package com.olympus.core.auth;

/**
 * Thread-safe credential store kept in memory for the lifetime of the process.
 * Writes are serialized on the store's monitor, so a pair saved by {@link #saveTokens}
 * is never interleaved with a single-token update; reads see the latest write.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private volatile String accessToken;
    private volatile String refreshToken;

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(String accessToken, String refreshToken) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
    }

    @Override
    public String getAccessToken() {
        return accessToken;
    }

    @Override
    public String getRefreshToken() {
        return refreshToken;
    }

    @Override
    public synchronized void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public synchronized void setRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
    }

    @Override
    public synchronized void saveTokens(String accessToken, String refreshToken) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
    }

    @Override
    public synchronized void clear() {
        accessToken = null;
        refreshToken = null;
    }
}
