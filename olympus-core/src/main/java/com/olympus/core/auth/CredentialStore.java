package com.olympus.core.auth;

/**
 * Holds the current access and refresh tokens.
 *
 * Read by the HTTP pipeline and the real-time channel. Only the HTTP pipeline
 * writes to it (after a token refresh, or clearing it when the refresh fails).
 */
public interface CredentialStore {

    /** Current access token, or null if none is stored. */
    String getAccessToken();

    /** Current refresh token, or null if none is stored. */
    String getRefreshToken();

    void setAccessToken(String accessToken);

    void setRefreshToken(String refreshToken);

    /** Remove all stored credentials. */
    void clear();

    default void saveTokens(String accessToken, String refreshToken) {
        setAccessToken(accessToken);
        setRefreshToken(refreshToken);
    }

    default boolean hasAccessToken() {
        String token = getAccessToken();
        return token != null && !token.isEmpty();
    }
}
