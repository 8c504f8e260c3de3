package com.olympus.api.exception;

/**
 * The session can no longer be recovered: the access token was rejected and the
 * refresh failed. Stored credentials have been cleared; the user must sign in again.
 */
public class SessionExpiredException extends ApiException {

    public SessionExpiredException(String message) {
        super(ApiErrorType.UNAUTHORIZED, message, 401, null);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(ApiErrorType.UNAUTHORIZED, message, 401, null, cause);
    }
}
