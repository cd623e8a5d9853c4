package io.privx.sdk.exception;

/**
 * Exception thrown when authentication fails.
 */
public class AuthenticationException extends PrivxException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException tokenExpired() {
        return new AuthenticationException("Access token expired or invalid");
    }

    public static AuthenticationException invalidCredentials() {
        return new AuthenticationException("Invalid API client credentials");
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException("API client ID and secret are required");
    }
}
