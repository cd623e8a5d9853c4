package io.privx.sdk.exception;

import java.util.Map;

/**
 * Base exception for PrivX SDK errors.
 */
public class PrivxException extends RuntimeException {

    private final int statusCode;
    private final Map<String, Object> context;

    public PrivxException(String message) {
        this(message, 0, null, Map.of());
    }

    public PrivxException(String message, int statusCode) {
        this(message, statusCode, null, Map.of());
    }

    public PrivxException(String message, Throwable cause) {
        this(message, 0, cause, Map.of());
    }

    public PrivxException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context != null ? context : Map.of();
    }

    /**
     * HTTP status of the failed call, or 0 when the call never produced a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Decoded error body returned by the server, empty when there was none.
     */
    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * The PrivX {@code error_code} from the error body, or {@code null} if the server sent none.
     */
    public String getErrorCode() {
        Object code = context.get("error_code");
        return code != null ? code.toString() : null;
    }
}
