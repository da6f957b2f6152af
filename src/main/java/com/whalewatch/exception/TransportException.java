package com.whalewatch.exception;

import java.util.Locale;

/**
 * Failure reported by a stream transport: connect or subscribe timeouts, dropped sockets,
 * rejected requests.
 *
 * <p>Authorization-class failures ({@link ErrorCode#TRANSPORT_UNAUTHORIZED}) are permanent
 * for the slot that saw them and are never retried.
 */
public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }

    public TransportException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static TransportException timeout(String message) {
        return new TransportException(ErrorCode.TRANSPORT_TIMEOUT, message);
    }

    public static TransportException unauthorized(String message) {
        return new TransportException(ErrorCode.TRANSPORT_UNAUTHORIZED, message);
    }

    public boolean isAuthorization() {
        return getErrorCode() == ErrorCode.TRANSPORT_UNAUTHORIZED;
    }

    /**
     * Classifies a provider error text. Messages mentioning "unauthorized" or "forbidden"
     * are authorization-class.
     */
    public static boolean looksUnauthorized(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("unauthorized") || lower.contains("forbidden");
    }
}
