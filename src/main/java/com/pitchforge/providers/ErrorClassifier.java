package com.pitchforge.providers;

import java.util.Locale;

/**
 * Maps a failed HTTP exchange to an {@link ErrorKind}. Only adapters call this;
 * everything past the adapter boundary dispatches on the enum.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorKind classify(int status, String body) {
        var byStatus = fromStatus(status);
        if (byStatus != null) return byStatus;
        var byBody = fromBody(body);
        return byBody != null ? byBody : ErrorKind.TRANSIENT;
    }

    /** Status codes that identify the failure on their own; null otherwise. */
    static ErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) return ErrorKind.AUTH_INVALID;
        if (status == 404) return ErrorKind.MODEL_NOT_FOUND;
        if (status == 429) return ErrorKind.RATE_LIMITED;
        return null;
    }

    static ErrorKind fromBody(String body) {
        if (body == null || body.isBlank()) return null;
        var msg = body.toLowerCase(Locale.ROOT);
        if (msg.contains("model_not_found") || msg.contains("model not found")
                || msg.contains("no such model") || msg.contains("does not exist")) {
            return ErrorKind.MODEL_NOT_FOUND;
        }
        if (msg.contains("rate limit") || msg.contains("rate_limit")
                || msg.contains("quota exceeded") || msg.contains("too many requests")) {
            return ErrorKind.RATE_LIMITED;
        }
        if (msg.contains("invalid_api_key") || msg.contains("unauthorized")
                || msg.contains("authentication")) {
            return ErrorKind.AUTH_INVALID;
        }
        return null;
    }
}
