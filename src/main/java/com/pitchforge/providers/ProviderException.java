package com.pitchforge.providers;

public class ProviderException extends RuntimeException {

    private final ErrorKind kind;
    private final String providerId;
    private final String modelId;
    private final int statusCode;

    public ProviderException(ErrorKind kind, String providerId, String modelId,
                             int statusCode, String message) {
        this(kind, providerId, modelId, statusCode, message, null);
    }

    public ProviderException(ErrorKind kind, String providerId, String modelId,
                             int statusCode, String message, Throwable cause) {
        super(providerId + "/" + modelId + " " + kind + ": " + message, cause);
        this.kind = kind;
        this.providerId = providerId;
        this.modelId = modelId;
        this.statusCode = statusCode;
    }

    public ErrorKind kind() { return kind; }

    public String providerId() { return providerId; }

    public String modelId() { return modelId; }

    /** HTTP status of the failed call, 0 when no response was received. */
    public int statusCode() { return statusCode; }
}
