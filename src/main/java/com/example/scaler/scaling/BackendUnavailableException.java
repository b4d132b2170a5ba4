package com.example.scaler.scaling;

/**
 * The queue backend could not be reached, timed out, or answered with an error status.
 */
public class BackendUnavailableException extends ScalingException {
    private final int status;

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public BackendUnavailableException(int status, String body) {
        super("queue backend error status=" + status + " body=" + body);
        this.status = status;
    }

    /**
     * HTTP status returned by the backend, or 0 when no response was received.
     */
    public int status() {
        return status;
    }
}
