package com.example.scaler.scaling;

/**
 * Base type for every failure of a single poll.
 */
public abstract class ScalingException extends RuntimeException {

    protected ScalingException(String message) {
        super(message);
    }

    protected ScalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
