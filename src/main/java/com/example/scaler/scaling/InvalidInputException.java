package com.example.scaler.scaling;

/**
 * Raised by {@link ScalingEstimator} for negative concurrency or backlog values.
 */
public class InvalidInputException extends ScalingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
