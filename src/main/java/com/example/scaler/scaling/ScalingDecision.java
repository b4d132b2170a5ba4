package com.example.scaler.scaling;

public record ScalingDecision(int expectedWorkers) {
    public ScalingDecision {
        if (expectedWorkers < 1) {
            throw new IllegalArgumentException("expectedWorkers must be >= 1");
        }
    }
}
