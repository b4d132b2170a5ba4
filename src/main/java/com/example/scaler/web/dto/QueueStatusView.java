package com.example.scaler.web.dto;

import com.example.scaler.scaling.ScalingEstimator;

public record QueueStatusView(
        String name,
        int workerConcurrency,
        long backlog,
        long demand,
        boolean capped
) {
    public static QueueStatusView of(ScalingEstimator.QueueDemand d) {
        return new QueueStatusView(d.name(), d.workerConcurrency(), d.backlog(), d.demand(), d.capped());
    }
}
