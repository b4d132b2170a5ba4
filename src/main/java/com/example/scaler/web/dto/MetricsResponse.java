package com.example.scaler.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload read by the autoscaler's metrics-api trigger.
 */
public record MetricsResponse(
        @JsonProperty("expected_pods") int expectedPods
) {}
