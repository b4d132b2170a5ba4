package com.example.scaler.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnqueueResponse(
        String message,
        @JsonProperty("workflow_id") String workflowId,
        String queue,
        int duration
) {
    public static EnqueueResponse enqueued(String workflowId, String queue, int duration) {
        return new EnqueueResponse("Workflow enqueued successfully", workflowId, queue, duration);
    }
}
