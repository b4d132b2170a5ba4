package com.example.scaler.admin.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One registered queue as reported by the backend admin server. A missing concurrency means uncapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueueDescriptor(
        String name,
        Integer workerConcurrency
) {}
