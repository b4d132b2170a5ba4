package com.example.scaler.persistence.entity;

import org.springframework.data.annotation.Id;

/**
 * Aggregation row: number of non-terminal tasks in one queue.
 */
public record QueueBacklogCount(
        @Id
        String name,
        long count
) {
}
