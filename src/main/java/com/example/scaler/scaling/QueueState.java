package com.example.scaler.scaling;

import java.util.Map;

/**
 * One snapshot of the queue backend.
 *
 * @param concurrencyByQueue every registered queue with its per-worker concurrency (0 = uncapped)
 * @param backlogByQueue     non-terminal task count per queue; queues without tasks are absent
 */
public record QueueState(
        Map<String, Integer> concurrencyByQueue,
        Map<String, Long> backlogByQueue
) {
    public QueueState {
        concurrencyByQueue = concurrencyByQueue == null ? Map.of() : Map.copyOf(concurrencyByQueue);
        backlogByQueue = backlogByQueue == null ? Map.of() : Map.copyOf(backlogByQueue);
    }
}
