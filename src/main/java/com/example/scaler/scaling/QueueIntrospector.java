package com.example.scaler.scaling;

import reactor.core.publisher.Mono;

/**
 * Read side of the queue backend.
 * <p>
 * Each call issues fresh queries; implementations keep no state between calls and do not retry.
 * Errors are signalled as {@link BackendUnavailableException} or {@link MalformedResponseException}.
 */
public interface QueueIntrospector {
    Mono<QueueState> fetchQueueState();
}
