package com.example.scaler.scaling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One poll: a fresh backend snapshot followed by the estimate. Keeps no state, so concurrent polls are independent.
 */
@Service
public class ScalingService {
    private static final Logger log = LoggerFactory.getLogger(ScalingService.class);

    private final QueueIntrospector introspector;
    private final ScalingEstimator estimator;

    public ScalingService(QueueIntrospector introspector, ScalingEstimator estimator) {
        this.introspector = introspector;
        this.estimator = estimator;
    }

    public Mono<ScalingDecision> poll() {
        return introspector.fetchQueueState()
                .map(state -> {
                    ScalingDecision decision = estimator.decide(state);
                    log.debug("scaler: queues={} backlog={} -> expectedWorkers={}",
                            state.concurrencyByQueue(), state.backlogByQueue(), decision.expectedWorkers());
                    return decision;
                })
                .doOnError(e -> log.warn("scaler: poll failed: {}", e.getMessage()));
    }

    public Mono<List<ScalingEstimator.QueueDemand>> queues() {
        return introspector.fetchQueueState()
                .map(estimator::breakdown);
    }
}
