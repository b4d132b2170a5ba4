package com.example.scaler.scaling;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns a queue snapshot into the number of worker replicas the autoscaler should aim for.
 * <p>
 * Policy:
 * <ul>
 *     <li>only queues with a worker concurrency above 0 are considered; uncapped queues never add replicas</li>
 *     <li>per queue, {@code demand = ceil(backlog / concurrency)}, a queue without backlog entry has demand 0</li>
 *     <li>the fleet size is the maximum demand over all queues (workers are generic and serve every queue)</li>
 *     <li>the result is never below 1</li>
 * </ul>
 * Stateless and free of I/O.
 */
@Component
public class ScalingEstimator {

    public static final int MIN_WORKERS = 1;

    public int estimate(Map<String, Integer> concurrencyByQueue, Map<String, Long> backlogByQueue) {
        validate(concurrencyByQueue, backlogByQueue);

        long max = 0L;
        for (Map.Entry<String, Integer> e : concurrencyByQueue.entrySet()) {
            int concurrency = valueOf(e.getValue());
            if (concurrency <= 0) {
                continue;
            }
            long demand = demand(valueOf(backlogByQueue.get(e.getKey())), concurrency);
            if (demand > max) {
                max = demand;
            }
        }

        return (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_WORKERS, max));
    }

    public ScalingDecision decide(QueueState state) {
        return new ScalingDecision(estimate(state.concurrencyByQueue(), state.backlogByQueue()));
    }

    /**
     * Per-queue view of a snapshot, sorted by queue name. Includes uncapped queues with demand 0.
     */
    public List<QueueDemand> breakdown(QueueState state) {
        validate(state.concurrencyByQueue(), state.backlogByQueue());

        List<QueueDemand> out = new ArrayList<>(state.concurrencyByQueue().size());
        state.concurrencyByQueue().forEach((name, concurrency) -> {
            long backlog = valueOf(state.backlogByQueue().get(name));
            int c = valueOf(concurrency);
            out.add(new QueueDemand(name, c, backlog, c > 0 ? demand(backlog, c) : 0L));
        });
        out.sort(Comparator.comparing(QueueDemand::name));
        return out;
    }

    /**
     * Integer ceiling of {@code backlog / concurrency}; {@code concurrency} must be positive.
     */
    public static long demand(long backlog, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        return -Math.floorDiv(-backlog, (long) concurrency);
    }

    private static void validate(Map<String, Integer> concurrencyByQueue, Map<String, Long> backlogByQueue) {
        if (concurrencyByQueue == null || backlogByQueue == null) {
            throw new InvalidInputException("queue mappings must not be null");
        }
        concurrencyByQueue.forEach((name, concurrency) -> {
            if (concurrency != null && concurrency < 0) {
                throw new InvalidInputException("negative worker concurrency " + concurrency + " for queue " + name);
            }
        });
        backlogByQueue.forEach((name, backlog) -> {
            if (backlog != null && backlog < 0) {
                throw new InvalidInputException("negative backlog " + backlog + " for queue " + name);
            }
        });
    }

    private static int valueOf(Integer v) {
        return v == null ? 0 : v;
    }

    private static long valueOf(Long v) {
        return v == null ? 0L : v;
    }

    public record QueueDemand(String name, int workerConcurrency, long backlog, long demand) {
        public boolean capped() {
            return workerConcurrency > 0;
        }
    }
}
