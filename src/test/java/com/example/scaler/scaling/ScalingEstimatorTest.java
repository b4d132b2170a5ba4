package com.example.scaler.scaling;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScalingEstimatorTest {

    private final ScalingEstimator estimator = new ScalingEstimator();

    @Test
    void usesCeilingDivisionPerQueue() {
        assertThat(estimator.estimate(Map.of("q", 1), Map.of("q", 0L))).isEqualTo(1);
        assertThat(estimator.estimate(Map.of("q", 1), Map.of("q", 10L))).isEqualTo(10);
        assertThat(estimator.estimate(Map.of("q", 2), Map.of("q", 10L))).isEqualTo(5);
        assertThat(estimator.estimate(Map.of("q", 3), Map.of("q", 10L))).isEqualTo(4);
    }

    @Test
    void takesTheBusiestQueueNotTheSum() {
        int workers = estimator.estimate(Map.of("q1", 2, "q2", 5), Map.of("q1", 10L, "q2", 5L));

        assertThat(workers).isEqualTo(5);
    }

    @Test
    void uncappedQueuesNeverChangeTheResult() {
        int withUncapped = estimator.estimate(Map.of("q1", 0, "q2", 2), Map.of("q1", 1000L, "q2", 4L));
        int without = estimator.estimate(Map.of("q2", 2), Map.of("q2", 4L));

        assertThat(withUncapped).isEqualTo(2).isEqualTo(without);
    }

    @Test
    void returnsOneWhenNothingIsCapped() {
        assertThat(estimator.estimate(Map.of(), Map.of())).isEqualTo(1);
        assertThat(estimator.estimate(Map.of("q", 0), Map.of("q", 50L))).isEqualTo(1);
        assertThat(estimator.estimate(Map.of(), Map.of("orphan", 7L))).isEqualTo(1);
    }

    @Test
    void returnsOneWhenEveryBacklogIsZero() {
        assertThat(estimator.estimate(Map.of("a", 1, "b", 3), Map.of("a", 0L, "b", 0L))).isEqualTo(1);
    }

    @Test
    void queueWithoutBacklogEntryContributesNothing() {
        assertThat(estimator.estimate(Map.of("idle", 1), Map.of())).isEqualTo(1);
        assertThat(estimator.estimate(Map.of("idle", 1, "busy", 2), Map.of("busy", 7L))).isEqualTo(4);
    }

    @Test
    void backlogOfUnregisteredQueueIsIgnored() {
        assertThat(estimator.estimate(Map.of("q", 5), Map.of("q", 5L, "unknown", 100L))).isEqualTo(1);
    }

    @Test
    void nullValuesAreTreatedAsAbsent() {
        Map<String, Integer> concurrency = new HashMap<>();
        concurrency.put("uncapped", null);
        concurrency.put("q", 2);
        Map<String, Long> backlog = new HashMap<>();
        backlog.put("uncapped", 99L);
        backlog.put("q", null);

        assertThat(estimator.estimate(concurrency, backlog)).isEqualTo(1);
    }

    @Test
    void rejectsNegativeConcurrency() {
        assertThatThrownBy(() -> estimator.estimate(Map.of("q", -1), Map.of("q", 3L)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("q");
    }

    @Test
    void rejectsNegativeBacklog() {
        assertThatThrownBy(() -> estimator.estimate(Map.of("q", 1), Map.of("q", -3L)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> estimator.estimate(Map.of("q", 1), Map.of("other", -1L)))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsNullMappings() {
        assertThatThrownBy(() -> estimator.estimate(null, Map.of()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> estimator.estimate(Map.of(), null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void isIdempotent() {
        Map<String, Integer> concurrency = Map.of("a", 3, "b", 7, "c", 0);
        Map<String, Long> backlog = Map.of("a", 11L, "b", 30L, "c", 4L);

        int first = estimator.estimate(concurrency, backlog);
        int second = estimator.estimate(concurrency, backlog);

        assertThat(first).isEqualTo(5).isEqualTo(second);
    }

    @Test
    void saturatesInsteadOfOverflowing() {
        assertThat(estimator.estimate(Map.of("q", 1), Map.of("q", Long.MAX_VALUE))).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void neverRecommendsLessThanOneWorker() {
        int[] concurrencies = {0, 1, 2, 3, 10};
        long[] backlogs = {0, 1, 2, 9, 10, 11, 1000};
        for (int c : concurrencies) {
            for (long b : backlogs) {
                assertThat(estimator.estimate(Map.of("q", c), Map.of("q", b)))
                        .as("concurrency=%d backlog=%d", c, b)
                        .isGreaterThanOrEqualTo(1);
            }
        }
    }

    @Test
    void decideWrapsTheEstimate() {
        ScalingDecision decision = estimator.decide(new QueueState(Map.of("q", 2), Map.of("q", 3L)));

        assertThat(decision.expectedWorkers()).isEqualTo(2);
    }

    @Test
    void breakdownListsEveryQueueSortedByName() {
        QueueState state = new QueueState(Map.of("b", 2, "a", 0, "c", 4), Map.of("a", 5L, "b", 3L));

        assertThat(estimator.breakdown(state)).containsExactly(
                new ScalingEstimator.QueueDemand("a", 0, 5L, 0L),
                new ScalingEstimator.QueueDemand("b", 2, 3L, 2L),
                new ScalingEstimator.QueueDemand("c", 4, 0L, 0L)
        );
    }

    @Test
    void demandRequiresPositiveConcurrency() {
        assertThat(ScalingEstimator.demand(0L, 4)).isZero();
        assertThat(ScalingEstimator.demand(1L, 4)).isEqualTo(1L);
        assertThatThrownBy(() -> ScalingEstimator.demand(1L, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
