package com.example.scaler.scaling;

import com.example.scaler.admin.QueueAdminClient;
import com.example.scaler.admin.dto.QueueDescriptor;
import com.example.scaler.config.ScalerProps;
import com.example.scaler.persistence.dao.TaskRepo;
import com.example.scaler.persistence.entity.QueueBacklogCount;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Reads queue configuration from the engine admin server and the backlog from the task store.
 * Both queries run concurrently; either failing fails the whole snapshot.
 */
@Component
public class WorkflowQueueIntrospector implements QueueIntrospector {

    private final QueueAdminClient adminClient;
    private final TaskRepo taskRepo;
    private final ScalerProps props;

    public WorkflowQueueIntrospector(QueueAdminClient adminClient, TaskRepo taskRepo, ScalerProps props) {
        this.adminClient = adminClient;
        this.taskRepo = taskRepo;
        this.props = props;
    }

    @Override
    public Mono<QueueState> fetchQueueState() {
        return Mono.zip(
                        adminClient.listQueues().map(WorkflowQueueIntrospector::toConcurrencyMap),
                        backlog()
                )
                .map(t -> new QueueState(t.getT1(), t.getT2()));
    }

    private Mono<Map<String, Long>> backlog() {
        return taskRepo.countBacklogByQueue()
                .collectList()
                .map(WorkflowQueueIntrospector::toBacklogMap)
                .timeout(Duration.ofMillis(props.timeoutMs()))
                .onErrorMap(DataAccessException.class,
                        e -> new BackendUnavailableException("failed to list queued tasks: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new BackendUnavailableException("listing queued tasks timed out after " + props.timeoutMs() + "ms", e));
    }

    static Map<String, Integer> toConcurrencyMap(List<QueueDescriptor> queues) {
        Map<String, Integer> out = new HashMap<>();
        for (QueueDescriptor q : queues) {
            if (q == null || q.name() == null || q.name().isBlank()) {
                throw new MalformedResponseException("queue metadata entry without a name: " + q);
            }
            int concurrency = q.workerConcurrency() == null ? 0 : q.workerConcurrency();
            if (out.put(q.name(), concurrency) != null) {
                throw new MalformedResponseException("duplicate queue in metadata: " + q.name());
            }
        }
        return out;
    }

    static Map<String, Long> toBacklogMap(List<QueueBacklogCount> rows) {
        Map<String, Long> out = new HashMap<>();
        for (QueueBacklogCount row : rows) {
            out.merge(row.name(), row.count(), Long::sum);
        }
        return out;
    }
}
