package com.example.scaler.tasks;

import com.example.scaler.config.ScalerProps;
import com.example.scaler.persistence.dao.TaskRepo;
import com.example.scaler.persistence.entity.TaskDoc;
import com.example.scaler.persistence.entity.TaskStatus;
import com.example.scaler.scaling.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Puts demo sleep tasks on a queue so there is backlog to scale on. Running them is up to the workflow engine.
 */
@Service
public class TaskSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

    public static final String SLEEP_WORKFLOW = "SleepWorkflow";

    private final TaskRepo taskRepo;
    private final ScalerProps props;

    public TaskSubmissionService(TaskRepo taskRepo, ScalerProps props) {
        this.taskRepo = taskRepo;
        this.props = props;
    }

    /**
     * @param queueName target queue, the configured default queue when null or blank
     */
    public Mono<TaskDoc> submitSleep(String queueName, int durationSeconds) {
        if (durationSeconds < 0) {
            return Mono.error(new InvalidTaskRequestException("duration must be >= 0, got " + durationSeconds));
        }
        String queue = queueName == null || queueName.isBlank() ? props.defaultQueue() : queueName;

        Instant now = Instant.now();
        TaskDoc task = new TaskDoc(
                UUID.randomUUID().toString(),
                queue,
                SLEEP_WORKFLOW,
                TaskStatus.ENQUEUED.name(),
                Map.of("duration_seconds", durationSeconds),
                now,
                now
        );

        return taskRepo.save(task)
                .timeout(Duration.ofMillis(props.timeoutMs()))
                .doOnSuccess(t -> log.info("scaler: enqueued {} id={} queue={} duration={}s",
                        SLEEP_WORKFLOW, t.id(), t.queueName(), durationSeconds))
                .onErrorMap(DataAccessException.class,
                        e -> new BackendUnavailableException("failed to enqueue workflow: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new BackendUnavailableException("enqueue timed out after " + props.timeoutMs() + "ms", e));
    }
}
