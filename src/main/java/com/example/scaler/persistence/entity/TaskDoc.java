package com.example.scaler.persistence.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.TypeAlias;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Workflow task as stored in the queue backend system database.
 * status holds a {@link TaskStatus} name; only ENQUEUED and PENDING tasks count as backlog.
 */
@TypeAlias("TaskDoc")
@Document("tasks")
@CompoundIndex(
        name = "ix_tasks_status_queueName",
        def = "{'status': 1, 'queueName': 1}"
)
public record TaskDoc(
        @Id
        String id,
        String queueName,
        String workflowName,
        String status,
        Map<String, Object> input,
        Instant createdAt,
        Instant updatedAt
) {
}
