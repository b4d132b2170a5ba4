package com.example.scaler.persistence.dao;

import com.example.scaler.persistence.entity.QueueBacklogCount;
import reactor.core.publisher.Flux;

public interface TaskRepoCustom {
    /**
     * One row per queue holding at least one ENQUEUED or PENDING task.
     */
    Flux<QueueBacklogCount> countBacklogByQueue();
}
