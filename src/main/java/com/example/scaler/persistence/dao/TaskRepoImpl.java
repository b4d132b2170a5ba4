package com.example.scaler.persistence.dao;

import com.example.scaler.persistence.entity.QueueBacklogCount;
import com.example.scaler.persistence.entity.TaskStatus;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import reactor.core.publisher.Flux;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;

public class TaskRepoImpl implements TaskRepoCustom {
    private final ReactiveMongoOperations mongo;

    public TaskRepoImpl(ReactiveMongoOperations mongo) {
        this.mongo = mongo;
    }

    @Override
    public Flux<QueueBacklogCount> countBacklogByQueue() {
        Aggregation agg = newAggregation(
                match(new Criteria().andOperator(
                        Criteria.where("status").in(TaskStatus.nonTerminalNames()),
                        Criteria.where("queueName").exists(true).ne(null)
                )),
                group("queueName").count().as("count")
        );
        return mongo.aggregate(agg, "tasks", QueueBacklogCount.class);
    }
}
