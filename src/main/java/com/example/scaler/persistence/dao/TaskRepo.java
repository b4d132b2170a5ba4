package com.example.scaler.persistence.dao;

import com.example.scaler.persistence.entity.TaskDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

public interface TaskRepo extends ReactiveMongoRepository<TaskDoc, String>, TaskRepoCustom {
}
