package com.example.scaler.web;

import com.example.scaler.tasks.InvalidTaskRequestException;
import com.example.scaler.tasks.TaskSubmissionService;
import com.example.scaler.web.dto.EnqueueResponse;
import com.example.scaler.web.dto.SubmitTaskRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class TasksController {

    private final TaskSubmissionService tasks;

    public TasksController(TaskSubmissionService tasks) {
        this.tasks = tasks;
    }

    @GetMapping("/enqueue/{duration}")
    public Mono<EnqueueResponse> enqueue(@PathVariable String duration,
                                         @RequestParam(required = false) String queue) {
        int seconds;
        try {
            seconds = Integer.parseInt(duration);
        } catch (NumberFormatException e) {
            return Mono.error(new InvalidDurationException(duration, e));
        }
        if (seconds < 0) {
            return Mono.error(new InvalidDurationException(duration, null));
        }
        return submit(queue, seconds);
    }

    @PostMapping("/api/tasks")
    public Mono<EnqueueResponse> create(@RequestBody @Valid SubmitTaskRequest req) {
        return submit(req.queue(), req.durationSeconds());
    }

    private Mono<EnqueueResponse> submit(String queue, int seconds) {
        return tasks.submitSleep(queue, seconds)
                .map(t -> EnqueueResponse.enqueued(t.id(), t.queueName(), seconds));
    }

    static class InvalidDurationException extends InvalidTaskRequestException {
        InvalidDurationException(String raw, Throwable cause) {
            super("Invalid duration: " + raw, cause);
        }
    }
}
