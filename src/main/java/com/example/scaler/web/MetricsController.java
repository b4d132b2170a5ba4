package com.example.scaler.web;

import com.example.scaler.scaling.ScalingService;
import com.example.scaler.web.dto.MetricsResponse;
import com.example.scaler.web.dto.QueueStatusView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
public class MetricsController {

    private final ScalingService scaling;

    public MetricsController(ScalingService scaling) {
        this.scaling = scaling;
    }

    @GetMapping("/metrics")
    public Mono<MetricsResponse> metrics() {
        return scaling.poll()
                .map(d -> new MetricsResponse(d.expectedWorkers()));
    }

    @GetMapping("/api/queues")
    public Flux<QueueStatusView> queues() {
        return scaling.queues()
                .flatMapIterable(list -> list)
                .map(QueueStatusView::of);
    }
}
