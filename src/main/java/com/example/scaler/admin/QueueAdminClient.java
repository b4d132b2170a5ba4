package com.example.scaler.admin;

import com.example.scaler.admin.dto.QueueDescriptor;
import com.example.scaler.config.ScalerProps;
import com.example.scaler.scaling.BackendUnavailableException;
import com.example.scaler.scaling.MalformedResponseException;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Client for the workflow engine admin server.
 */
@Component
public class QueueAdminClient {

    static final String QUEUES_METADATA_PATH = "/dbos-workflow-queues-metadata";

    private final WebClient wc;
    private final ScalerProps props;

    public QueueAdminClient(WebClient queueAdminWebClient, ScalerProps props) {
        this.wc = queueAdminWebClient;
        this.props = props;
    }

    private Duration timeout() {
        return Duration.ofMillis(props.timeoutMs());
    }

    public Mono<List<QueueDescriptor>> listQueues() {
        return wc.get()
                .uri(QUEUES_METADATA_PATH)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toBackendError)
                .bodyToMono(QueueDescriptor[].class)
                .switchIfEmpty(Mono.error(() -> new MalformedResponseException("queue metadata response has no body")))
                .map(Arrays::asList)
                .timeout(timeout())
                .onErrorMap(CodecException.class,
                        e -> new MalformedResponseException("failed to decode queue metadata: " + e.getMessage(), e))
                .onErrorMap(UnsupportedMediaTypeException.class,
                        e -> new MalformedResponseException("unexpected queue metadata content type: " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new BackendUnavailableException("failed to fetch queue metadata: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new BackendUnavailableException("queue metadata request timed out after " + props.timeoutMs() + "ms", e));
    }

    private Mono<? extends Throwable> toBackendError(ClientResponse resp) {
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(new BackendUnavailableException(resp.statusCode().value(), body)));
    }
}
