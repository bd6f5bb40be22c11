package ru.oparin.dream.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.dream.exception.GenerationClientException;
import ru.oparin.dream.model.dto.QueueStatusDTO;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.sd.GenerationClient;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final GenerationClient generationClient;
    private final GenerationQueueService queueService;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return generationClient.checkStatus()
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(buildHealth("healthy", null))))
                .onErrorResume(GenerationClientException.class, error -> {
                    log.warn("Stable Diffusion недоступен: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(503).body(buildHealth("unhealthy", error.getMessage())));
                });
    }

    private Map<String, Object> buildHealth(String status, String error) {
        QueueStatusDTO queue = queueService.snapshot();
        Map<String, Object> health = new HashMap<>();
        health.put("status", status);
        health.put("queued", queue.getQueued());
        health.put("processing", queue.isProcessing());
        if (error != null) {
            health.put("error", error);
        }
        return health;
    }
}
