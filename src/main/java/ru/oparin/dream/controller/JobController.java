package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.JobStatusDTO;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;
import ru.oparin.dream.service.queue.GenerationJobStore;
import ru.oparin.dream.service.queue.GenerationQueueService;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Контроллер статусов и результатов задач генерации.
 */
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Статус и результат задач генерации")
public class JobController {

    private final GenerationJobStore jobStore;
    private final GenerationQueueService queueService;

    @Operation(summary = "Статус задачи")
    @GetMapping("/{id}")
    public Mono<ResponseEntity<JobStatusDTO>> getStatus(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            GenerationJob job = jobStore.getStatus(id);
            OptionalInt position = queueService.positionOf(id);
            return ResponseEntity.ok(JobStatusDTO.from(job, position.isPresent() ? position.getAsInt() : null));
        });
    }

    /**
     * Результат задачи. До завершения задачи возвращает 404 с кодом RESULT_NOT_READY,
     * для несуществующей задачи - 404 с кодом JOB_NOT_FOUND.
     */
    @Operation(summary = "Результат задачи", description = "Изображения в base64 и метаданные генерации")
    @GetMapping("/{id}/result")
    public Mono<ResponseEntity<JobResult>> getResult(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(jobStore.getResult(id)));
    }

    @Operation(summary = "Позиция задачи в очереди", description = "position = null, если задача уже не ожидает")
    @GetMapping("/{id}/position")
    public Mono<ResponseEntity<Map<String, Object>>> getPosition(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            GenerationJob job = jobStore.getStatus(id);
            OptionalInt position = queueService.positionOf(id);
            Map<String, Object> body = new HashMap<>();
            body.put("jobId", id);
            body.put("status", job.getStatus());
            body.put("position", position.isPresent() ? position.getAsInt() : null);
            return ResponseEntity.ok(body);
        });
    }
}
