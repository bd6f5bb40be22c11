package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dream.exception.AdmissionRejectedException;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.GenerationResponse;
import ru.oparin.dream.model.dto.QueueStatusDTO;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.service.GenerationService;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.queue.JobProgressListener;

/**
 * Контроллер постановки задач генерации в очередь.
 * Статус и результат задачи запрашиваются через {@link JobController}.
 */
@Slf4j
@RestController
@RequestMapping("/generate")
@RequiredArgsConstructor
@Tag(name = "Generate", description = "API для постановки задач генерации в очередь Stable Diffusion")
public class GenerateController {

    private final GenerationService generationService;
    private final GenerationQueueService queueService;

    /**
     * Генерация по текстовому описанию.
     *
     * @param request параметры генерации
     * @return принятая задача
     */
    @Operation(summary = "Генерация по тексту (txt2img)",
            description = "Ставит задачу в очередь и возвращает идентификатор для отслеживания статуса")
    @PostMapping("/txt2img")
    public Mono<ResponseEntity<GenerationResponse>> txt2img(@Valid @RequestBody GenerationRequest request) {
        return submit(request, JobKind.TXT2IMG, null);
    }

    /**
     * Генерация с разбиением кадра на регионы.
     */
    @Operation(summary = "Региональная генерация",
            description = "Каждый регион кадра получает свой промпт по выбранной схеме")
    @PostMapping("/regional")
    public Mono<ResponseEntity<GenerationResponse>> regional(@Valid @RequestBody GenerationRequest request) {
        return submit(request, JobKind.REGIONAL, null);
    }

    /**
     * Генерация на основе исходного изображения.
     *
     * @param request параметры генерации (JSON часть request)
     * @param image   исходное изображение
     */
    @Operation(summary = "Генерация по изображению (img2img)")
    @PostMapping(value = "/img2img", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<GenerationResponse>> img2img(@Valid @RequestPart("request") GenerationRequest request,
                                                            @RequestPart("image") FilePart image) {
        return readBytes(image)
                .flatMap(bytes -> submit(request, JobKind.IMG2IMG, bytes));
    }

    /**
     * Генерация с ControlNet. Изображение необязательно: без него используются препроцессоры юнитов без входа.
     */
    @Operation(summary = "Генерация с ControlNet",
            description = "Если юниты не переданы в запросе, используются юниты, сохраненные в сессии пользователя")
    @PostMapping(value = "/controlnet", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<GenerationResponse>> controlNet(@Valid @RequestPart("request") GenerationRequest request,
                                                               @RequestPart(value = "image", required = false) FilePart image) {
        if (image == null) {
            return submit(request, JobKind.CONTROLNET, null);
        }
        return readBytes(image)
                .flatMap(bytes -> submit(request, JobKind.CONTROLNET, bytes));
    }

    /**
     * Состояние очереди.
     */
    @Operation(summary = "Состояние очереди", description = "Количество ожидающих задач и задача в работе")
    @GetMapping("/queue")
    public Mono<ResponseEntity<QueueStatusDTO>> queueStatus() {
        return Mono.fromSupplier(queueService::snapshot)
                .map(ResponseEntity::ok);
    }

    private Mono<ResponseEntity<GenerationResponse>> submit(GenerationRequest request, JobKind kind, byte[] image) {
        return generationService.submit(request, kind, image, JobProgressListener.NONE)
                .map(ResponseEntity::ok)
                .doOnError(error -> {
                    if (error instanceof AdmissionRejectedException || error instanceof RequestValidationException) {
                        // Ожидаемые отказы логируем без стектрейса
                        log.warn("Задача {} пользователя {} не принята: {}", kind, request.getUserId(), error.getMessage());
                    } else {
                        log.error("Ошибка при постановке задачи {} пользователя {}", kind, request.getUserId(), error);
                    }
                });
    }

    private Mono<byte[]> readBytes(FilePart part) {
        return DataBufferUtils.join(part.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                });
    }
}
