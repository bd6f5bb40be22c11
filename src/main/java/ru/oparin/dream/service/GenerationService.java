package ru.oparin.dream.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.GenerationResponse;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.service.admission.AdmissionService;
import ru.oparin.dream.service.admission.AdmissionTicket;
import ru.oparin.dream.service.queue.GenerationJobStore;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.queue.JobProgressListener;

import java.util.Collection;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Прием задач генерации.
 * <p>
 * Порядок обработки запроса: проверка параметров, подготовка изображения, снимок сессии,
 * допуск пользователя, сборка запроса к Stable Diffusion, регистрация задачи и постановка в очередь.
 * Ошибки проверки возвращаются до допуска и не блокируют пользователя.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationService {

    private final Validator validator;
    private final ImageNormalizationService imageNormalizationService;
    private final AdmissionService admissionService;
    private final UserSessionService userSessionService;
    private final GenerationPayloadBuilder payloadBuilder;
    private final GenerationJobStore jobStore;
    private final GenerationQueueService queueService;

    /**
     * Поставить задачу генерации в очередь.
     *
     * @param request     запрос пользователя
     * @param kind        вид задачи
     * @param sourceImage исходное изображение для img2img и ControlNet, может быть null
     * @param listener    получатель уведомлений о ходе задачи
     * @return принятая задача
     */
    public Mono<GenerationResponse> submit(GenerationRequest request, JobKind kind, byte[] sourceImage,
                                          JobProgressListener listener) {
        return Mono.fromCallable(() -> submitBlocking(request, kind, sourceImage, listener))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private GenerationResponse submitBlocking(GenerationRequest request, JobKind kind, byte[] sourceImage,
                                              JobProgressListener listener) {
        validate(request, kind, sourceImage);
        String normalizedImage = sourceImage == null ? null : imageNormalizationService.normalize(sourceImage);

        String userId = request.getUserId();
        UserSession session = userSessionService.getSnapshot(userId);
        if (kind == JobKind.CONTROLNET && isEmpty(request.getControlNetUnits()) && isEmpty(session.getControlConfigs())) {
            throw new RequestValidationException("Не заданы юниты ControlNet ни в запросе, ни в сессии");
        }

        AdmissionTicket ticket = admissionService.tryAdmit(userId, admissionService.isPrivileged(userId));
        try {
            ResolvedPayload payload = payloadBuilder.build(request, kind, session, normalizedImage);
            GenerationJob job = jobStore.register(userId, kind, payload);
            int position = queueService.enqueue(job, ticket, listener);

            return GenerationResponse.builder()
                    .jobId(job.getId())
                    .kind(kind)
                    .status(job.getStatus())
                    .position(position)
                    .message("Задача поставлена в очередь")
                    .build();
        } catch (RuntimeException e) {
            ticket.close();
            throw e;
        }
    }

    private void validate(GenerationRequest request, JobKind kind, byte[] sourceImage) {
        if (request == null) {
            throw new RequestValidationException("Запрос не передан");
        }
        Set<ConstraintViolation<GenerationRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .collect(Collectors.joining("; "));
            throw new RequestValidationException(details);
        }
        if (kind == JobKind.REGIONAL && request.getRegional() == null) {
            throw new RequestValidationException("Для региональной генерации требуется схема регионов");
        }
        if (kind != JobKind.REGIONAL && (request.getPrompt() == null || request.getPrompt().isBlank())) {
            throw new RequestValidationException("Промпт не может быть пустым");
        }
        if (kind == JobKind.IMG2IMG && (sourceImage == null || sourceImage.length == 0)) {
            throw new RequestValidationException("Для img2img требуется исходное изображение");
        }
    }

    private static boolean isEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }
}
