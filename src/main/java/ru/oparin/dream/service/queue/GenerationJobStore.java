package ru.oparin.dream.service.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.dream.exception.JobNotFoundException;
import ru.oparin.dream.exception.ResultNotReadyException;
import ru.oparin.dream.model.dto.sd.GenerationOutput;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Хранилище задач генерации и их результатов.
 * <p>
 * Статус задачи доступен сразу после регистрации. Результат появляется один раз
 * при переходе в конечный статус и больше не меняется.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationJobStore {

    private final ConcurrentMap<String, GenerationJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, JobResult> results = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Зарегистрировать новую задачу в статусе QUEUED.
     *
     * @param userId  идентификатор пользователя
     * @param kind    вид задачи
     * @param payload запрос к Stable Diffusion
     * @return зарегистрированная задача
     */
    public GenerationJob register(String userId, JobKind kind, ResolvedPayload payload) {
        GenerationJob job = GenerationJob.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .kind(kind)
                .payload(payload)
                .status(JobStatus.QUEUED)
                .createdAt(clock.instant())
                .build();
        jobs.put(job.getId(), job);
        log.debug("Зарегистрирована задача {} пользователя {} ({})", job.getId(), userId, kind);
        return job;
    }

    /**
     * Получить текущее состояние задачи.
     *
     * @throws JobNotFoundException если задача не существует
     */
    public GenerationJob getStatus(String jobId) {
        GenerationJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Получить результат завершенной задачи.
     *
     * @throws JobNotFoundException    если задача не существует
     * @throws ResultNotReadyException если задача еще не завершена
     */
    public JobResult getResult(String jobId) {
        JobResult result = results.get(jobId);
        if (result != null) {
            return result;
        }
        GenerationJob job = getStatus(jobId);
        if (job.getStatus().isTerminal()) {
            // Задача завершилась между двумя чтениями
            return results.get(jobId);
        }
        throw new ResultNotReadyException(jobId, job.getStatus());
    }

    public GenerationJob markProcessing(String jobId) {
        return transition(jobId, JobStatus.PROCESSING, null, null);
    }

    /**
     * Перевести задачу в COMPLETED и сохранить результат.
     */
    public GenerationJob markCompleted(String jobId, GenerationOutput output) {
        JobResult result = JobResult.builder()
                .jobId(jobId)
                .status(JobStatus.COMPLETED)
                .images(output.getImages())
                .info(output.getInfo())
                .parameters(output.getParameters())
                .build();
        return transition(jobId, JobStatus.COMPLETED, null, result);
    }

    /**
     * Перевести задачу в FAILED.
     *
     * @param message текст для пользователя
     * @param error   исходный текст ошибки
     */
    public GenerationJob markFailed(String jobId, String message, String error) {
        JobResult result = JobResult.builder()
                .jobId(jobId)
                .status(JobStatus.FAILED)
                .error(error)
                .build();
        return transition(jobId, JobStatus.FAILED, message, result);
    }

    /**
     * Удалить завершенные задачи, перешедшие в конечный статус раньше указанного момента.
     *
     * @return количество удаленных задач
     */
    public int evictTerminalBefore(Instant threshold) {
        List<String> expired = jobs.values().stream()
                .filter(job -> job.getStatus().isTerminal())
                .filter(job -> job.getCompletedAt() != null && job.getCompletedAt().isBefore(threshold))
                .map(GenerationJob::getId)
                .toList();
        expired.forEach(jobId -> {
            results.remove(jobId);
            jobs.remove(jobId);
        });
        return expired.size();
    }

    /**
     * Результат записывается внутри атомарного обновления задачи,
     * поэтому задача в конечном статусе всегда видна вместе с результатом.
     */
    private GenerationJob transition(String jobId, JobStatus target, String message, JobResult result) {
        GenerationJob updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (!current.getStatus().canTransitionTo(target)) {
                throw new IllegalStateException(String.format(
                        "Недопустимый переход задачи %s: %s → %s", id, current.getStatus(), target));
            }
            if (result != null && results.putIfAbsent(id, result) != null) {
                log.warn("Результат задачи {} уже сохранен, повторная запись пропущена", id);
            }
            return current.toBuilder()
                    .status(target)
                    .message(message != null ? message : current.getMessage())
                    .completedAt(target.isTerminal() ? clock.instant() : null)
                    .build();
        });
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        log.debug("Задача {} переведена в статус {}", jobId, target);
        return updated;
    }
}
