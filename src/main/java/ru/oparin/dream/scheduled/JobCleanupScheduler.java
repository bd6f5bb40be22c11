package ru.oparin.dream.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.service.queue.GenerationJobStore;

import java.time.Clock;
import java.time.Instant;

/**
 * Удаление завершенных задач и их результатов старше app.generation.job-retention.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobCleanupScheduler {

    private final GenerationJobStore jobStore;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.generation.cleanup-interval:PT10M}",
            initialDelayString = "${app.generation.cleanup-interval:PT10M}")
    public void cleanupFinishedJobs() {
        try {
            Instant threshold = clock.instant().minus(generationProperties.getJobRetention());
            int removed = jobStore.evictTerminalBefore(threshold);
            if (removed > 0) {
                log.info("Очистка задач завершена. Удалено задач: {}", removed);
            }
        } catch (Exception e) {
            log.error("Ошибка при очистке завершенных задач", e);
        }
    }
}
