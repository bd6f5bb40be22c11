package ru.oparin.dream.service.admission;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.exception.AdmissionRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Сервис допуска задач в очередь.
 * <p>
 * Обычный пользователь может иметь не больше одной задачи в очереди или в работе
 * и после завершения задачи ждет app.generation.cooldown. Проверки и установка флага
 * генерации выполняются одной атомарной операцией над записью пользователя,
 * поэтому два почти одновременных запроса не пройдут оба.
 * <p>
 * Привилегированные пользователи проходят без проверок, а их задачи не запускают
 * интервал ожидания.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private final Cache<String, AdmissionState> admissionStates;
    private final GenerationProperties generationProperties;
    private final Clock clock;

    /**
     * Проверить, относится ли пользователь к привилегированным.
     *
     * @param callerId идентификатор пользователя
     * @return true, если пользователь указан в app.generation.privileged-callers
     */
    public boolean isPrivileged(String callerId) {
        return generationProperties.getPrivilegedCallers().contains(callerId);
    }

    /**
     * Допустить задачу пользователя.
     *
     * @param callerId   идентификатор пользователя
     * @param privileged пропустить проверки
     * @return тикет, который нужно закрыть по завершении задачи
     * @throws AdmissionRejectedException если у пользователя уже есть активная задача или не истек интервал ожидания
     */
    public AdmissionTicket tryAdmit(String callerId, boolean privileged) {
        if (privileged) {
            admissionStates.asMap().compute(callerId,
                    (key, state) -> (state == null ? AdmissionState.idle() : state).startGenerating());
            log.debug("Привилегированный пользователь {} допущен без проверок", callerId);
            return new AdmissionTicket(callerId, true, () -> release(callerId, true));
        }

        AtomicReference<AdmissionRejectedException> rejection = new AtomicReference<>();
        admissionStates.asMap().compute(callerId, (key, state) -> {
            AdmissionState current = state == null ? AdmissionState.idle() : state;
            if (current.isGenerating()) {
                rejection.set(AdmissionRejectedException.alreadyGenerating());
                return state;
            }
            if (current.getLastCompletedAt() != null) {
                Instant now = clock.instant();
                Instant retryAt = current.getLastCompletedAt().plus(generationProperties.getCooldown());
                if (now.isBefore(retryAt)) {
                    rejection.set(AdmissionRejectedException.cooldown(secondsUntil(now, retryAt), retryAt));
                    return state;
                }
            }
            return current.startGenerating();
        });

        if (rejection.get() != null) {
            log.info("Задача пользователя {} отклонена: {}", callerId, rejection.get().getReason());
            throw rejection.get();
        }
        return new AdmissionTicket(callerId, false, () -> release(callerId, false));
    }

    /**
     * Текущее состояние допуска пользователя.
     *
     * @param callerId идентификатор пользователя
     * @return состояние, {@link AdmissionState#idle()} если пользователь еще ничего не генерировал
     */
    public AdmissionState getState(String callerId) {
        AdmissionState state = admissionStates.getIfPresent(callerId);
        return state == null ? AdmissionState.idle() : state;
    }

    private void release(String callerId, boolean privileged) {
        Instant now = clock.instant();
        admissionStates.asMap().compute(callerId, (key, state) -> {
            AdmissionState current = state == null ? AdmissionState.idle() : state;
            return privileged ? current.finishedWithoutCooldown() : current.finishedAt(now);
        });
        log.debug("Блокировка пользователя {} снята", callerId);
    }

    private static long secondsUntil(Instant now, Instant retryAt) {
        long millis = Duration.between(now, retryAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
