package ru.oparin.dream.service.admission;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Состояние допуска одного пользователя. Неизменяемо, каждое изменение дает новый экземпляр.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AdmissionState {

    private static final AdmissionState IDLE = new AdmissionState(false, null);

    /** Есть задача в очереди или в работе. */
    private final boolean generating;

    /** Время завершения последней задачи, null если задач еще не было. */
    private final Instant lastCompletedAt;

    public static AdmissionState idle() {
        return IDLE;
    }

    AdmissionState startGenerating() {
        return new AdmissionState(true, lastCompletedAt);
    }

    AdmissionState finishedAt(Instant completedAt) {
        return new AdmissionState(false, completedAt);
    }

    AdmissionState finishedWithoutCooldown() {
        return new AdmissionState(false, lastCompletedAt);
    }
}
