package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.dream.model.enums.AdmissionRejectionReason;

import java.time.Instant;

/**
 * Задача не принята: пользователь уже генерирует или не истек интервал ожидания.
 */
@Getter
public class AdmissionRejectedException extends RuntimeException {

    private final HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
    private final AdmissionRejectionReason reason;

    /** Сколько секунд осталось ждать, 0 для ALREADY_GENERATING. */
    private final long remainingSeconds;

    /** Момент, после которого можно повторить запрос, null для ALREADY_GENERATING. */
    private final Instant retryAt;

    private AdmissionRejectedException(String message, AdmissionRejectionReason reason, long remainingSeconds, Instant retryAt) {
        super(message);
        this.reason = reason;
        this.remainingSeconds = remainingSeconds;
        this.retryAt = retryAt;
    }

    public static AdmissionRejectedException alreadyGenerating() {
        return new AdmissionRejectedException("Дождитесь завершения текущей генерации",
                AdmissionRejectionReason.ALREADY_GENERATING, 0, null);
    }

    public static AdmissionRejectedException cooldown(long remainingSeconds, Instant retryAt) {
        return new AdmissionRejectedException(
                String.format("Подождите %d сек. перед следующей генерацией", remainingSeconds),
                AdmissionRejectionReason.COOLDOWN_ACTIVE, remainingSeconds, retryAt);
    }
}
