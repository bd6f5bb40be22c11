package ru.oparin.dream.model.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;

import java.time.Instant;

/**
 * Задача генерации.
 * Экземпляр неизменяем: каждый переход статуса создает новую копию через {@link #toBuilder()}.
 */
@Getter
@ToString(exclude = "payload")
@Builder(toBuilder = true)
public class GenerationJob {

    private final String id;
    private final String userId;
    private final JobKind kind;
    private final ResolvedPayload payload;
    private final JobStatus status;
    private final Instant createdAt;

    /**
     * Время перехода в конечный статус.
     */
    private final Instant completedAt;

    /**
     * Сообщение для пользователя (причина ошибки и т.п.).
     */
    private final String message;
}
