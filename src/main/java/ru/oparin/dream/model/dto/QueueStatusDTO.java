package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Снимок состояния очереди генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Состояние очереди генерации")
public class QueueStatusDTO {

    /** Количество ожидающих задач. */
    private int queued;

    /** Идет ли сейчас генерация. */
    private boolean processing;

    /** Идентификатор задачи в работе. */
    private String processingJobId;
}
