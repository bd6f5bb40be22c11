package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;

/**
 * Ответ на постановку задачи в очередь.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Задача, принятая в очередь")
public class GenerationResponse {

    @Schema(description = "Идентификатор задачи")
    private String jobId;

    private JobKind kind;

    private JobStatus status;

    /** Позиция в очереди на момент постановки, 1 - следующая на выполнение. */
    @Schema(description = "Позиция в очереди")
    private Integer position;

    private String message;
}
