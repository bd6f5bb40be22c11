package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;

import java.time.Instant;

/**
 * Текущее состояние задачи генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Статус задачи генерации")
public class JobStatusDTO {

    private String jobId;
    private String userId;
    private JobKind kind;
    private JobStatus status;
    private Instant createdAt;
    private Instant completedAt;
    private String message;

    /** Позиция в очереди, null если задача уже не ожидает. */
    private Integer position;

    public static JobStatusDTO from(GenerationJob job, Integer position) {
        return JobStatusDTO.builder()
                .jobId(job.getId())
                .userId(job.getUserId())
                .kind(job.getKind())
                .status(job.getStatus())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .message(job.getMessage())
                .position(position)
                .build();
    }
}
