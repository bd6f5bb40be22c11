package ru.oparin.dream.model.entity;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import ru.oparin.dream.model.enums.JobStatus;

import java.util.List;

/**
 * Результат завершенной задачи. Создается один раз при переходе в конечный статус.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "images")
public class JobResult {

    private final String jobId;
    private final JobStatus status;

    /** Изображения в base64 (PNG). */
    private final List<String> images;

    /** Разобранное поле info из ответа Stable Diffusion. */
    private final JsonNode info;

    /** Параметры, с которыми выполнялась генерация. */
    private final JsonNode parameters;

    /** Текст ошибки от Stable Diffusion, только для FAILED. */
    private final String error;

    @Builder
    private JobResult(String jobId, JobStatus status, List<String> images, JsonNode info, JsonNode parameters, String error) {
        this.jobId = jobId;
        this.status = status;
        this.images = images == null ? List.of() : List.copyOf(images);
        this.info = info == null ? null : info.deepCopy();
        this.parameters = parameters == null ? null : parameters.deepCopy();
        this.error = error;
    }

    public JsonNode getInfo() {
        return info == null ? null : info.deepCopy();
    }

    public JsonNode getParameters() {
        return parameters == null ? null : parameters.deepCopy();
    }
}
