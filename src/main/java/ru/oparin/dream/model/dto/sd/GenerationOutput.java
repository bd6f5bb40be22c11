package ru.oparin.dream.model.dto.sd;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Результат генерации от Stable Diffusion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationOutput {

    /** Изображения в base64. */
    private List<String> images;

    /** Метаданные генерации (seed, модель и т.д.). */
    private JsonNode info;

    private JsonNode parameters;
}
