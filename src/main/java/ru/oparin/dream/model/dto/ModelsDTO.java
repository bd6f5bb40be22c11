package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Модели и сэмплеры, доступные в Stable Diffusion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Доступные модели")
public class ModelsDTO {

    private List<String> checkpoints;
    private List<String> vaes;
    private List<String> samplers;
    private List<String> upscalers;
}
