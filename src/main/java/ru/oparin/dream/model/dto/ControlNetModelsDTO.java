package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Модели и препроцессоры расширения ControlNet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Доступные модели ControlNet")
public class ControlNetModelsDTO {

    @Schema(description = "Модели, значение поля model юнита", example = "[\"control_v11p_sd15_canny\"]")
    private List<String> models;

    @Schema(description = "Препроцессоры, значение поля module юнита", example = "[\"canny\", \"depth_midas\"]")
    private List<String> modules;
}
