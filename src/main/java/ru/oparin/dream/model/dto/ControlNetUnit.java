package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Настройки одного юнита ControlNet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Юнит ControlNet")
public class ControlNetUnit {

    @Builder.Default
    private Boolean enabled = true;

    /** Имя модели ControlNet. */
    @NotBlank(message = "Модель ControlNet обязательна")
    @Schema(example = "control_v11p_sd15_canny")
    private String model;

    /** Препроцессор, null - без препроцессора. */
    @Schema(example = "canny")
    private String module;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double weight = 1.0;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double guidanceStart = 0.0;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double guidanceEnd = 1.0;

    @Builder.Default
    @Min(64)
    @Max(2048)
    private Integer processorRes = 512;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("255.0")
    private Double thresholdA = 64.0;

    @Builder.Default
    @DecimalMin("0.0")
    @DecimalMax("255.0")
    private Double thresholdB = 64.0;

    /** 0 - сбалансированный, 1 - важнее промпт, 2 - важнее ControlNet. */
    @Builder.Default
    @Min(0)
    @Max(2)
    private Integer controlMode = 0;

    @Builder.Default
    private Boolean pixelPerfect = false;
}
