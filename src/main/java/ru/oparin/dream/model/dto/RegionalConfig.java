package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.enums.RegionalLayout;

/**
 * Настройки разбиения кадра на регионы.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Разбиение кадра на регионы с отдельными промптами")
public class RegionalConfig {

    @NotNull(message = "Схема регионов обязательна")
    @Schema(description = "Схема", example = "quadrants")
    private RegionalLayout layout;

    /** Общая часть промпта для всех регионов. */
    @Builder.Default
    @Schema(description = "Общий промпт", example = "sky")
    private String common = "";

    @NotBlank(message = "Промпт первого региона обязателен")
    @Schema(example = "cat")
    private String region1;

    @NotBlank(message = "Промпт второго региона обязателен")
    @Schema(example = "dog")
    private String region2;

    private String region3;

    private String region4;
}
