package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Запрос на сохранение пресета генерации.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Пресет генерации")
public class PresetRq {

    @NotBlank(message = "Название пресета обязательно")
    private String name;

    @Builder.Default
    private String description = "";

    /** Произвольные параметры генерации. */
    @NotNull(message = "Параметры пресета обязательны")
    private Map<String, Object> config;
}
