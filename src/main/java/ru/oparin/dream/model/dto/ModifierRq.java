package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.GenerationLimits;

/**
 * Запрос на добавление стилевого модификатора (LoRA) в сессию.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Стилевой модификатор")
public class ModifierRq {

    @NotBlank(message = "Имя модификатора обязательно")
    @Schema(example = "detail_tweaker.safetensors")
    private String name;

    @Builder.Default
    @DecimalMin(value = "0.1", message = "Вес модификатора должен быть не меньше 0.1")
    @DecimalMax(value = "2.0", message = "Вес модификатора должен быть не больше 2.0")
    @Schema(example = "0.8")
    private Double weight = GenerationLimits.DEFAULT_MODIFIER_WEIGHT;
}
