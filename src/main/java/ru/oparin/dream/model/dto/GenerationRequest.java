package ru.oparin.dream.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.GenerationLimits;

import java.util.ArrayList;
import java.util.List;

/**
 * Запрос на генерацию изображения.
 * Числовые параметры проверяются до постановки в очередь и повторно ограничиваются при сборке payload.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Запрос на генерацию изображения")
public class GenerationRequest {

    /** Идентификатор вызывающего пользователя. */
    @NotBlank(message = "Идентификатор пользователя обязателен")
    @Schema(description = "Идентификатор пользователя", example = "user-42")
    private String userId;

    /** Описание изображения. Для региональной генерации не используется. */
    @Schema(description = "Промпт", example = "a castle on a hill, sunset")
    private String prompt;

    /** Негативный промпт. */
    @Builder.Default
    @Schema(description = "Негативный промпт", example = "blurry, low quality")
    private String negativePrompt = "";

    /** Имя сэмплера. */
    @Builder.Default
    @Schema(description = "Сэмплер", example = GenerationLimits.DEFAULT_SAMPLER)
    private String samplerName = GenerationLimits.DEFAULT_SAMPLER;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_STEPS, message = "Количество шагов должно быть не меньше 1")
    @Max(value = GenerationLimits.MAX_STEPS, message = "Количество шагов должно быть не больше 150")
    @Schema(description = "Количество шагов", example = "20")
    private Integer steps = GenerationLimits.DEFAULT_STEPS;

    @Builder.Default
    @DecimalMin(value = "1.0", message = "CFG scale должен быть не меньше 1.0")
    @DecimalMax(value = "30.0", message = "CFG scale должен быть не больше 30.0")
    @Schema(description = "CFG scale", example = "7.0")
    private Double cfgScale = GenerationLimits.DEFAULT_CFG_SCALE;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_DIMENSION, message = "Ширина должна быть не меньше 64")
    @Max(value = GenerationLimits.MAX_DIMENSION, message = "Ширина должна быть не больше 2048")
    @Schema(description = "Ширина", example = "512")
    private Integer width = GenerationLimits.DEFAULT_DIMENSION;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_DIMENSION, message = "Высота должна быть не меньше 64")
    @Max(value = GenerationLimits.MAX_DIMENSION, message = "Высота должна быть не больше 2048")
    @Schema(description = "Высота", example = "512")
    private Integer height = GenerationLimits.DEFAULT_DIMENSION;

    /** Количество последовательных прогонов (n_iter). */
    @Builder.Default
    @Min(value = GenerationLimits.MIN_BATCH_COUNT, message = "Количество серий должно быть не меньше 1")
    @Max(value = GenerationLimits.MAX_BATCH_COUNT, message = "Количество серий должно быть не больше 10")
    @Schema(description = "Количество серий", example = "1")
    private Integer batchCount = GenerationLimits.MIN_BATCH_COUNT;

    /** Количество изображений в одном прогоне. */
    @Builder.Default
    @Min(value = GenerationLimits.MIN_BATCH_SIZE, message = "Размер серии должен быть не меньше 1")
    @Max(value = GenerationLimits.MAX_BATCH_SIZE, message = "Размер серии должен быть не больше 4")
    @Schema(description = "Размер серии", example = "1")
    private Integer batchSize = GenerationLimits.MIN_BATCH_SIZE;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_SEED, message = "Seed должен быть не меньше -1")
    @Schema(description = "Seed, -1 для случайного", example = "-1")
    private Long seed = GenerationLimits.MIN_SEED;

    @Builder.Default
    @Schema(description = "Включить hires fix", example = "false")
    private Boolean enableHr = false;

    @Builder.Default
    @DecimalMin(value = "1.0", message = "Коэффициент увеличения должен быть не меньше 1.0")
    @DecimalMax(value = "4.0", message = "Коэффициент увеличения должен быть не больше 4.0")
    @Schema(description = "Коэффициент увеличения hires fix", example = "2.0")
    private Double hrScale = GenerationLimits.DEFAULT_HR_SCALE;

    @Schema(description = "Апскейлер hires fix", example = "Latent")
    private String hrUpscaler;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_HR_SECOND_PASS_STEPS, message = "Шагов второго прохода должно быть не меньше 0")
    @Max(value = GenerationLimits.MAX_HR_SECOND_PASS_STEPS, message = "Шагов второго прохода должно быть не больше 150")
    @Schema(description = "Шаги второго прохода hires fix, 0 - как в первом", example = "0")
    private Integer hrSecondPassSteps = GenerationLimits.MIN_HR_SECOND_PASS_STEPS;

    /** Сила изменения исходного изображения (только для img2img). */
    @Builder.Default
    @DecimalMin(value = "0.0", message = "Denoising strength должен быть не меньше 0.0")
    @DecimalMax(value = "1.0", message = "Denoising strength должен быть не больше 1.0")
    @Schema(description = "Denoising strength", example = "0.7")
    private Double denoisingStrength = GenerationLimits.DEFAULT_DENOISING;

    @Builder.Default
    @Min(value = GenerationLimits.MIN_RESIZE_MODE, message = "Режим масштабирования должен быть от 0 до 3")
    @Max(value = GenerationLimits.MAX_RESIZE_MODE, message = "Режим масштабирования должен быть от 0 до 3")
    @Schema(description = "Режим масштабирования исходного изображения", example = "0")
    private Integer resizeMode = GenerationLimits.MIN_RESIZE_MODE;

    @Builder.Default
    private Boolean inpaintFullRes = false;

    @Builder.Default
    @Min(value = 0, message = "Отступ inpaint должен быть не меньше 0")
    @Max(value = GenerationLimits.MAX_INPAINT_PADDING, message = "Отступ inpaint должен быть не больше 256")
    private Integer inpaintFullResPadding = GenerationLimits.DEFAULT_INPAINT_PADDING;

    @Builder.Default
    private Integer inpaintingMaskInvert = 0;

    /** Переопределение модели на время задачи. */
    @Schema(description = "Checkpoint модели", example = "sd_xl_base_1.0.safetensors")
    private String checkpoint;

    /** Переопределение VAE на время задачи. */
    @Schema(description = "VAE", example = "sdxl_vae.safetensors")
    private String vae;

    /** Разбиение кадра на регионы. */
    @Valid
    private RegionalConfig regional;

    /** Юниты ControlNet. Если пусто, используются юниты из сессии пользователя. */
    @Valid
    @Builder.Default
    private List<ControlNetUnit> controlNetUnits = new ArrayList<>();
}
