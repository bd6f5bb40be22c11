package ru.oparin.dream.config.properties;

import jakarta.validation.constraints.AssertTrue;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import ru.oparin.dream.model.GenerationLimits;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Конфигурационные свойства очереди генерации.
 * Настройки загружаются из application.yml с префиксом app.generation.
 */
@Getter
@Setter
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.generation")
public class GenerationProperties {

    /**
     * Интервал ожидания после завершения генерации до следующей задачи пользователя.
     */
    private Duration cooldown = Duration.ofSeconds(15);

    /**
     * Пользователи без ограничений по интервалу и параллельным задачам.
     * Для Telegram указывается в виде tg:&lt;id&gt;.
     */
    private Set<String> privilegedCallers = new HashSet<>();

    /**
     * Сколько хранить завершенные задачи и их результаты.
     */
    private Duration jobRetention = Duration.ofHours(24);

    /**
     * Сколько хранить состояние допуска неактивного пользователя.
     */
    private Duration admissionStateTtl = Duration.ofHours(1);

    /**
     * Максимальное количество пикселей исходного изображения для img2img.
     */
    private long maxSourcePixels = 1216L * 1216L;

    /**
     * Параметры по умолчанию для генераций из Telegram бота.
     */
    private Defaults defaults = new Defaults();

    /**
     * Состояние допуска хранит время последней генерации, поэтому не должно истекать раньше интервала ожидания.
     */
    @AssertTrue(message = "app.generation.admission-state-ttl не может быть меньше app.generation.cooldown")
    public boolean isAdmissionStateTtlCoveringCooldown() {
        return admissionStateTtl == null || cooldown == null || admissionStateTtl.compareTo(cooldown) >= 0;
    }

    /**
     * Параметры генерации по умолчанию.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Defaults {
        /**
         * Негативный промпт.
         */
        private String negativePrompt = "";

        /**
         * Сэмплер.
         */
        private String samplerName = GenerationLimits.DEFAULT_SAMPLER;

        private int steps = GenerationLimits.DEFAULT_STEPS;

        private double cfgScale = GenerationLimits.DEFAULT_CFG_SCALE;

        private int width = GenerationLimits.DEFAULT_DIMENSION;

        private int height = GenerationLimits.DEFAULT_DIMENSION;

        /**
         * Denoising strength для img2img.
         */
        private double denoisingStrength = GenerationLimits.DEFAULT_DENOISING;
    }
}
