package ru.oparin.dream.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Конфигурационные свойства для интеграции со Stable Diffusion WebUI API.
 * Настройки загружаются из application.yml с префиксом stable-diffusion.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "stable-diffusion")
public class StableDiffusionProperties {

    /**
     * Настройки API (URL и таймауты).
     */
    private Api api = new Api();

    /**
     * Настройки API Stable Diffusion.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        /**
         * Базовый URL API, например http://127.0.0.1:7860/sdapi/v1.
         */
        private String url = "http://127.0.0.1:7860/sdapi/v1";

        /**
         * Таймаут генерации.
         */
        private Duration timeout = Duration.ofMinutes(10);

        /**
         * Таймаут служебных запросов (модели, проверка доступности).
         */
        private Duration infoTimeout = Duration.ofSeconds(30);

        /**
         * Максимальный размер ответа в байтах (ответ содержит изображения в base64).
         */
        private int maxResponseSize = 64 * 1024 * 1024;
    }
}
