package ru.oparin.dream.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Пути к файлам, в которых сохраняются сессии и пресеты пользователей.
 * Пустое значение отключает сохранение на диск.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /**
     * Файл сессий пользователей.
     */
    private String sessionsFile;

    /**
     * Файл пресетов пользователей.
     */
    private String presetsFile;
}
