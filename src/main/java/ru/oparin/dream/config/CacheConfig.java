package ru.oparin.dream.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.service.admission.AdmissionState;

import java.time.Clock;

/**
 * Конфигурация кешей и времени приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Часы приложения. В тестах подменяются управляемыми часами.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Состояние допуска пользователей.
     * Запись без активной генерации удаляется через app.generation.admission-state-ttl
     * после последнего изменения; запись с активной генерацией не истекает.
     */
    @Bean
    public Cache<String, AdmissionState> admissionStates(GenerationProperties generationProperties) {
        long ttlNanos = generationProperties.getAdmissionStateTtl().toNanos();
        return Caffeine.newBuilder()
                .expireAfter(new Expiry<String, AdmissionState>() {
                    @Override
                    public long expireAfterCreate(String key, AdmissionState state, long currentTime) {
                        return state.isGenerating() ? Long.MAX_VALUE : ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, AdmissionState state, long currentTime, long currentDuration) {
                        return state.isGenerating() ? Long.MAX_VALUE : ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, AdmissionState state, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }
}
