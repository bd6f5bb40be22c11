package ru.oparin.dream.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Именованный набор параметров генерации пользователя.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Preset {

    private String id;
    private String userId;
    private String name;
    private String description;
    private Map<String, Object> config;
    private Instant createdAt;
    private Instant lastUsed;
}
