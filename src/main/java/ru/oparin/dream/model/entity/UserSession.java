package ru.oparin.dream.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.dream.model.dto.ControlNetUnit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Настройки пользователя, применяемые ко всем его генерациям.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSession {

    private String userId;

    /**
     * Активные стилевые модификаторы (LoRA): имя → вес, в порядке добавления.
     */
    @Builder.Default
    private LinkedHashMap<String, Double> modifiers = new LinkedHashMap<>();

    /**
     * Сохраненные юниты ControlNet, применяются если в запросе юниты не заданы.
     */
    @Builder.Default
    private List<ControlNetUnit> controlConfigs = new ArrayList<>();

    /**
     * Произвольные параметры Stable Diffusion, добавляемые в каждый запрос.
     */
    @Builder.Default
    private Map<String, Object> customSettings = new HashMap<>();

    private Instant lastModified;
}
