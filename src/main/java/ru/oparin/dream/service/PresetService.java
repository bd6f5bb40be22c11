package ru.oparin.dream.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.dream.config.properties.StorageProperties;
import ru.oparin.dream.exception.NotFoundException;
import ru.oparin.dream.model.dto.PresetRq;
import ru.oparin.dream.model.entity.Preset;
import ru.oparin.dream.util.JsonFileStorage;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Пресеты генерации пользователей.
 */
@Slf4j
@Service
public class PresetService {

    private static final TypeReference<Map<String, Map<String, Preset>>> PRESETS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    /** Пользователь → идентификатор пресета → пресет. */
    private final ConcurrentMap<String, Map<String, Preset>> presets = new ConcurrentHashMap<>();
    private final JsonFileStorage<Map<String, Map<String, Preset>>> storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PresetService(StorageProperties storageProperties, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.storage = new JsonFileStorage<>(storageProperties.getPresetsFile(), objectMapper, PRESETS_TYPE);
        storage.load().ifPresent(loaded -> loaded.forEach((userId, userPresets) ->
                presets.put(userId, new HashMap<>(userPresets))));
    }

    /**
     * Сохранить новый пресет.
     *
     * @return сохраненный пресет с присвоенным идентификатором
     */
    public Preset save(String userId, PresetRq request) {
        Preset preset = Preset.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .name(request.getName().strip())
                .description(request.getDescription() == null ? "" : request.getDescription())
                .config(objectMapper.convertValue(objectMapper.valueToTree(request.getConfig()), CONFIG_TYPE))
                .createdAt(clock.instant())
                .build();
        presets.compute(userId, (key, userPresets) -> {
            Map<String, Preset> updated = userPresets == null ? new HashMap<>() : new HashMap<>(userPresets);
            updated.put(preset.getId(), preset);
            return updated;
        });
        persist();
        log.info("Пользователь {} сохранил пресет '{}' ({})", userId, preset.getName(), preset.getId());
        return preset;
    }

    /**
     * Пресеты пользователя в порядке создания.
     */
    public List<Preset> list(String userId) {
        return presets.getOrDefault(userId, Map.of()).values().stream()
                .sorted(Comparator.comparing(Preset::getCreatedAt))
                .toList();
    }

    /**
     * Получить пресет и отметить время его использования.
     *
     * @throws NotFoundException если пресет не найден
     */
    public Preset use(String userId, String presetId) {
        AtomicReference<Preset> used = new AtomicReference<>();
        presets.computeIfPresent(userId, (key, userPresets) -> {
            Preset preset = userPresets.get(presetId);
            if (preset == null) {
                return userPresets;
            }
            Map<String, Preset> updated = new HashMap<>(userPresets);
            used.set(preset.toBuilder().lastUsed(clock.instant()).build());
            updated.put(presetId, used.get());
            return updated;
        });
        if (used.get() == null) {
            throw NotFoundException.preset(presetId);
        }
        persist();
        return used.get();
    }

    /**
     * Удалить пресет.
     *
     * @throws NotFoundException если пресет не найден
     */
    public void delete(String userId, String presetId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        presets.computeIfPresent(userId, (key, userPresets) -> {
            if (!userPresets.containsKey(presetId)) {
                return userPresets;
            }
            removed.set(true);
            Map<String, Preset> updated = new HashMap<>(userPresets);
            updated.remove(presetId);
            return updated.isEmpty() ? null : updated;
        });
        if (!removed.get()) {
            throw NotFoundException.preset(presetId);
        }
        persist();
        log.info("Пользователь {} удалил пресет {}", userId, presetId);
    }

    private synchronized void persist() {
        if (storage.isEnabled()) {
            storage.save(Map.copyOf(presets));
        }
    }
}
