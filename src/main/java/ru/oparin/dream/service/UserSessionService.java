package ru.oparin.dream.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.dream.config.properties.StorageProperties;
import ru.oparin.dream.exception.NotFoundException;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.GenerationLimits;
import ru.oparin.dream.model.dto.ControlNetUnit;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.util.JsonFileStorage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Хранилище сессий пользователей: LoRA, сохраненные юниты ControlNet и пользовательские параметры.
 * <p>
 * Наружу выдаются только копии сессий, поэтому изменение сессии не затрагивает
 * уже собранные запросы задач в очереди.
 */
@Slf4j
@Service
public class UserSessionService {

    private static final TypeReference<Map<String, UserSession>> SESSIONS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> SETTINGS_TYPE = new TypeReference<>() {
    };

    private final ConcurrentMap<String, UserSession> sessions = new ConcurrentHashMap<>();
    private final JsonFileStorage<Map<String, UserSession>> storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UserSessionService(StorageProperties storageProperties, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.storage = new JsonFileStorage<>(storageProperties.getSessionsFile(), objectMapper, SESSIONS_TYPE);
        storage.load().ifPresent(loaded -> {
            sessions.putAll(loaded);
            log.info("Загружено сессий пользователей: {}", loaded.size());
        });
    }

    /**
     * Получить копию сессии пользователя. Если сессии нет, создается пустая.
     *
     * @param userId идентификатор пользователя
     * @return независимая копия сессии
     */
    public UserSession getSnapshot(String userId) {
        UserSession session = sessions.computeIfAbsent(userId, this::newSession);
        return copy(session);
    }

    /**
     * Изменить сессию пользователя.
     * Изменение применяется к копии и сохраняется целиком, время изменения обновляется всегда.
     * Если действие выбросило исключение, сессия остается прежней.
     *
     * @param userId   идентификатор пользователя
     * @param mutation изменение сессии
     * @return копия измененной сессии
     */
    public UserSession mutate(String userId, Consumer<UserSession> mutation) {
        UserSession updated = sessions.compute(userId, (key, current) -> {
            UserSession draft = current == null ? newSession(key) : copy(current);
            mutation.accept(draft);
            draft.setLastModified(clock.instant());
            return draft;
        });
        persist();
        return copy(updated);
    }

    /**
     * Добавить LoRA или изменить ее вес. Новая LoRA добавляется в конец списка.
     */
    public UserSession addModifier(String userId, String name, double weight) {
        if (name == null || name.isBlank()) {
            throw new RequestValidationException("Имя модификатора не может быть пустым");
        }
        // NaN не проходит ни одно сравнение
        if (!(weight >= GenerationLimits.MIN_MODIFIER_WEIGHT && weight <= GenerationLimits.MAX_MODIFIER_WEIGHT)) {
            throw new RequestValidationException(String.format(
                    "Вес модификатора должен быть от %.1f до %.1f", GenerationLimits.MIN_MODIFIER_WEIGHT, GenerationLimits.MAX_MODIFIER_WEIGHT));
        }
        log.info("Пользователь {} добавил модификатор {} с весом {}", userId, name, weight);
        return mutate(userId, session -> session.getModifiers().put(name.strip(), weight));
    }

    /**
     * Удалить LoRA из сессии.
     *
     * @throws NotFoundException если такой LoRA в сессии нет
     */
    public UserSession removeModifier(String userId, String name) {
        return mutate(userId, session -> {
            if (session.getModifiers().remove(name) == null) {
                throw NotFoundException.modifier(name);
            }
        });
    }

    public UserSession clearModifiers(String userId) {
        return mutate(userId, session -> session.getModifiers().clear());
    }

    public UserSession addControlConfig(String userId, ControlNetUnit unit) {
        return mutate(userId, session -> session.getControlConfigs().add(unit.toBuilder().build()));
    }

    public UserSession clearControlConfigs(String userId) {
        return mutate(userId, session -> session.getControlConfigs().clear());
    }

    /**
     * Обновить пользовательские параметры. Параметр со значением null удаляется.
     */
    public UserSession updateCustomSettings(String userId, Map<String, Object> settings) {
        Map<String, Object> incoming = deepCopy(settings);
        return mutate(userId, session -> incoming.forEach((key, value) -> {
            if (value == null) {
                session.getCustomSettings().remove(key);
            } else {
                session.getCustomSettings().put(key, value);
            }
        }));
    }

    /**
     * Снимок всех сессий берется под той же блокировкой, что и запись,
     * поэтому в файл не попадет более старое состояние поверх нового.
     */
    private synchronized void persist() {
        if (storage.isEnabled()) {
            storage.save(Map.copyOf(sessions));
        }
    }

    private UserSession newSession(String userId) {
        return UserSession.builder()
                .userId(userId)
                .lastModified(clock.instant())
                .build();
    }

    private UserSession copy(UserSession session) {
        return UserSession.builder()
                .userId(session.getUserId())
                .modifiers(session.getModifiers() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(session.getModifiers()))
                .controlConfigs(session.getControlConfigs() == null ? new ArrayList<>() : session.getControlConfigs().stream()
                        .map(unit -> unit.toBuilder().build())
                        .collect(Collectors.toCollection(ArrayList::new)))
                .customSettings(deepCopy(session.getCustomSettings()))
                .lastModified(session.getLastModified())
                .build();
    }

    private Map<String, Object> deepCopy(Map<String, Object> settings) {
        if (settings == null || settings.isEmpty()) {
            return new HashMap<>();
        }
        // Через дерево, чтобы вложенные коллекции тоже копировались
        return objectMapper.convertValue(objectMapper.valueToTree(settings), SETTINGS_TYPE);
    }
}
