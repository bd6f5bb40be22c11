package ru.oparin.dream.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Хранение объекта в JSON файле.
 * Запись идет во временный файл с последующей заменой, чтобы не оставить файл недописанным.
 * Если путь не задан, хранилище отключено: загрузка ничего не возвращает, сохранение ничего не делает.
 */
@Slf4j
public class JsonFileStorage<T> {

    private final Path path;
    private final ObjectMapper objectMapper;
    private final TypeReference<T> type;

    public JsonFileStorage(String path, ObjectMapper objectMapper, TypeReference<T> type) {
        this.path = path == null || path.isBlank() ? null : Path.of(path);
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public boolean isEnabled() {
        return path != null;
    }

    /**
     * Прочитать объект из файла.
     *
     * @return объект или пусто, если хранилище отключено или файла еще нет
     * @throws IllegalStateException если файл существует, но не читается
     */
    public Optional<T> load() {
        if (path == null || !Files.exists(path)) {
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(path.toFile(), type);
            log.info("Загружены данные из {}", path);
            return Optional.ofNullable(value);
        } catch (IOException e) {
            throw new IllegalStateException("Не удалось прочитать файл " + path, e);
        }
    }

    /**
     * Сохранить объект в файл. Ошибка записи логируется, данные в памяти остаются актуальными.
     */
    public synchronized void save(T value) {
        if (path == null) {
            return;
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Не удалось сохранить данные в {}", path, e);
        }
    }
}
