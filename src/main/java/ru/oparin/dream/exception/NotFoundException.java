package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Запрошенный объект сессии или пресет не найден.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private final HttpStatus status = HttpStatus.NOT_FOUND;

    /** Машиночитаемый код ошибки. */
    private final String code;

    public NotFoundException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static NotFoundException preset(String presetId) {
        return new NotFoundException("PRESET_NOT_FOUND", "Пресет не найден: " + presetId);
    }

    public static NotFoundException modifier(String name) {
        return new NotFoundException("MODIFIER_NOT_FOUND", "Модификатор не найден в сессии: " + name);
    }
}
