package ru.oparin.dream.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Тип ошибки при обращении к Stable Diffusion API.
 */
@Getter
@RequiredArgsConstructor
public enum DownstreamErrorKind {

    /** Сервис недоступен: ошибка соединения или таймаут. */
    UNREACHABLE("DOWNSTREAM_UNREACHABLE", HttpStatus.SERVICE_UNAVAILABLE),

    /** Сервис ответил HTTP-ошибкой. */
    HTTP_ERROR("DOWNSTREAM_ERROR", HttpStatus.BAD_GATEWAY),

    /** Ответ сервиса не удалось разобрать. */
    MALFORMED("DOWNSTREAM_MALFORMED", HttpStatus.BAD_GATEWAY);

    private final String code;
    private final HttpStatus status;
}
