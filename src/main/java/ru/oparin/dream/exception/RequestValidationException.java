package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Некорректный запрос, обнаруженный вне bean validation (разбор команд бота, изображения и т.п.).
 */
@Getter
public class RequestValidationException extends RuntimeException {

    private final HttpStatus status = HttpStatus.BAD_REQUEST;

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
