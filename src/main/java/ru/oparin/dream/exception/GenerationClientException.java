package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.dream.model.enums.DownstreamErrorKind;

/**
 * Ошибка при обращении к Stable Diffusion API.
 */
@Getter
public class GenerationClientException extends RuntimeException {

    private final DownstreamErrorKind kind;

    /** HTTP-статус ответа Stable Diffusion, только для HTTP_ERROR. */
    private final Integer downstreamStatus;

    public GenerationClientException(DownstreamErrorKind kind, String message, Integer downstreamStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.downstreamStatus = downstreamStatus;
    }

    public static GenerationClientException unreachable(String message, Throwable cause) {
        return new GenerationClientException(DownstreamErrorKind.UNREACHABLE, message, null, cause);
    }

    public static GenerationClientException httpError(int status, String body) {
        return new GenerationClientException(DownstreamErrorKind.HTTP_ERROR,
                "HTTP " + status + ": " + body, status, null);
    }

    public static GenerationClientException malformed(String message, Throwable cause) {
        return new GenerationClientException(DownstreamErrorKind.MALFORMED, message, null, cause);
    }

    public HttpStatus getStatus() {
        return kind.getStatus();
    }
}
