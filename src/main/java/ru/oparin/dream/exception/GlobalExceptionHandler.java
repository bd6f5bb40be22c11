package ru.oparin.dream.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Внутренняя ошибка сервера",
                        "status", 500,
                        "message", ex.getMessage() != null ? ex.getMessage() : "Unknown error"
                )));
    }

    @ExceptionHandler(AdmissionRejectedException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAdmissionRejected(AdmissionRejectedException ex) {
        log.warn("Задача отклонена: {}", ex.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("error", ex.getMessage());
        body.put("status", ex.getStatus().value());
        body.put("code", ex.getReason().name());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(ex.getStatus());
        if (ex.getRetryAt() != null) {
            body.put("remainingSeconds", ex.getRemainingSeconds());
            body.put("retryAt", ex.getRetryAt().toString());
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRemainingSeconds()));
        }
        return Mono.just(response.body(body));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleJobNotFound(JobNotFoundException ex) {
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value(),
                        "code", "JOB_NOT_FOUND"
                )));
    }

    @ExceptionHandler(ResultNotReadyException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleResultNotReady(ResultNotReadyException ex) {
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value(),
                        "code", "RESULT_NOT_READY",
                        "jobStatus", ex.getJobStatus().name()
                )));
    }

    @ExceptionHandler(NotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleNotFound(NotFoundException ex) {
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value(),
                        "code", ex.getCode()
                )));
    }

    @ExceptionHandler(GenerationClientException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleGenerationClientException(GenerationClientException ex) {
        log.error("Ошибка Stable Diffusion ({}): {}", ex.getKind(), ex.getMessage());

        if (ex.getCause() != null) {
            log.error("Cause: {}", ex.getCause().getMessage());
        }

        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(Map.of(
                        "error", ex.getMessage(),
                        "status", ex.getStatus().value(),
                        "code", ex.getKind().getCode()
                )));
    }

    @ExceptionHandler(RequestValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleRequestValidationException(RequestValidationException ex) {
        log.warn("Некорректный запрос: {}", ex.getMessage());

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "code", "VALIDATION_FAILED",
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации",
                        "status", 400,
                        "code", "VALIDATION_FAILED",
                        "details", String.valueOf(ex.getMessage())
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Map<String, String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ?
                                fieldError.getDefaultMessage() : "Invalid value",
                        (first, second) -> first
                ));

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Ошибка валидации данных",
                        "status", 400,
                        "code", "VALIDATION_FAILED",
                        "details", errors
                )));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInputException(ServerWebInputException ex) {
        log.warn("Не удалось разобрать запрос: {}", ex.getReason());

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Некорректный формат запроса",
                        "status", 400,
                        "code", "VALIDATION_FAILED",
                        "details", String.valueOf(ex.getReason())
                )));
    }
}
