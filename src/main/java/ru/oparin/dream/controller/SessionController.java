package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.ControlNetUnit;
import ru.oparin.dream.model.dto.ModifierRq;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.service.UserSessionService;

import java.util.Map;

/**
 * Контроллер для работы с сессиями пользователей: LoRA, юниты ControlNet и пользовательские параметры.
 * Изменения применяются только к задачам, поставленным после изменения.
 */
@Slf4j
@RestController
@RequestMapping("/sessions/{userId}")
@RequiredArgsConstructor
@Tag(name = "Sessions", description = "Настройки пользователя, применяемые к генерациям")
public class SessionController {

    private final UserSessionService userSessionService;

    @Operation(summary = "Получить сессию пользователя")
    @GetMapping
    public Mono<ResponseEntity<UserSession>> getSession(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.getSnapshot(userId)));
    }

    @Operation(summary = "Добавить LoRA", description = "Повторное добавление той же LoRA меняет ее вес")
    @PostMapping("/modifiers")
    public Mono<ResponseEntity<UserSession>> addModifier(@PathVariable String userId,
                                                         @Valid @RequestBody ModifierRq request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                userSessionService.addModifier(userId, request.getName(), request.getWeight())));
    }

    @Operation(summary = "Удалить LoRA")
    @DeleteMapping("/modifiers/{name}")
    public Mono<ResponseEntity<UserSession>> removeModifier(@PathVariable String userId, @PathVariable String name) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.removeModifier(userId, name)));
    }

    @Operation(summary = "Удалить все LoRA")
    @DeleteMapping("/modifiers")
    public Mono<ResponseEntity<UserSession>> clearModifiers(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.clearModifiers(userId)));
    }

    @Operation(summary = "Обновить пользовательские параметры", description = "Параметр со значением null удаляется")
    @PatchMapping("/settings")
    public Mono<ResponseEntity<UserSession>> updateSettings(@PathVariable String userId,
                                                            @RequestBody Map<String, Object> settings) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.updateCustomSettings(userId, settings)));
    }

    @Operation(summary = "Сохранить юнит ControlNet")
    @PostMapping("/control-configs")
    public Mono<ResponseEntity<UserSession>> addControlConfig(@PathVariable String userId,
                                                              @Valid @RequestBody ControlNetUnit unit) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.addControlConfig(userId, unit)));
    }

    @Operation(summary = "Удалить сохраненные юниты ControlNet")
    @DeleteMapping("/control-configs")
    public Mono<ResponseEntity<UserSession>> clearControlConfigs(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(userSessionService.clearControlConfigs(userId)));
    }
}
