package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.PresetRq;
import ru.oparin.dream.model.entity.Preset;
import ru.oparin.dream.service.PresetService;

import java.util.List;

@RestController
@RequestMapping("/presets/{userId}")
@RequiredArgsConstructor
@Tag(name = "Presets", description = "Пресеты генерации пользователя")
public class PresetController {

    private final PresetService presetService;

    @Operation(summary = "Список пресетов")
    @GetMapping
    public Mono<ResponseEntity<List<Preset>>> list(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(presetService.list(userId)));
    }

    @Operation(summary = "Сохранить пресет")
    @PostMapping
    public Mono<ResponseEntity<Preset>> save(@PathVariable String userId, @Valid @RequestBody PresetRq request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(presetService.save(userId, request)));
    }

    @Operation(summary = "Получить пресет", description = "Отмечает время использования пресета")
    @GetMapping("/{presetId}")
    public Mono<ResponseEntity<Preset>> get(@PathVariable String userId, @PathVariable String presetId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(presetService.use(userId, presetId)));
    }

    @Operation(summary = "Удалить пресет")
    @DeleteMapping("/{presetId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String userId, @PathVariable String presetId) {
        return Mono.fromRunnable(() -> presetService.delete(userId, presetId))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
