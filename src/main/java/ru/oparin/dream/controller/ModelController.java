package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.ModelsDTO;
import ru.oparin.dream.service.sd.GenerationClient;

@RestController
@RequestMapping("/models")
@RequiredArgsConstructor
@Tag(name = "Models", description = "Модели, доступные в Stable Diffusion")
public class ModelController {

    private final GenerationClient generationClient;

    @Operation(summary = "Список моделей", description = "Checkpoint'ы, VAE, сэмплеры и апскейлеры")
    @GetMapping
    public Mono<ResponseEntity<ModelsDTO>> getModels() {
        return generationClient.getModels()
                .map(ResponseEntity::ok);
    }
}
