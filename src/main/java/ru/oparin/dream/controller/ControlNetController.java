package ru.oparin.dream.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.ControlNetModelsDTO;
import ru.oparin.dream.service.sd.GenerationClient;

@RestController
@RequestMapping("/controlnet")
@RequiredArgsConstructor
@Tag(name = "ControlNet", description = "Модели и препроцессоры ControlNet")
public class ControlNetController {

    private final GenerationClient generationClient;

    @Operation(summary = "Модели ControlNet",
            description = "Значения для полей model и module юнита ControlNet")
    @GetMapping("/models")
    public Mono<ResponseEntity<ControlNetModelsDTO>> getModels() {
        return generationClient.getControlNetModels()
                .map(ResponseEntity::ok);
    }
}
