package ru.oparin.dream.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.telegram.TelegramUpdate;
import ru.oparin.dream.service.telegram.TelegramBotService;

/**
 * Контроллер для обработки webhook от Telegram Bot API.
 * Всегда отвечает 200, иначе Telegram будет повторять доставку обновления.
 */
@Slf4j
@RestController
@RequestMapping("/telegram")
@RequiredArgsConstructor
public class TelegramBotController {

    private final TelegramBotService telegramBotService;

    @PostMapping("/webhook")
    public Mono<ResponseEntity<String>> handleWebhook(@RequestBody TelegramUpdate update) {
        log.debug("Получен webhook от Telegram: {}", update.getUpdateId());

        return telegramBotService.processUpdate(update)
                .then(Mono.just(ResponseEntity.ok("OK")))
                .onErrorResume(error -> {
                    log.error("Ошибка обработки webhook {}: {}", update.getUpdateId(), error.getMessage(), error);
                    return Mono.just(ResponseEntity.ok("ERROR"));
                });
    }
}
