package ru.oparin.dream.service.telegram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.telegram.TelegramApiResponse;
import ru.oparin.dream.model.dto.telegram.TelegramMessage;

import java.time.Duration;

/**
 * Сервис для отправки сообщений и изображений через Telegram Bot API.
 */
@Slf4j
@Service
public class TelegramMessageService {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final ParameterizedTypeReference<TelegramApiResponse<TelegramMessage>> MESSAGE_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;

    public TelegramMessageService(WebClient.Builder webClientBuilder,
                                  @Value("${telegram.bot.token}") String botToken,
                                  @Value("${telegram.bot.api-url:https://api.telegram.org}") String apiUrl) {
        this.webClient = webClientBuilder.clone()
                .baseUrl(apiUrl + "/bot" + botToken)
                .build();
    }

    /**
     * Отправить текстовое сообщение без разметки.
     *
     * @return идентификатор отправленного сообщения
     */
    public Mono<Long> sendMessage(Long chatId, String text) {
        return sendMessage(chatId, text, null);
    }

    /**
     * Отправить текстовое сообщение.
     *
     * @param chatId    ID чата
     * @param text      текст сообщения
     * @param parseMode режим разметки (Markdown, HTML) или null
     * @return идентификатор отправленного сообщения
     */
    public Mono<Long> sendMessage(Long chatId, String text, String parseMode) {
        log.debug("Отправка сообщения в чат {}: {}", chatId, text);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        if (parseMode != null) {
            body.add("parse_mode", parseMode);
        }

        return post("/sendMessage", BodyInserters.fromFormData(body), MediaType.APPLICATION_FORM_URLENCODED)
                .doOnSuccess(messageId -> log.debug("Сообщение {} отправлено в чат {}", messageId, chatId))
                .doOnError(error -> log.error("Ошибка отправки сообщения в чат {}: {}", chatId, error.getMessage()));
    }

    /**
     * Заменить текст ранее отправленного сообщения.
     */
    public Mono<Void> editMessageText(Long chatId, Long messageId, String text) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("message_id", String.valueOf(messageId));
        body.add("text", text);

        return post("/editMessageText", BodyInserters.fromFormData(body), MediaType.APPLICATION_FORM_URLENCODED)
                .doOnError(error -> log.warn("Ошибка изменения сообщения {} в чате {}: {}", messageId, chatId, error.getMessage()))
                .then();
    }

    /**
     * Отправить изображение файлом.
     *
     * @param chatId  ID чата
     * @param image   содержимое изображения (PNG)
     * @param caption подпись, может быть null
     */
    public Mono<Void> sendPhoto(Long chatId, byte[] image, String caption) {
        log.info("Отправка изображения в чат {}, размер: {} байт", chatId, image.length);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("chat_id", String.valueOf(chatId));
        builder.part("photo", new ByteArrayResource(image))
                .filename("dream.png")
                .contentType(MediaType.IMAGE_PNG);
        if (caption != null && !caption.isBlank()) {
            builder.part("caption", caption);
        }

        return post("/sendPhoto", BodyInserters.fromMultipartData(builder.build()), MediaType.MULTIPART_FORM_DATA)
                .doOnError(error -> log.error("Ошибка отправки изображения в чат {}: {}", chatId, error.getMessage()))
                .then();
    }

    /**
     * Отправить сообщение об ошибке.
     */
    public Mono<Void> sendErrorMessage(Long chatId, String errorMessage) {
        return sendMessage(chatId, "❌ " + errorMessage).then();
    }

    private Mono<Long> post(String method, BodyInserters.FormInserter<?> body, MediaType contentType) {
        return webClient.post()
                .uri(method)
                .contentType(contentType)
                .body(body)
                .retrieve()
                .bodyToMono(MESSAGE_RESPONSE)
                .timeout(TIMEOUT)
                .flatMap(response -> {
                    if (!response.isOk()) {
                        return Mono.error(new IllegalStateException(
                                "Telegram API вернул ошибку " + response.getErrorCode() + ": " + response.getDescription()));
                    }
                    TelegramMessage message = response.getResult();
                    return Mono.justOrEmpty(message == null ? null : message.getMessageId());
                });
    }
}
