package ru.oparin.dream.service.telegram;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.telegram.TelegramApiResponse;
import ru.oparin.dream.model.dto.telegram.TelegramFile;

import java.time.Duration;

/**
 * Скачивание файлов, присланных боту.
 */
@Slf4j
@Service
public class TelegramFileService {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final ParameterizedTypeReference<TelegramApiResponse<TelegramFile>> FILE_RESPONSE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final String botToken;

    public TelegramFileService(WebClient.Builder webClientBuilder,
                               @Value("${telegram.bot.token}") String botToken,
                               @Value("${telegram.bot.api-url:https://api.telegram.org}") String apiUrl) {
        this.botToken = botToken;
        this.webClient = webClientBuilder.clone()
                .baseUrl(apiUrl)
                .build();
    }

    /**
     * Скачать файл.
     *
     * @param fileId ID файла в Telegram
     * @return содержимое файла
     */
    public Mono<byte[]> downloadFile(String fileId) {
        return webClient.get()
                .uri("/bot" + botToken + "/getFile?file_id=" + fileId)
                .retrieve()
                .bodyToMono(FILE_RESPONSE)
                .timeout(TIMEOUT)
                .flatMap(response -> {
                    if (!response.isOk() || response.getResult() == null || response.getResult().getFilePath() == null) {
                        return Mono.error(new IllegalStateException(
                                "Не удалось получить путь к файлу: " + response.getDescription()));
                    }
                    return webClient.get()
                            .uri("/file/bot" + botToken + "/" + response.getResult().getFilePath())
                            .retrieve()
                            .bodyToMono(byte[].class)
                            .timeout(TIMEOUT);
                })
                .doOnSuccess(bytes -> log.info("Файл {} скачан, размер: {} байт", fileId, bytes == null ? 0 : bytes.length))
                .doOnError(error -> log.error("Ошибка скачивания файла {}: {}", fileId, error.getMessage()));
    }
}
