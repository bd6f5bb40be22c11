package ru.oparin.dream.service.sd;

import reactor.core.publisher.Mono;
import ru.oparin.dream.model.dto.ControlNetModelsDTO;
import ru.oparin.dream.model.dto.ModelsDTO;
import ru.oparin.dream.model.dto.sd.GenerationOutput;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;

/**
 * Клиент сервиса генерации изображений.
 * <p>
 * Все ошибки возвращаются как {@link ru.oparin.dream.exception.GenerationClientException}
 * с типом UNREACHABLE (нет соединения или таймаут), HTTP_ERROR или MALFORMED.
 */
public interface GenerationClient {

    /**
     * Выполнить генерацию.
     *
     * @param payload готовый запрос
     * @return изображения и метаданные генерации
     */
    Mono<GenerationOutput> submit(ResolvedPayload payload);

    /**
     * Проверить доступность сервиса.
     *
     * @return пустой Mono при успехе, ошибка если сервис недоступен
     */
    Mono<Void> checkStatus();

    /**
     * Получить доступные модели, VAE, сэмплеры и апскейлеры.
     */
    Mono<ModelsDTO> getModels();

    /**
     * Получить модели и препроцессоры ControlNet.
     */
    Mono<ControlNetModelsDTO> getControlNetModels();
}
