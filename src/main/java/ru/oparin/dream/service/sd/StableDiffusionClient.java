package ru.oparin.dream.service.sd;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import ru.oparin.dream.config.properties.StableDiffusionProperties;
import ru.oparin.dream.exception.GenerationClientException;
import ru.oparin.dream.model.dto.ControlNetModelsDTO;
import ru.oparin.dream.model.dto.ModelsDTO;
import ru.oparin.dream.model.dto.sd.GenerationOutput;
import ru.oparin.dream.model.dto.sd.SdControlNetList;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.dto.sd.SdImageResponse;
import ru.oparin.dream.model.dto.sd.SdNamedItem;

import java.util.List;
import java.util.function.Function;
import java.util.concurrent.TimeoutException;

/**
 * Клиент Stable Diffusion WebUI API (/sdapi/v1).
 */
@Slf4j
@Component
public class StableDiffusionClient implements GenerationClient {

    private static final List<String> DEFAULT_VAES = List.of("Automatic", "None");
    private static final ParameterizedTypeReference<List<SdNamedItem>> ITEM_LIST = new ParameterizedTypeReference<>() {
    };
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final WebClient webClient;

    /**
     * Корень сервера WebUI. Endpoint'ы ControlNet лежат вне /sdapi/v1.
     */
    private final String serverRoot;
    private final StableDiffusionProperties properties;
    private final ObjectMapper objectMapper;

    public StableDiffusionClient(WebClient.Builder webClientBuilder,
                                 StableDiffusionProperties properties,
                                 ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        StableDiffusionProperties.Api api = properties.getApi();
        this.serverRoot = UriComponentsBuilder.fromHttpUrl(api.getUrl())
                .replacePath(null)
                .replaceQuery(null)
                .build()
                .toUriString();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(api.getTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS);

        this.webClient = webClientBuilder
                .baseUrl(api.getUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(api.getMaxResponseSize()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<GenerationOutput> submit(ResolvedPayload payload) {
        String endpoint = "/" + payload.getEndpoint();
        log.info("Отправка запроса в Stable Diffusion {}: prompt='{}'", endpoint, payload.getPrompt());

        return webClient.post()
                .uri(endpoint)
                .bodyValue(payload.getDocument())
                .retrieve()
                .bodyToMono(SdImageResponse.class)
                .timeout(properties.getApi().getTimeout())
                .onErrorMap(this::mapError)
                .flatMap(this::toOutput)
                .doOnSuccess(output -> log.info("Stable Diffusion вернул {} изображений", output.getImages().size()));
    }

    @Override
    public Mono<Void> checkStatus() {
        return webClient.get()
                .uri("/options")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getApi().getInfoTimeout())
                .onErrorMap(this::mapError)
                .then();
    }

    @Override
    public Mono<ModelsDTO> getModels() {
        Mono<List<String>> vaes = fetchNames("/sd-vae")
                .onErrorResume(error -> {
                    log.warn("Не удалось получить список VAE, используется список по умолчанию: {}", error.getMessage());
                    return Mono.just(DEFAULT_VAES);
                });

        return Mono.zip(fetchNames("/sd-models"), vaes, fetchNames("/samplers"), fetchNames("/upscalers"))
                .map(tuple -> ModelsDTO.builder()
                        .checkpoints(tuple.getT1())
                        .vaes(tuple.getT2())
                        .samplers(tuple.getT3())
                        .upscalers(tuple.getT4())
                        .build());
    }

    @Override
    public Mono<ControlNetModelsDTO> getControlNetModels() {
        return Mono.zip(fetchControlNetList("/controlnet/model_list", SdControlNetList::getModelList),
                        fetchControlNetList("/controlnet/module_list", SdControlNetList::getModuleList))
                .map(tuple -> ControlNetModelsDTO.builder()
                        .models(tuple.getT1())
                        .modules(tuple.getT2())
                        .build());
    }

    private Mono<List<String>> fetchControlNetList(String path, Function<SdControlNetList, List<String>> extractor) {
        return webClient.get()
                .uri(serverRoot + path)
                .retrieve()
                .bodyToMono(SdControlNetList.class)
                .timeout(properties.getApi().getInfoTimeout())
                .onErrorMap(this::mapError)
                .map(response -> {
                    List<String> names = extractor.apply(response);
                    return names == null ? List.<String>of() : List.copyOf(names);
                });
    }

    private Mono<List<String>> fetchNames(String uri) {
        return webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(ITEM_LIST)
                .timeout(properties.getApi().getInfoTimeout())
                .onErrorMap(this::mapError)
                .map(items -> items.stream()
                        .map(SdNamedItem::displayName)
                        .filter(name -> name != null && !name.isBlank())
                        .toList());
    }

    private Mono<GenerationOutput> toOutput(SdImageResponse response) {
        if (response.getImages() == null) {
            return Mono.error(GenerationClientException.malformed("В ответе нет изображений", null));
        }
        JsonNode info;
        try {
            info = response.getInfo() == null || response.getInfo().isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response.getInfo());
        } catch (JsonProcessingException e) {
            return Mono.error(GenerationClientException.malformed("Не удалось разобрать info: " + e.getOriginalMessage(), e));
        }
        return Mono.just(GenerationOutput.builder()
                .images(response.getImages())
                .info(info)
                .parameters(response.getParameters())
                .build());
    }

    /**
     * Привести ошибку WebClient к {@link GenerationClientException}.
     */
    Throwable mapError(Throwable error) {
        if (error instanceof GenerationClientException) {
            return error;
        }
        if (error instanceof TimeoutException) {
            return GenerationClientException.unreachable("Превышено время ожидания Stable Diffusion", error);
        }
        if (error instanceof WebClientRequestException) {
            return GenerationClientException.unreachable("Не удалось подключиться к Stable Diffusion: " + error.getMessage(), error);
        }
        if (error instanceof WebClientResponseException webError) {
            log.warn("Stable Diffusion вернул HTTP {}: {}", webError.getStatusCode().value(), webError.getResponseBodyAsString());
            return GenerationClientException.httpError(webError.getStatusCode().value(), webError.getResponseBodyAsString());
        }
        return GenerationClientException.malformed("Некорректный ответ Stable Diffusion: " + error.getMessage(), error);
    }
}
