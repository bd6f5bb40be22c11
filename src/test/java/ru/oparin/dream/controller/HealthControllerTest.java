package ru.oparin.dream.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import ru.oparin.dream.exception.GenerationClientException;
import ru.oparin.dream.model.dto.ModelsDTO;
import ru.oparin.dream.model.dto.QueueStatusDTO;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.sd.GenerationClient;

import java.util.List;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {HealthController.class, ModelController.class})
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private GenerationClient generationClient;

    @MockBean
    private GenerationQueueService queueService;

    @BeforeEach
    void setUp() {
        when(queueService.snapshot()).thenReturn(QueueStatusDTO.builder().queued(2).processing(true).build());
    }

    @Test
    void shouldReportHealthyWhenServiceResponds() {
        when(generationClient.checkStatus()).thenReturn(Mono.empty());

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.queued").isEqualTo(2);
    }

    @Test
    void shouldReportUnhealthyWhenServiceUnreachable() {
        when(generationClient.checkStatus())
                .thenReturn(Mono.error(GenerationClientException.unreachable("Connection refused", null)));

        webTestClient.get()
                .uri("/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("unhealthy")
                .jsonPath("$.error").isEqualTo("Connection refused");
    }

    @Test
    void shouldListModels() {
        when(generationClient.getModels()).thenReturn(Mono.just(ModelsDTO.builder()
                .checkpoints(List.of("dreamshaper_8"))
                .vaes(List.of("Automatic", "None"))
                .samplers(List.of("Euler a"))
                .upscalers(List.of("Latent"))
                .build()));

        webTestClient.get()
                .uri("/models")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.checkpoints[0]").isEqualTo("dreamshaper_8")
                .jsonPath("$.vaes.length()").isEqualTo(2);
    }

    @Test
    void shouldMapModelListFailureToServiceUnavailable() {
        when(generationClient.getModels())
                .thenReturn(Mono.error(GenerationClientException.unreachable("Connection refused", null)));

        webTestClient.get()
                .uri("/models")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.code").isEqualTo("DOWNSTREAM_UNREACHABLE");
    }
}
