package ru.oparin.dream.controller;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;
import ru.oparin.dream.exception.AdmissionRejectedException;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.GenerationResponse;
import ru.oparin.dream.model.dto.QueueStatusDTO;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;
import ru.oparin.dream.service.GenerationService;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.queue.JobProgressListener;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = GenerateController.class)
class GenerateControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private GenerationService generationService;

    @MockBean
    private GenerationQueueService queueService;

    @Test
    void shouldAcceptTxt2ImgRequest() {
        when(generationService.submit(any(), eq(JobKind.TXT2IMG), isNull(), eq(JobProgressListener.NONE)))
                .thenReturn(Mono.just(response(JobKind.TXT2IMG)));

        webTestClient.post()
                .uri("/generate/txt2img")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"userId": "alice", "prompt": "a castle on a hill", "steps": 30}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("job-1")
                .jsonPath("$.status").isEqualTo("QUEUED")
                .jsonPath("$.position").isEqualTo(1);

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generationService).submit(captor.capture(), eq(JobKind.TXT2IMG), isNull(), eq(JobProgressListener.NONE));
        assertThat(captor.getValue().getSteps()).isEqualTo(30);
        assertThat(captor.getValue().getCfgScale()).isEqualTo(7.0);
    }

    @Test
    void shouldRejectOutOfRangeParametersBeforeSubmission() {
        webTestClient.post()
                .uri("/generate/txt2img")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"userId": "alice", "prompt": "a castle", "steps": 500}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED")
                .jsonPath("$.details.steps").exists();

        verify(generationService, never()).submit(any(), any(), any(), any());
    }

    @Test
    void shouldReturnTooManyRequestsDuringCooldown() {
        when(generationService.submit(any(), any(), any(), any()))
                .thenReturn(Mono.error(AdmissionRejectedException.cooldown(7, Instant.parse("2024-05-01T10:00:15Z"))));

        webTestClient.post()
                .uri("/generate/txt2img")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\": \"alice\", \"prompt\": \"cat\"}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "7")
                .expectBody()
                .jsonPath("$.code").isEqualTo("COOLDOWN_ACTIVE")
                .jsonPath("$.remainingSeconds").isEqualTo(7)
                .jsonPath("$.retryAt").isEqualTo("2024-05-01T10:00:15Z");
    }

    @Test
    void shouldReportAlreadyGenerating() {
        when(generationService.submit(any(), any(), any(), any()))
                .thenReturn(Mono.error(AdmissionRejectedException.alreadyGenerating()));

        webTestClient.post()
                .uri("/generate/txt2img")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\": \"alice\", \"prompt\": \"cat\"}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().doesNotExist(HttpHeaders.RETRY_AFTER)
                .expectBody()
                .jsonPath("$.code").isEqualTo("ALREADY_GENERATING");
    }

    @Test
    void shouldMapServiceValidationToBadRequest() {
        when(generationService.submit(any(), eq(JobKind.REGIONAL), isNull(), any()))
                .thenReturn(Mono.error(new RequestValidationException("Для региональной генерации требуется схема регионов")));

        webTestClient.post()
                .uri("/generate/regional")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\": \"alice\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED");
    }

    @Test
    void shouldAcceptImg2ImgUpload() {
        byte[] image = {1, 2, 3, 4};
        when(generationService.submit(any(), eq(JobKind.IMG2IMG), any(), any()))
                .thenReturn(Mono.just(response(JobKind.IMG2IMG)));

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("request", "{\"userId\": \"alice\", \"prompt\": \"autumn\"}", MediaType.APPLICATION_JSON);
        body.part("image", new ByteArrayResource(image)).filename("source.png").contentType(MediaType.IMAGE_PNG);

        webTestClient.post()
                .uri("/generate/img2img")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("IMG2IMG");

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(generationService).submit(any(), eq(JobKind.IMG2IMG), captor.capture(), any());
        assertThat(captor.getValue()).containsExactly(image);
    }

    @Test
    void shouldReturnQueueSnapshot() {
        when(queueService.snapshot()).thenReturn(QueueStatusDTO.builder()
                .queued(3)
                .processing(true)
                .processingJobId("job-0")
                .build());

        webTestClient.get()
                .uri("/generate/queue")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.queued").isEqualTo(3)
                .jsonPath("$.processing").isEqualTo(true)
                .jsonPath("$.processingJobId").isEqualTo("job-0");
    }

    private static GenerationResponse response(JobKind kind) {
        return GenerationResponse.builder()
                .jobId("job-1")
                .kind(kind)
                .status(JobStatus.QUEUED)
                .position(1)
                .message("Задача поставлена в очередь")
                .build();
    }
}
