package ru.oparin.dream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.oparin.dream.config.CacheConfig;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.config.properties.StorageProperties;
import ru.oparin.dream.exception.AdmissionRejectedException;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.GenerationResponse;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;
import ru.oparin.dream.service.admission.AdmissionService;
import ru.oparin.dream.service.queue.GenerationJobStore;
import ru.oparin.dream.service.queue.GenerationQueueService;
import ru.oparin.dream.service.queue.JobProgressListener;
import ru.oparin.dream.support.MutableClock;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GenerationServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private AdmissionService admissionService;
    private GenerationJobStore jobStore;
    private GenerationQueueService queueService;
    private GenerationService generationService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(START);
        GenerationProperties properties = new GenerationProperties();
        admissionService = new AdmissionService(new CacheConfig().admissionStates(properties), properties, clock);
        jobStore = mock(GenerationJobStore.class);
        queueService = mock(GenerationQueueService.class);
        generationService = new GenerationService(
                validator,
                new ImageNormalizationService(properties),
                admissionService,
                new UserSessionService(new StorageProperties(), objectMapper, clock),
                new GenerationPayloadBuilder(objectMapper),
                jobStore,
                queueService);

        when(jobStore.register(any(), any(), any())).thenAnswer(invocation -> GenerationJob.builder()
                .id("job-1")
                .userId(invocation.getArgument(0))
                .kind(invocation.getArgument(1))
                .payload(invocation.getArgument(2))
                .status(JobStatus.QUEUED)
                .createdAt(START)
                .build());
    }

    @Test
    void shouldQueueValidRequest() {
        when(queueService.enqueue(any(), any(), any())).thenReturn(2);

        GenerationResponse response = generationService
                .submit(request("a castle"), JobKind.TXT2IMG, null, JobProgressListener.NONE)
                .block();

        assertThat(response.getJobId()).isEqualTo("job-1");
        assertThat(response.getKind()).isEqualTo(JobKind.TXT2IMG);
        assertThat(response.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(response.getPosition()).isEqualTo(2);
        assertThat(admissionService.getState("alice").isGenerating()).isTrue();
        verify(jobStore).register(eq("alice"), eq(JobKind.TXT2IMG), any());
    }

    @Test
    void shouldRejectInvalidRequestBeforeAdmission() {
        GenerationRequest invalid = request("a castle").toBuilder().steps(0).build();

        assertThatThrownBy(() -> generationService
                .submit(invalid, JobKind.TXT2IMG, null, JobProgressListener.NONE).block())
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("steps");

        assertThat(admissionService.getState("alice").isGenerating()).isFalse();
        assertThat(admissionService.getState("alice").getLastCompletedAt()).isNull();
        verifyNoInteractions(jobStore, queueService);
    }

    @Test
    void shouldRequireImageForImg2Img() {
        assertThatThrownBy(() -> generationService
                .submit(request("a castle"), JobKind.IMG2IMG, null, JobProgressListener.NONE).block())
                .isInstanceOf(RequestValidationException.class);

        verifyNoInteractions(jobStore, queueService);
    }

    @Test
    void shouldRejectControlNetWithoutUnits() {
        assertThatThrownBy(() -> generationService
                .submit(request("a castle"), JobKind.CONTROLNET, null, JobProgressListener.NONE).block())
                .isInstanceOf(RequestValidationException.class);

        assertThat(admissionService.getState("alice").isGenerating()).isFalse();
    }

    @Test
    void shouldRejectSecondJobWhileFirstIsActive() {
        when(queueService.enqueue(any(), any(), any())).thenReturn(1);
        generationService.submit(request("first"), JobKind.TXT2IMG, null, JobProgressListener.NONE).block();

        assertThatThrownBy(() -> generationService
                .submit(request("second"), JobKind.TXT2IMG, null, JobProgressListener.NONE).block())
                .isInstanceOf(AdmissionRejectedException.class);

        verify(jobStore).register(eq("alice"), eq(JobKind.TXT2IMG), any());
    }

    @Test
    void shouldReleaseCallerWhenEnqueueFails() {
        when(queueService.enqueue(any(), any(), any())).thenThrow(new IllegalStateException("Очередь остановлена"));

        assertThatThrownBy(() -> generationService
                .submit(request("a castle"), JobKind.TXT2IMG, null, JobProgressListener.NONE).block())
                .isInstanceOf(IllegalStateException.class);

        assertThat(admissionService.getState("alice").isGenerating()).isFalse();
    }

    @Test
    void shouldRequireRegionalLayoutForRegionalJob() {
        assertThatThrownBy(() -> generationService
                .submit(request(null), JobKind.REGIONAL, null, JobProgressListener.NONE).block())
                .isInstanceOf(RequestValidationException.class);

        verify(queueService, never()).enqueue(any(), any(), any());
    }

    private static GenerationRequest request(String prompt) {
        return GenerationRequest.builder()
                .userId("alice")
                .prompt(prompt)
                .build();
    }
}
