package ru.oparin.dream.service.queue;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.oparin.dream.exception.JobNotFoundException;
import ru.oparin.dream.exception.ResultNotReadyException;
import ru.oparin.dream.model.dto.sd.GenerationOutput;
import ru.oparin.dream.model.dto.sd.ResolvedPayload;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.JobStatus;
import ru.oparin.dream.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationJobStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private GenerationJobStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new GenerationJobStore(clock);
    }

    @Test
    void shouldRegisterQueuedJob() {
        GenerationJob job = register();

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getCreatedAt()).isEqualTo(START);
        assertThat(store.getStatus(job.getId())).isSameAs(job);
    }

    @Test
    void shouldThrowForUnknownJob() {
        assertThatThrownBy(() -> store.getStatus("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> store.getResult("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void shouldReportResultNotReadyUntilTerminal() {
        GenerationJob job = register();

        assertThatThrownBy(() -> store.getResult(job.getId()))
                .isInstanceOfSatisfying(ResultNotReadyException.class,
                        e -> assertThat(e.getJobStatus()).isEqualTo(JobStatus.QUEUED));

        store.markProcessing(job.getId());
        assertThatThrownBy(() -> store.getResult(job.getId()))
                .isInstanceOfSatisfying(ResultNotReadyException.class,
                        e -> assertThat(e.getJobStatus()).isEqualTo(JobStatus.PROCESSING));
    }

    @Test
    void shouldStoreResultOnCompletion() {
        GenerationJob job = register();
        store.markProcessing(job.getId());
        clock.advance(Duration.ofSeconds(30));

        GenerationJob completed = store.markCompleted(job.getId(), output("aW1n"));

        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isEqualTo(START.plusSeconds(30));
        JobResult result = store.getResult(job.getId());
        assertThat(result.getImages()).containsExactly("aW1n");
        assertThat(result.getInfo().get("seed").asLong()).isEqualTo(7L);
        assertThat(store.getResult(job.getId())).isSameAs(result);
    }

    @Test
    void shouldNotExposeStoredMetadataForModification() {
        GenerationJob job = register();
        store.markProcessing(job.getId());
        store.markCompleted(job.getId(), output("aW1n"));
        JobResult result = store.getResult(job.getId());

        ((ObjectNode) result.getInfo()).put("seed", 99L);
        ((ObjectNode) result.getParameters()).put("steps", 150);

        assertThat(store.getResult(job.getId()).getInfo().get("seed").asLong()).isEqualTo(7L);
        assertThat(store.getResult(job.getId()).getParameters().has("steps")).isFalse();
    }

    @Test
    void shouldKeepMessageAndErrorOnFailure() {
        GenerationJob job = register();
        store.markProcessing(job.getId());

        GenerationJob failed = store.markFailed(job.getId(), "Сервис недоступен", "Connection refused");

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getMessage()).isEqualTo("Сервис недоступен");
        assertThat(store.getResult(job.getId()).getError()).isEqualTo("Connection refused");
        assertThat(store.getResult(job.getId()).getImages()).isEmpty();
    }

    @Test
    void shouldAllowFailingQueuedJob() {
        GenerationJob job = register();

        assertThat(store.markFailed(job.getId(), "отменено", null).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void shouldRejectIllegalTransitions() {
        GenerationJob job = register();

        assertThatThrownBy(() -> store.markCompleted(job.getId(), output("x")))
                .isInstanceOf(IllegalStateException.class);

        store.markProcessing(job.getId());
        store.markCompleted(job.getId(), output("first"));

        assertThatThrownBy(() -> store.markFailed(job.getId(), "late", "late"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.markProcessing(job.getId()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.getResult(job.getId()).getImages()).containsExactly("first");
        assertThat(store.getStatus(job.getId()).getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void shouldEvictOnlyTerminalJobsOlderThanThreshold() {
        GenerationJob old = register();
        store.markProcessing(old.getId());
        store.markCompleted(old.getId(), output("old"));
        clock.advance(Duration.ofHours(2));
        GenerationJob recent = register();
        store.markProcessing(recent.getId());
        store.markFailed(recent.getId(), "ошибка", "boom");
        GenerationJob active = register();

        int removed = store.evictTerminalBefore(START.plus(Duration.ofHours(1)));

        assertThat(removed).isEqualTo(1);
        assertThatThrownBy(() -> store.getStatus(old.getId())).isInstanceOf(JobNotFoundException.class);
        assertThat(store.getStatus(recent.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(store.getStatus(active.getId()).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    private GenerationJob register() {
        ResolvedPayload payload = new ResolvedPayload("txt2img", JsonNodeFactory.instance.objectNode().put("prompt", "cat"));
        return store.register("alice", JobKind.TXT2IMG, payload);
    }

    private static GenerationOutput output(String image) {
        return GenerationOutput.builder()
                .images(List.of(image))
                .info(JsonNodeFactory.instance.objectNode().put("seed", 7L))
                .parameters(JsonNodeFactory.instance.objectNode())
                .build();
    }
}
