package ru.oparin.dream.service.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import ru.oparin.dream.exception.GenerationClientException;
import ru.oparin.dream.model.dto.QueueStatusDTO;
import ru.oparin.dream.model.dto.sd.GenerationOutput;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;
import ru.oparin.dream.service.admission.AdmissionTicket;
import ru.oparin.dream.service.sd.GenerationClient;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Очередь задач генерации с единственным обработчиком.
 * <p>
 * Задачи выполняются строго по порядку постановки, в каждый момент в работе не больше одной задачи.
 * Обработчик запускается на отдельном потоке при постановке задачи в пустую очередь
 * и завершается, когда очередь опустела. Признак работы обработчика меняется
 * под той же блокировкой, что и сама очередь, поэтому второй обработчик не запустится.
 * <p>
 * После каждого извлечения задачи ожидающие получают новую позицию. Уведомления
 * отправляются независимо друг от друга и не задерживают обработчик.
 */
@Slf4j
@Service
public class GenerationQueueService implements DisposableBean {

    private static final String FAILED_MESSAGE = "Не удалось сгенерировать изображение";
    private static final String UNREACHABLE_MESSAGE = "Сервис генерации недоступен, попробуйте позже";

    private final GenerationJobStore jobStore;
    private final GenerationClient generationClient;
    private final Scheduler consumerScheduler;

    private final Object lock = new Object();
    private final Deque<QueuedJob> queue = new ArrayDeque<>();
    private boolean consumerRunning;
    private String processingJobId;

    public GenerationQueueService(GenerationJobStore jobStore, GenerationClient generationClient) {
        this.jobStore = jobStore;
        this.generationClient = generationClient;
        this.consumerScheduler = Schedulers.newBoundedElastic(1, Integer.MAX_VALUE, "generation-queue");
    }

    /**
     * Поставить задачу в конец очереди.
     * Задача должна быть уже зарегистрирована в {@link GenerationJobStore}.
     *
     * @param job      задача в статусе QUEUED
     * @param ticket   тикет допуска, закрывается по завершении задачи
     * @param listener получатель уведомлений
     * @return позиция в очереди, 1 - следующая на выполнение
     */
    public int enqueue(GenerationJob job, AdmissionTicket ticket, JobProgressListener listener) {
        QueuedJob entry = new QueuedJob(job, ticket, listener);
        int position;
        boolean startConsumer;
        synchronized (lock) {
            queue.addLast(entry);
            position = queue.size();
            startConsumer = !consumerRunning;
            consumerRunning = true;
        }
        log.info("Задача {} пользователя {} поставлена в очередь, позиция {}", job.getId(), job.getUserId(), position);

        deliver(entry, l -> l.onQueued(job, position)).subscribe();
        if (startConsumer) {
            log.debug("Запуск обработчика очереди");
            consumerScheduler.schedule(this::drain);
        }
        return position;
    }

    /**
     * Позиция ожидающей задачи.
     *
     * @param jobId идентификатор задачи
     * @return позиция начиная с 1 или пусто, если задача уже не ожидает
     */
    public OptionalInt positionOf(String jobId) {
        synchronized (lock) {
            int position = 1;
            for (QueuedJob entry : queue) {
                if (entry.job.getId().equals(jobId)) {
                    return OptionalInt.of(position);
                }
                position++;
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Текущее состояние очереди.
     */
    public QueueStatusDTO snapshot() {
        synchronized (lock) {
            return QueueStatusDTO.builder()
                    .queued(queue.size())
                    .processing(processingJobId != null)
                    .processingJobId(processingJobId)
                    .build();
        }
    }

    @Override
    public void destroy() {
        consumerScheduler.dispose();
    }

    private void drain() {
        boolean drained = false;
        try {
            while (true) {
                QueuedJob entry;
                List<QueuedJob> waiting;
                synchronized (lock) {
                    entry = queue.pollFirst();
                    if (entry == null) {
                        consumerRunning = false;
                        processingJobId = null;
                        drained = true;
                        log.debug("Очередь пуста, обработчик остановлен");
                        return;
                    }
                    processingJobId = entry.job.getId();
                    waiting = List.copyOf(queue);
                }
                notifyPositions(waiting);
                process(entry);
            }
        } finally {
            if (!drained) {
                restartAfterFailure();
            }
        }
    }

    private void restartAfterFailure() {
        boolean restart;
        synchronized (lock) {
            processingJobId = null;
            restart = !queue.isEmpty();
            consumerRunning = restart;
        }
        log.error("Обработчик очереди завершился аварийно, перезапуск: {}", restart);
        if (restart) {
            consumerScheduler.schedule(this::drain);
        }
    }

    private void process(QueuedJob entry) {
        String jobId = entry.job.getId();
        GenerationJob finished;
        try {
            GenerationJob started = jobStore.markProcessing(jobId);
            deliver(entry, l -> l.onStarted(started)).subscribe();
            log.info("Начата генерация задачи {} пользователя {}", jobId, started.getUserId());
            finished = execute(started);
        } catch (RuntimeException e) {
            log.error("Ошибка обработки задачи {}", jobId, e);
            finished = jobStore.markFailed(jobId, FAILED_MESSAGE, String.valueOf(e.getMessage()));
        } finally {
            // Пользователь освобождается только после записи конечного статуса
            entry.ticket.close();
        }

        JobResult result = jobStore.getResult(jobId);
        log.info("Задача {} завершена со статусом {}", jobId, finished.getStatus());
        GenerationJob completedJob = finished;
        deliver(entry, l -> l.onFinished(completedJob, result)).subscribe();
    }

    private GenerationJob execute(GenerationJob job) {
        try {
            GenerationOutput output = generationClient.submit(job.getPayload()).block();
            if (output == null) {
                throw GenerationClientException.malformed("Пустой ответ сервиса генерации", null);
            }
            return jobStore.markCompleted(job.getId(), output);
        } catch (GenerationClientException e) {
            log.warn("Генерация задачи {} завершилась ошибкой {}: {}", job.getId(), e.getKind(), e.getMessage());
            String message = switch (e.getKind()) {
                case UNREACHABLE -> UNREACHABLE_MESSAGE;
                case HTTP_ERROR, MALFORMED -> FAILED_MESSAGE;
            };
            return jobStore.markFailed(job.getId(), message, e.getMessage());
        }
    }

    private void notifyPositions(List<QueuedJob> waiting) {
        if (waiting.isEmpty()) {
            return;
        }
        Flux.range(0, waiting.size())
                .flatMap(index -> {
                    QueuedJob entry = waiting.get(index);
                    return deliver(entry, l -> l.onPositionChanged(entry.job, index + 1));
                })
                .subscribe();
    }

    /**
     * Отправить уведомление одному получателю.
     * При ошибке получатель отключается, а блокировка его пользователя снимается.
     */
    private Mono<Void> deliver(QueuedJob entry, Function<JobProgressListener, Mono<Void>> notification) {
        if (entry.detached.get()) {
            return Mono.empty();
        }
        return Mono.defer(() -> notification.apply(entry.listener))
                .onErrorResume(error -> {
                    if (entry.detached.compareAndSet(false, true)) {
                        log.warn("Не удалось уведомить пользователя {} о задаче {}, уведомления отключены: {}",
                                entry.job.getUserId(), entry.job.getId(), error.getMessage());
                        entry.ticket.close();
                    }
                    return Mono.empty();
                });
    }

    private static final class QueuedJob {
        private final GenerationJob job;
        private final AdmissionTicket ticket;
        private final JobProgressListener listener;
        private final AtomicBoolean detached = new AtomicBoolean(false);

        private QueuedJob(GenerationJob job, AdmissionTicket ticket, JobProgressListener listener) {
            this.job = job;
            this.ticket = ticket;
            this.listener = listener;
        }
    }
}
