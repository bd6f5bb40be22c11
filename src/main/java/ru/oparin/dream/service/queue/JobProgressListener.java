package ru.oparin.dream.service.queue;

import reactor.core.publisher.Mono;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;

/**
 * Получатель уведомлений о ходе выполнения задачи.
 * <p>
 * Ошибка любого уведомления отключает дальнейшие уведомления этого получателя
 * и сразу снимает блокировку пользователя, сама задача при этом продолжает выполняться.
 */
public interface JobProgressListener {

    /**
     * Получатель, который ничего не делает. Используется для REST API, где статус опрашивается.
     */
    JobProgressListener NONE = new JobProgressListener() {
    };

    /**
     * Задача поставлена в очередь.
     *
     * @param position позиция в очереди, 1 - следующая на выполнение
     */
    default Mono<Void> onQueued(GenerationJob job, int position) {
        return Mono.empty();
    }

    /**
     * Позиция задачи в очереди изменилась.
     */
    default Mono<Void> onPositionChanged(GenerationJob job, int position) {
        return Mono.empty();
    }

    /**
     * Задача передана в Stable Diffusion.
     */
    default Mono<Void> onStarted(GenerationJob job) {
        return Mono.empty();
    }

    /**
     * Задача завершена успешно или с ошибкой.
     */
    default Mono<Void> onFinished(GenerationJob job, JobResult result) {
        return Mono.empty();
    }
}
