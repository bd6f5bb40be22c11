package ru.oparin.dream.model.enums;

/**
 * Статусы задачи генерации.
 * Переходы допускаются только вперед: QUEUED → PROCESSING → COMPLETED | FAILED.
 */
public enum JobStatus {

    /**
     * Задача ожидает своей очереди.
     */
    QUEUED,

    /**
     * Задача передана в Stable Diffusion и генерируется.
     */
    PROCESSING,

    /**
     * Генерация завершена, результат доступен.
     */
    COMPLETED,

    /**
     * Генерация завершилась ошибкой.
     */
    FAILED;

    /**
     * Проверить, является ли статус конечным.
     *
     * @return true для COMPLETED и FAILED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Проверить допустимость перехода в указанный статус.
     * Задача, которая не смогла стартовать, может перейти из QUEUED сразу в FAILED.
     *
     * @param target целевой статус
     * @return true, если переход разрешен
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case QUEUED -> target == PROCESSING || target == FAILED;
            case PROCESSING -> target.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }
}
