package ru.oparin.dream.model.enums;

/**
 * Причина отказа в приеме задачи.
 */
public enum AdmissionRejectionReason {

    /** У пользователя уже есть задача в очереди или в работе. */
    ALREADY_GENERATING,

    /** Не истек интервал ожидания после предыдущей генерации. */
    COOLDOWN_ACTIVE
}
