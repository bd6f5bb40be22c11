package ru.oparin.dream.service.admission;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Разрешение на одну задачу генерации.
 * Закрытие снимает блокировку пользователя и запускает интервал ожидания.
 * Повторное закрытие ничего не делает, поэтому тикет можно закрывать и в finally,
 * и при потере канала уведомлений.
 */
public final class AdmissionTicket implements AutoCloseable {

    @Getter
    private final String callerId;

    @Getter
    private final boolean privileged;

    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AdmissionTicket(String callerId, boolean privileged, Runnable onRelease) {
        this.callerId = callerId;
        this.privileged = privileged;
        this.onRelease = onRelease;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}
