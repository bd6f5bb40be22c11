package ru.oparin.dream.service.telegram;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.dream.model.entity.GenerationJob;
import ru.oparin.dream.model.entity.JobResult;
import ru.oparin.dream.model.enums.JobStatus;
import ru.oparin.dream.service.queue.JobProgressListener;

import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Уведомления о ходе задачи в чат Telegram.
 * <p>
 * При постановке в очередь отправляется статусное сообщение, дальше оно редактируется
 * при смене позиции и старте генерации. Готовые изображения приходят отдельными сообщениями.
 */
@Slf4j
public class TelegramProgressListener implements JobProgressListener {

    private static final int MAX_CAPTION_LENGTH = 1024;

    private final Long chatId;
    private final String caption;
    private final TelegramMessageService messageService;

    private final AtomicReference<Mono<Long>> statusMessage = new AtomicReference<>();
    private final AtomicReference<String> lastText = new AtomicReference<>();

    public TelegramProgressListener(Long chatId, String caption, TelegramMessageService messageService) {
        this.chatId = chatId;
        this.caption = caption;
        this.messageService = messageService;
    }

    @Override
    public Mono<Void> onQueued(GenerationJob job, int position) {
        String text = queuedText(position);
        lastText.set(text);
        Mono<Long> sent = messageService.sendMessage(chatId, text).cache();
        statusMessage.set(sent);
        return sent.then();
    }

    @Override
    public Mono<Void> onPositionChanged(GenerationJob job, int position) {
        return updateStatus(queuedText(position));
    }

    @Override
    public Mono<Void> onStarted(GenerationJob job) {
        return updateStatus("🎨 Генерация началась...");
    }

    @Override
    public Mono<Void> onFinished(GenerationJob job, JobResult result) {
        if (job.getStatus() != JobStatus.COMPLETED) {
            log.info("Задача {} для чата {} завершилась ошибкой: {}", job.getId(), chatId, job.getMessage());
            return updateStatus("❌ " + job.getMessage());
        }
        return updateStatus("✅ Готово, изображений: " + result.getImages().size())
                .thenMany(Flux.fromIterable(result.getImages())
                        .index()
                        .concatMap(indexed -> messageService.sendPhoto(chatId,
                                Base64.getDecoder().decode(indexed.getT2()),
                                indexed.getT1() == 0 ? truncate(caption) : null)))
                .then();
    }

    private Mono<Void> updateStatus(String text) {
        Mono<Long> sent = statusMessage.get();
        if (sent == null) {
            lastText.set(text);
            Mono<Long> message = messageService.sendMessage(chatId, text).cache();
            statusMessage.set(message);
            return message.then();
        }
        // Telegram отклоняет редактирование без изменения текста
        if (text.equals(lastText.getAndSet(text))) {
            return Mono.empty();
        }
        return sent.flatMap(messageId -> messageService.editMessageText(chatId, messageId, text));
    }

    private static String queuedText(int position) {
        return position <= 1
                ? "⏳ Задача в очереди, вы следующий"
                : "⏳ Задача в очереди, позиция: " + position;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_CAPTION_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_CAPTION_LENGTH - 1) + "…";
    }
}
