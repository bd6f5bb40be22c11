package ru.oparin.dream.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.dream.config.properties.GenerationProperties;
import ru.oparin.dream.exception.AdmissionRejectedException;
import ru.oparin.dream.exception.RequestValidationException;
import ru.oparin.dream.model.dto.GenerationRequest;
import ru.oparin.dream.model.dto.RegionalConfig;
import ru.oparin.dream.model.dto.telegram.TelegramMessage;
import ru.oparin.dream.model.dto.telegram.TelegramPhoto;
import ru.oparin.dream.model.dto.telegram.TelegramUpdate;
import ru.oparin.dream.model.entity.UserSession;
import ru.oparin.dream.model.enums.AdmissionRejectionReason;
import ru.oparin.dream.model.enums.JobKind;
import ru.oparin.dream.model.enums.RegionalLayout;
import ru.oparin.dream.model.GenerationLimits;
import ru.oparin.dream.service.GenerationService;
import ru.oparin.dream.service.UserSessionService;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Основной сервис Telegram бота.
 * Разбирает команды и сообщения и ставит задачи генерации от имени пользователя tg:&lt;id&gt;.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramBotService {

    static final String CALLER_PREFIX = "tg:";

    private static final String REGIONAL_USAGE = """
            Формат: /regional схема | общий промпт | регион 1 | регион 2 [| регион 3 | регион 4]
            Схемы: vertical, horizontal, three_columns, four_columns, quadrants""";

    private final GenerationService generationService;
    private final UserSessionService userSessionService;
    private final TelegramMessageService telegramMessageService;
    private final TelegramFileService telegramFileService;
    private final GenerationProperties generationProperties;

    /**
     * Обработать обновление от Telegram.
     */
    public Mono<Void> processUpdate(TelegramUpdate update) {
        if (update == null || update.getMessage() == null) {
            log.debug("Обновление не содержит сообщения, пропускаем");
            return Mono.empty();
        }

        TelegramMessage message = update.getMessage();
        if (message.getChat() == null || message.getFrom() == null) {
            log.debug("Сообщение без чата или отправителя, пропускаем");
            return Mono.empty();
        }
        Long chatId = message.getChat().getId();
        String callerId = CALLER_PREFIX + message.getFrom().getId();

        return processMessage(message, chatId, callerId)
                .onErrorResume(error -> {
                    log.error("Ошибка обработки сообщения от пользователя {} в чате {}: {}",
                            callerId, chatId, error.getMessage(), error);
                    return telegramMessageService.sendErrorMessage(chatId, "Что-то пошло не так. Попробуйте позже.");
                });
    }

    private Mono<Void> processMessage(TelegramMessage message, Long chatId, String callerId) {
        if (message.getPhoto() != null && !message.getPhoto().isEmpty()) {
            return handlePhotoMessage(chatId, callerId, message);
        }

        String text = message.getText();
        if (text != null && text.startsWith("/")) {
            return handleCommand(chatId, callerId, text);
        }
        if (text != null && !text.isBlank()) {
            return generate(chatId, buildRequest(callerId, text.strip()), JobKind.TXT2IMG, null);
        }

        log.debug("Получено сообщение неизвестного типа от пользователя {} в чате {}", callerId, chatId);
        return sendMessage(chatId, "Отправьте текстовое описание или фото с подписью. Справка: /help");
    }

    private Mono<Void> handleCommand(Long chatId, String callerId, String text) {
        String[] parts = text.strip().split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        String args = parts.length > 1 ? parts[1].strip() : "";
        log.info("Команда {} от пользователя {} в чате {}", command, callerId, chatId);

        return switch (command) {
            case "/start" -> sendMessage(chatId, buildWelcomeMessage());
            case "/help" -> sendMessage(chatId, buildHelpMessage());
            case "/dream" -> args.isEmpty()
                    ? sendMessage(chatId, "Укажите описание: /dream <промпт>")
                    : generate(chatId, buildRequest(callerId, args), JobKind.TXT2IMG, null);
            case "/regional" -> handleRegionalCommand(chatId, callerId, args);
            case "/lora" -> handleLoraCommand(chatId, callerId, args);
            case "/loras" -> handleLorasCommand(chatId, callerId);
            case "/lora_clear" -> blocking(() -> userSessionService.clearModifiers(callerId))
                    .then(sendMessage(chatId, "🧹 Все LoRA удалены"));
            default -> sendMessage(chatId, "Неизвестная команда " + command + ". Справка: /help");
        };
    }

    private Mono<Void> handlePhotoMessage(Long chatId, String callerId, TelegramMessage message) {
        String caption = message.getCaption();
        if (caption == null || caption.isBlank()) {
            return sendMessage(chatId, "Добавьте к фото подпись с описанием того, что нужно получить");
        }
        List<TelegramPhoto> sizes = message.getPhoto();
        TelegramPhoto largest = sizes.get(sizes.size() - 1);
        log.info("Фото от пользователя {} в чате {}: {}", callerId, chatId, caption);

        return telegramFileService.downloadFile(largest.getFileId())
                .flatMap(bytes -> generate(chatId, buildRequest(callerId, caption.strip()), JobKind.IMG2IMG, bytes))
                .onErrorResume(error -> {
                    log.error("Ошибка обработки фото пользователя {}: {}", callerId, error.getMessage());
                    return telegramMessageService.sendErrorMessage(chatId, "Не удалось обработать фото. Попробуйте отправить его еще раз.");
                });
    }

    private Mono<Void> handleRegionalCommand(Long chatId, String callerId, String args) {
        RegionalConfig regional;
        try {
            regional = parseRegional(args);
        } catch (RequestValidationException e) {
            return sendMessage(chatId, "⚠️ " + e.getMessage() + "\n\n" + REGIONAL_USAGE);
        }
        GenerationRequest request = buildRequest(callerId, null).toBuilder()
                .regional(regional)
                .build();
        return generate(chatId, request, JobKind.REGIONAL, null);
    }

    private Mono<Void> handleLoraCommand(Long chatId, String callerId, String args) {
        if (args.isEmpty()) {
            return sendMessage(chatId, "Укажите LoRA: /lora <имя> [вес]");
        }
        String[] parts = args.split("\\s+");
        String name = parts[0];
        double weight = GenerationLimits.DEFAULT_MODIFIER_WEIGHT;
        if (parts.length > 1) {
            try {
                weight = Double.parseDouble(parts[1].replace(',', '.'));
            } catch (NumberFormatException e) {
                weight = Double.NaN;
            }
            if (!Double.isFinite(weight)) {
                return sendMessage(chatId, "⚠️ Вес должен быть числом, например: /lora " + name + " 0.8");
            }
        }
        double finalWeight = weight;
        return blocking(() -> userSessionService.addModifier(callerId, name, finalWeight))
                .then(sendMessage(chatId, "✅ LoRA " + name + " добавлена с весом " + finalWeight))
                .onErrorResume(RequestValidationException.class, e -> sendMessage(chatId, "⚠️ " + e.getMessage()));
    }

    private Mono<Void> handleLorasCommand(Long chatId, String callerId) {
        return blocking(() -> userSessionService.getSnapshot(callerId))
                .flatMap(session -> sendMessage(chatId, buildLorasMessage(session)));
    }

    /**
     * Поставить задачу в очередь. Отказы допуска и ошибки проверки сообщаются пользователю.
     */
    private Mono<Void> generate(Long chatId, GenerationRequest request, JobKind kind, byte[] image) {
        String caption = request.getPrompt() != null ? request.getPrompt() : describe(request.getRegional());
        TelegramProgressListener listener = new TelegramProgressListener(chatId, caption, telegramMessageService);

        return generationService.submit(request, kind, image, listener)
                .doOnNext(response -> log.info("Задача {} пользователя {} принята, позиция {}",
                        response.getJobId(), request.getUserId(), response.getPosition()))
                .then()
                .onErrorResume(AdmissionRejectedException.class, e -> sendMessage(chatId, buildRejectionMessage(e)))
                .onErrorResume(RequestValidationException.class, e -> sendMessage(chatId, "⚠️ " + e.getMessage()));
    }

    /**
     * Запрос с параметрами генерации по умолчанию для бота.
     */
    GenerationRequest buildRequest(String callerId, String prompt) {
        GenerationProperties.Defaults defaults = generationProperties.getDefaults();
        return GenerationRequest.builder()
                .userId(callerId)
                .prompt(prompt)
                .negativePrompt(defaults.getNegativePrompt())
                .samplerName(defaults.getSamplerName())
                .steps(defaults.getSteps())
                .cfgScale(defaults.getCfgScale())
                .width(defaults.getWidth())
                .height(defaults.getHeight())
                .denoisingStrength(defaults.getDenoisingStrength())
                .build();
    }

    /**
     * Разобрать аргументы /regional: схема | общий промпт | регион 1 | регион 2 [| регион 3 | регион 4].
     *
     * @throws RequestValidationException если аргументы не соответствуют формату
     */
    static RegionalConfig parseRegional(String args) {
        List<String> parts = Arrays.stream(args.split("\\|", -1))
                .map(String::strip)
                .toList();
        if (parts.size() < 4 || parts.size() > 6) {
            throw new RequestValidationException("Нужно от 2 до 4 регионов");
        }
        RegionalLayout layout;
        try {
            layout = RegionalLayout.fromString(parts.get(0));
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException(e.getMessage());
        }
        if (parts.get(2).isEmpty() || parts.get(3).isEmpty()) {
            throw new RequestValidationException("Промпты первых двух регионов обязательны");
        }
        return RegionalConfig.builder()
                .layout(layout)
                .common(parts.get(1))
                .region1(parts.get(2))
                .region2(parts.get(3))
                .region3(parts.size() > 4 && !parts.get(4).isEmpty() ? parts.get(4) : null)
                .region4(parts.size() > 5 && !parts.get(5).isEmpty() ? parts.get(5) : null)
                .build();
    }

    private <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(action)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> sendMessage(Long chatId, String text) {
        return telegramMessageService.sendMessage(chatId, text).then();
    }

    // ==================== Построение сообщений ====================

    private String buildWelcomeMessage() {
        return """
                👋 Добро пожаловать!

                🎨 Я генерирую изображения с помощью Stable Diffusion.
                Отправьте текстовое описание или фото с подписью.

                Справка: /help""";
    }

    private String buildHelpMessage() {
        return String.format("""
                🤖 Справка по боту

                🎨 Генерация:
                • Текст или /dream <промпт> - генерация по описанию
                • Фото с подписью - генерация на основе фото
                • /regional - отдельный промпт для каждой части кадра
                %s

                🧩 LoRA:
                • /lora <имя> [вес] - добавить LoRA (вес от %.1f до %.1f)
                • /loras - список добавленных LoRA
                • /lora_clear - удалить все LoRA

                ⏱ Одновременно выполняется одна задача, между генерациями пауза %d сек.""",
                REGIONAL_USAGE,
                GenerationLimits.MIN_MODIFIER_WEIGHT, GenerationLimits.MAX_MODIFIER_WEIGHT,
                generationProperties.getCooldown().toSeconds());
    }

    private String buildLorasMessage(UserSession session) {
        if (session.getModifiers().isEmpty()) {
            return "LoRA не добавлены. Добавить: /lora <имя> [вес]";
        }
        return session.getModifiers().entrySet().stream()
                .map(entry -> "• " + entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n", "🧩 Ваши LoRA:\n", ""));
    }

    private String buildRejectionMessage(AdmissionRejectedException e) {
        if (e.getReason() == AdmissionRejectionReason.ALREADY_GENERATING) {
            return "⏳ Дождитесь завершения текущей генерации";
        }
        return String.format("⏱ Подождите %d сек. перед следующей генерацией", e.getRemainingSeconds());
    }

    private static String describe(RegionalConfig regional) {
        if (regional == null) {
            return null;
        }
        return regional.getLayout().getKey() + ": " + regional.getRegion1() + " | " + regional.getRegion2();
    }
}
