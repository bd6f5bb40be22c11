package ru.oparin.dream.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Сообщение Telegram. Фото приходит списком размеров, последний элемент - самый крупный.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramMessage {

    @JsonProperty("message_id")
    private Long messageId;

    private TelegramUser from;
    private TelegramChat chat;
    private String text;
    private String caption;
    private List<TelegramPhoto> photo;
}
