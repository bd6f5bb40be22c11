package ru.oparin.dream.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Ответ Telegram Bot API.
 *
 * @param <T> тип поля result: сообщение для sendMessage/sendPhoto, файл для getFile
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramApiResponse<T> {

    private boolean ok;
    private T result;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;
}
