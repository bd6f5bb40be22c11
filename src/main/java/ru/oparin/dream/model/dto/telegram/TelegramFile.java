package ru.oparin.dream.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Описание файла из ответа getFile. Путь используется для скачивания содержимого.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramFile {

    @JsonProperty("file_id")
    private String fileId;

    @JsonProperty("file_path")
    private String filePath;
}
