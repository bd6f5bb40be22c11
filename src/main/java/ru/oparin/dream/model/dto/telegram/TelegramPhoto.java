package ru.oparin.dream.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Один из размеров присланного фото.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramPhoto {

    @JsonProperty("file_id")
    private String fileId;

    private Integer width;
    private Integer height;
}
