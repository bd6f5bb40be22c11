package ru.oparin.dream.model.dto.sd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Ответ endpoint'ов txt2img и img2img.
 * Поле info приходит строкой с JSON внутри.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SdImageResponse {

    private List<String> images;
    private JsonNode parameters;
    private String info;
}
