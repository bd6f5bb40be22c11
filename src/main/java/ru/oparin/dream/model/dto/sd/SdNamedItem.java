package ru.oparin.dream.model.dto.sd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Элемент списков моделей, VAE, сэмплеров и апскейлеров.
 * У разных endpoint'ов имя лежит в разных полях.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SdNamedItem {

    private String name;

    private String title;

    @JsonProperty("model_name")
    private String modelName;

    /**
     * Имя для отображения пользователю.
     */
    public String displayName() {
        if (title != null) {
            return title;
        }
        return name != null ? name : modelName;
    }
}
