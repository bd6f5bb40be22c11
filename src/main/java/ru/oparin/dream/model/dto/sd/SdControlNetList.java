package ru.oparin.dream.model.dto.sd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Ответ /controlnet/model_list и /controlnet/module_list.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SdControlNetList {

    @JsonProperty("model_list")
    private List<String> modelList;

    @JsonProperty("module_list")
    private List<String> moduleList;
}
