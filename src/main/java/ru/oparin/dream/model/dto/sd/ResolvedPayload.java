package ru.oparin.dream.model.dto.sd;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Готовый запрос к Stable Diffusion API.
 * Документ копируется при создании и при каждом чтении, поэтому снаружи изменить его нельзя.
 */
@EqualsAndHashCode
@ToString
public class ResolvedPayload {

    /** Endpoint API: txt2img или img2img. */
    @Getter
    private final String endpoint;

    private final ObjectNode document;

    public ResolvedPayload(String endpoint, ObjectNode document) {
        this.endpoint = endpoint;
        this.document = document.deepCopy();
    }

    public ObjectNode getDocument() {
        return document.deepCopy();
    }

    public String getPrompt() {
        return document.path("prompt").asText("");
    }
}
