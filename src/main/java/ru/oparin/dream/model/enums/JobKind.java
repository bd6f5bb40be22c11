package ru.oparin.dream.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Вид задачи генерации.
 */
@Getter
@RequiredArgsConstructor
public enum JobKind {

    /** Генерация по текстовому описанию. */
    TXT2IMG("txt2img"),

    /** Генерация на основе исходного изображения. */
    IMG2IMG("img2img"),

    /** Генерация с управлением структурой через ControlNet. */
    CONTROLNET("txt2img"),

    /** Генерация с разбиением кадра на регионы. */
    REGIONAL("txt2img");

    /**
     * Endpoint Stable Diffusion API, на который отправляется задача.
     */
    private final String endpoint;
}
