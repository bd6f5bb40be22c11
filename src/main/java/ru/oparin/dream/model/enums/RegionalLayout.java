package ru.oparin.dream.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Схема разбиения кадра на регионы для расширения Regional Prompter.
 * <p>
 * Каждая схема задает разделители между промптами регионов и фиксированный набор
 * аргументов расширения. Регион с номером больше второго, если не задан,
 * берет промпт региона на два номера раньше (третий - первого, четвертый - второго).
 */
@Getter
public enum RegionalLayout {

    VERTICAL("vertical", "Vertical", "1,1", "ADDCOL"),
    HORIZONTAL("horizontal", "Horizontal", "1,1", "ADDROW"),
    THREE_COLUMNS("three_columns", "Vertical", "1,1,1", "ADDCOL", "ADDCOL"),
    FOUR_COLUMNS("four_columns", "Vertical", "1,1,1,1", "ADDCOL", "ADDCOL", "ADDCOL"),
    QUADRANTS("quadrants", "Vertical", "2,2", "ADDCOL", "ADDROW", "ADDCOL");

    /** Разделитель общего промпта и промптов регионов. */
    public static final String COMMON_SEPARATOR = "ADDCOMM";

    /** Ключ расширения в секции alwayson_scripts. */
    public static final String SCRIPT_NAME = "Regional Prompter";

    private final String key;
    private final String direction;
    private final String ratios;
    private final List<String> separators;

    RegionalLayout(String key, String direction, String ratios, String... separators) {
        this.key = key;
        this.direction = direction;
        this.ratios = ratios;
        this.separators = List.of(separators);
    }

    /**
     * Количество регионов в схеме.
     */
    public int getRegionCount() {
        return separators.size() + 1;
    }

    /**
     * Аргументы расширения Regional Prompter для этой схемы.
     * Порядок аргументов совпадает с порядком параметров во вкладке расширения.
     *
     * @return новый изменяемый список аргументов
     */
    public List<Object> scriptArgs() {
        return new ArrayList<>(Arrays.asList(
                true, false, "Matrix", direction, "Mask", "Prompt", ratios, "",
                false, true, false, "Attention", false, "0", "0", "0", ""));
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Найти схему по ключу (vertical, three_columns и т.д.) без учета регистра.
     *
     * @param value ключ или имя константы
     * @return схема
     * @throws IllegalArgumentException если схема не найдена
     */
    @JsonCreator
    public static RegionalLayout fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Схема регионов не указана");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(layout -> layout.key.equalsIgnoreCase(normalized) || layout.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Неизвестная схема регионов: " + value));
    }
}
