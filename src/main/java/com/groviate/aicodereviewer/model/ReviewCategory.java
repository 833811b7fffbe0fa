package com.groviate.aicodereviewer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * Категории проблем, которые может найти AI в коде
 */
@Getter
public enum ReviewCategory {

    SECURITY("security", "Уязвимость безопасности"),

    PERFORMANCE("performance", "Проблемы производительности"),

    STYLE("style", "Нарушение стиля кода"),

    LOGIC("logic", "Логическая ошибка"),

    DOCUMENTATION("documentation", "Документация"),

    BEST_PRACTICES("best_practices", "Лучшие практики");

    private final String value;
    private final String description;

    ReviewCategory(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Приводит категорию из ответа модели к известному набору.
     * Пробелы и дефисы считаются подчёркиванием ("best-practices" -> best_practices).
     * Всё нераспознанное становится {@link #BEST_PRACTICES}.
     *
     * @param raw значение из ответа модели (может быть null)
     * @return нормализованная категория
     */
    @JsonCreator
    public static ReviewCategory normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return BEST_PRACTICES;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ReviewCategory c : values()) {
            if (c.value.equals(v)) {
                return c;
            }
        }
        return BEST_PRACTICES;
    }
}
