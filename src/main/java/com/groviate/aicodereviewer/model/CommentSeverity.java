package com.groviate.aicodereviewer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * Серьёзность замечания ревью
 */
@Getter
public enum CommentSeverity {

    ERROR("error", 3, "Ошибка - обязательно исправить"),

    WARNING("warning", 2, "Предупреждение - желательно исправить"),

    SUGGESTION("suggestion", 1, "Предложение - можно улучшить"),

    PRAISE("praise", 0, "Похвала - хорошее решение");

    private final String value;
    private final int rank; // чем больше, тем серьёзнее
    private final String description;

    CommentSeverity(String value, int rank, String description) {
        this.value = value;
        this.rank = rank;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Приводит произвольную строку от модели к закрытому набору.
     * Неизвестное или пустое значение превращается в {@link #SUGGESTION}.
     *
     * @param raw значение из ответа модели (может быть null)
     * @return нормализованная серьёзность
     */
    @JsonCreator
    public static CommentSeverity normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return SUGGESTION;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (CommentSeverity s : values()) {
            if (s.value.equals(v)) {
                return s;
            }
        }
        return SUGGESTION;
    }

    public boolean isAtLeast(CommentSeverity other) {
        return other == null || this.rank >= other.rank;
    }
}
