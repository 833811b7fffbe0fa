package com.groviate.aicodereviewer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.groviate.aicodereviewer.exception.ConfigurationException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Типы ревью, которые умеет выполнять AI
 */
@Getter
public enum ReviewType {

    FULL("full", "Полное ревью"),

    SECURITY("security", "Ревью безопасности"),

    PERFORMANCE("performance", "Ревью производительности"),

    MAINTAINABILITY("maintainability", "Сопровождаемость и качество кода"),

    STYLE("style", "Стиль и форматирование"),

    DOCUMENTATION("documentation", "Качество документации"),

    QUICK("quick", "Быстрый обзор критичных проблем");

    private final String value;
    private final String description;

    ReviewType(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Находит тип ревью по строковому значению (без учёта регистра)
     *
     * @param value строковое значение, например "security"
     * @return тип ревью
     * @throws ConfigurationException если значение не входит в перечисление
     */
    @JsonCreator
    public static ReviewType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ReviewType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        String available = Arrays.stream(values()).map(ReviewType::getValue).collect(Collectors.joining(", "));
        throw new ConfigurationException("Unknown review type: " + value + ". Available: " + available);
    }
}
