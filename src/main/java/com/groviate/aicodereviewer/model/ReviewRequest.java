package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Запрос на ревью одного файла к AI-провайдеру
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {

    private static final List<String> SECURITY_MARKERS = List.of(
            "password", "token", "secret", "auth", "crypt",
            "security", "permission", "access", "private");

    private static final List<String> PERFORMANCE_MARKERS = List.of(
            "loop", "query", "algorithm", "cache", "performance",
            "optimization", "batch", "concurrent", "thread");

    private CodeContext codeContext;

    private ReviewType reviewType;

    private ReviewSettings settings;

    @Builder.Default
    private Map<String, Object> generationParams = Map.of(); //Доп. параметры генерации (model и т.п.)

    private Integer maxTokens;

    @Builder.Default
    private Double temperature = 0.7;

    /**
     * Проверяет, что запрос можно отправлять провайдеру
     *
     * @return false если нет пути/содержимого, temperature вне [0, 1] или не задан тип ревью
     */
    public boolean validate() {
        if (codeContext == null) {
            return false;
        }
        if (codeContext.getContent() == null || codeContext.getContent().isEmpty()) {
            return false;
        }
        if (codeContext.getFilePath() == null || codeContext.getFilePath().isEmpty()) {
            return false;
        }
        if (temperature == null || temperature < 0 || temperature > 1) {
            return false;
        }
        return reviewType != null;
    }

    /**
     * Содержит ли код признаки security-чувствительной логики (ключи, токены, доступы)
     */
    public boolean isSecuritySensitive() {
        return containsAny(SECURITY_MARKERS);
    }

    /**
     * Содержит ли код признаки performance-критичной логики (циклы, запросы, потоки)
     */
    public boolean isPerformanceCritical() {
        return containsAny(PERFORMANCE_MARKERS);
    }

    private boolean containsAny(List<String> markers) {
        if (codeContext == null || codeContext.getContent() == null) {
            return false;
        }
        String lower = codeContext.getContent().toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }
}
