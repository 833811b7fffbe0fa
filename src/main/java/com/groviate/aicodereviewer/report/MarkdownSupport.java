package com.groviate.aicodereviewer.report;

import com.groviate.aicodereviewer.model.CommentSeverity;

import java.util.Locale;
import java.util.Map;

/**
 * Общие markdown-хелперы для генератора отчётов и шаблонов
 */
public final class MarkdownSupport {

    public static final String NOT_AVAILABLE = "N/A";

    private MarkdownSupport() {
    }

    /**
     * @return строка вида "🔴 Error"
     */
    public static String severityLabel(CommentSeverity severity) {
        return getSeverityEmoji(severity) + " " + capitalize(severity.getValue());
    }

    public static String getSeverityEmoji(CommentSeverity severity) {
        return switch (severity) {
            case ERROR -> "🔴";
            case WARNING -> "🟡";
            case SUGGESTION -> "🔵";
            case PRAISE -> "💚";
        };
    }

    /**
     * Таблица "| Метрика | Значение |". Пустые метрики дают пустую строку.
     */
    public static String metricsTable(Map<String, Object> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return "";
        }
        StringBuilder table = new StringBuilder("| Метрика | Значение |\n|--------|-------|\n");
        metrics.forEach((key, value) -> table.append("| ").append(key).append(" | ")
                .append(formatValue(value)).append(" |\n"));
        return table.toString();
    }

    public static String formatValue(Object value) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        if (value instanceof Double || value instanceof Float) {
            return String.format(Locale.ROOT, "%.2f", ((Number) value).doubleValue());
        }
        return value.toString();
    }

    public static String formatScore(Double score) {
        return score == null ? NOT_AVAILABLE : String.format(Locale.ROOT, "%.2f", score);
    }

    public static String lineLabel(Integer lineNumber) {
        return lineNumber == null ? NOT_AVAILABLE : lineNumber.toString();
    }

    public static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
