package com.groviate.aicodereviewer.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.aicodereviewer.exception.ReviewException;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewCategory;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разбирает текстовый ответ модели в {@link ReviewResponse}.
 * <p>
 * 1. Находит JSON-объект внутри произвольного текста (модель может обернуть его в пояснения или ```json)
 * 2. Проверяет обязательные поля summary и comments
 * 3. Нормализует severity и category каждого замечания
 * 4. Пропускает замечания без content, не прерывая разбор остальных
 */
@Slf4j
public class ReviewResponseParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReviewResponseParser(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param raw ответ модели
     * @return разобранный ответ
     * @throws ReviewException JSON не найден, не декодируется или нет summary/comments
     */
    public ReviewResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ReviewException("AI returned empty response");
        }

        JsonNode root = locateResponseObject(raw);
        if (!root.get("comments").isArray()) {
            throw new ReviewException("AI response field 'comments' is not an array");
        }

        List<ReviewComment> comments = new ArrayList<>();
        int skipped = 0;
        for (JsonNode node : root.get("comments")) {
            ReviewComment comment = parseComment(node);
            if (comment == null) {
                skipped++;
            } else {
                comments.add(comment);
            }
        }
        if (skipped > 0) {
            log.debug("Пропущено замечаний без content: {}", skipped);
        }

        return ReviewResponse.builder()
                .comments(comments)
                .summary(root.get("summary").asText())
                .score(normalizeScore(root.get("score")))
                .metadata(readMetadata(root.get("metadata")))
                .timestamp(Instant.now(clock))
                .build();
    }

    private ReviewComment parseComment(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode content = firstPresent(node, "content", "message");
        if (content == null || !content.isValueNode() || content.asText().isBlank()) {
            return null;
        }
        JsonNode fix = firstPresent(node, "suggested_fix", "suggestedFix");

        return ReviewComment.builder()
                .lineNumber(readLine(firstPresent(node, "line_number", "lineNumber", "line")))
                .content(content.asText())
                .severity(CommentSeverity.normalize(textOrNull(node.get("severity"))))
                .category(ReviewCategory.normalize(textOrNull(node.get("category"))))
                .suggestedFix(fix == null ? null : fix.asText())
                .build();
    }

    private Integer readLine(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Оценка в [0, 1] остаётся как есть, шкала (1, 10] приводится делением на 10, остальное отбрасывается
     */
    private Double normalizeScore(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        if (value >= 0 && value <= 1) {
            return value;
        }
        if (value > 1 && value <= 10) {
            return value / 10.0;
        }
        return null;
    }

    private Map<String, Object> readMetadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return new LinkedHashMap<>(objectMapper.convertValue(node, MAP_TYPE));
    }

    private static JsonNode firstPresent(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        return (node == null || node.isNull()) ? null : node.asText();
    }

    /**
     * Ищет в тексте ответа JSON-объект с summary и comments.
     * Перебирает все открывающие скобки по порядку: фигурные скобки в пояснениях модели пропускаются.
     *
     * @throws ReviewException если подходящего объекта нет (сообщение по первому найденному кандидату)
     */
    private JsonNode locateResponseObject(String raw) {
        String s = raw.trim();
        JsonNode firstDecoded = null;
        JsonProcessingException firstFailure = null;

        for (int start = s.indexOf('{'); start >= 0; start = s.indexOf('{', start + 1)) {
            int end = findJsonEnd(s, start);
            if (end < 0) {
                continue;
            }
            try {
                JsonNode candidate = objectMapper.readTree(s.substring(start, end + 1));
                if (candidate.hasNonNull("summary") && candidate.hasNonNull("comments")) {
                    return candidate;
                }
                if (firstDecoded == null) {
                    firstDecoded = candidate;
                }
            } catch (JsonProcessingException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (firstDecoded != null) {
            List<String> missing = new ArrayList<>();
            if (!firstDecoded.hasNonNull("summary")) missing.add("summary");
            if (!firstDecoded.hasNonNull("comments")) missing.add("comments");
            throw new ReviewException("AI response is missing required fields: " + String.join(", ", missing));
        }
        if (firstFailure != null) {
            throw new ReviewException("Failed to decode AI response JSON: " + firstFailure.getOriginalMessage(),
                    firstFailure);
        }
        throw new ReviewException("No JSON object found in AI response");
    }

    /**
     * Ищет закрывающую скобку объекта, учитывая строки и экранирование.
     */
    private int findJsonEnd(String s, int start) {
        boolean inString = false;
        boolean escaped = false;
        int depth = 0;

        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);

            boolean currentCharIsEscaped = escaped;
            escaped = !escaped && c == '\\';

            if (currentCharIsEscaped) {
                continue;
            }
            if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }

        return -1;
    }
}
