package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Настройки одного ревью. Чистая конфигурация, без идентичности.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSettings {

    private Integer maxComments; //Максимум замечаний в ответе

    private CommentSeverity minSeverity; //Минимальная серьёзность замечаний

    private List<String> focusAreas; //На чём сосредоточиться

    private List<String> ignorePatterns; //Что не комментировать

    private Map<String, Object> customRules; //Переопределения правил

    /**
     * Применяет фильтр по серьёзности и лимит количества к замечаниям модели.
     *
     * @param comments замечания в исходном порядке
     * @return отфильтрованный список (исходный порядок сохраняется)
     */
    public List<ReviewComment> apply(List<ReviewComment> comments) {
        if (comments == null || comments.isEmpty()) {
            return List.of();
        }
        var stream = comments.stream()
                .filter(c -> minSeverity == null || c.getSeverity().isAtLeast(minSeverity));
        if (maxComments != null && maxComments >= 0) {
            stream = stream.limit(maxComments);
        }
        return stream.toList();
    }
}
