package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Результат ревью одного файла от AI
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewResponse {

    @Builder.Default
    private List<ReviewComment> comments = List.of();

    private String summary;

    private Double score; //Общая оценка качества в диапазоне [0, 1], может отсутствовать

    @Builder.Default
    private Map<String, Object> metadata = Map.of();

    @Builder.Default
    private Instant timestamp = Instant.now();

    public List<ReviewComment> getCommentsBySeverity(CommentSeverity severity) {
        return comments.stream().filter(c -> c.getSeverity() == severity).toList();
    }

    public List<ReviewComment> getCommentsByCategory(ReviewCategory category) {
        return comments.stream().filter(c -> c.getCategory() == category).toList();
    }

    /**
     * @return true если есть хотя бы одно замечание уровня error
     */
    public boolean hasCriticalIssues() {
        return comments.stream().anyMatch(c -> c.getSeverity() == CommentSeverity.ERROR);
    }
}
