package com.groviate.aicodereviewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Одно замечание, найденное AI при ревью файла
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewComment {

    private Integer lineNumber; //Номер строки в файле (null - замечание ко всему файлу)

    private String content; //Текст замечания

    @Builder.Default
    private CommentSeverity severity = CommentSeverity.SUGGESTION;

    @Builder.Default
    private ReviewCategory category = ReviewCategory.BEST_PRACTICES;

    private String suggestedFix; //Предложение по исправлению
}
