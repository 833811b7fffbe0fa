package com.groviate.aicodereviewer.report.template;

import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.report.MarkdownSupport;
import com.groviate.aicodereviewer.report.ReportSection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Краткая выжимка для руководителя: ключевые цифры и критичные проблемы
 */
public class ExecutiveSummaryTemplate extends ReportTemplate {

    public static final String ID = "executive-summary";

    private final Map<String, TemplateVariable> variables = new LinkedHashMap<>();

    public ExecutiveSummaryTemplate() {
        variables.put(REVIEW, TemplateVariable.builder().name(REVIEW).description("Результат ревью").build());
        variables.put(FILE_PATH, TemplateVariable.builder().name(FILE_PATH).description("Путь к файлу").build());
        variables.put(REVIEW_TYPE, TemplateVariable.builder().name(REVIEW_TYPE).description("Тип ревью").build());
    }

    @Override
    public String getTemplateId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Executive Summary";
    }

    @Override
    public String getDescription() {
        return "Краткий итог с ключевыми находками и рекомендациями";
    }

    @Override
    public Map<String, TemplateVariable> getVariables() {
        return variables;
    }

    @Override
    public List<ReportSection> render(Map<String, Object> context) {
        ReviewResponse review = (ReviewResponse) context.get(REVIEW);
        String filePath = (String) context.get(FILE_PATH);
        ReviewType reviewType = (ReviewType) context.get(REVIEW_TYPE);

        List<ReviewComment> critical = review.getCommentsBySeverity(CommentSeverity.ERROR);
        int warnings = review.getCommentsBySeverity(CommentSeverity.WARNING).size();
        int suggestions = review.getCommentsBySeverity(CommentSeverity.SUGGESTION).size();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("critical_issues", critical.size());
        metrics.put("warnings", warnings);
        metrics.put("suggestions", suggestions);
        metrics.put("quality_score", review.getScore());

        String content = "# Executive Summary\n\n"
                + "## Обзор\n"
                + "- **Файл:** `" + filePath + "`\n"
                + "- **Тип ревью:** " + reviewType.getValue() + "\n"
                + "- **Оценка качества:** " + MarkdownSupport.formatScore(review.getScore()) + "\n"
                + "- **Дата ревью:** " + reportDate(context) + "\n\n"
                + "## Ключевые находки\n"
                + "- Критичные проблемы: " + critical.size() + "\n"
                + "- Предупреждения: " + warnings + "\n"
                + "- Предложения: " + suggestions + "\n\n"
                + "## Итог\n"
                + review.getSummary();

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder().title("Executive Summary").content(content).metrics(metrics).build());

        if (!critical.isEmpty()) {
            StringBuilder sb = new StringBuilder("## Критичные проблемы\n\n");
            for (ReviewComment c : critical) {
                sb.append("- **").append(c.getCategory().getValue()).append("** (строка ")
                        .append(MarkdownSupport.lineLabel(c.getLineNumber())).append("):\n  ")
                        .append(c.getContent()).append("\n\n");
            }
            sections.add(ReportSection.builder()
                    .title("Critical Issues")
                    .content(sb.toString())
                    .severity(CommentSeverity.ERROR)
                    .metrics(new LinkedHashMap<>(Map.of("count", critical.size())))
                    .build());
        }
        return sections;
    }
}
