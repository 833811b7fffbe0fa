package com.groviate.aicodereviewer.report.template;

import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewCategory;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.report.MarkdownSupport;
import com.groviate.aicodereviewer.report.ReportSection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Аудит безопасности: замечания категории security, сгруппированные по серьёзности
 */
public class SecurityAuditTemplate extends ReportTemplate {

    public static final String ID = "security-audit";

    private static final List<CommentSeverity> REPORTED = List.of(
            CommentSeverity.ERROR, CommentSeverity.WARNING, CommentSeverity.SUGGESTION);

    private final Map<String, TemplateVariable> variables = new LinkedHashMap<>();

    public SecurityAuditTemplate() {
        variables.put(REVIEW, TemplateVariable.builder().name(REVIEW).description("Результат ревью").build());
        variables.put(FILE_PATH, TemplateVariable.builder().name(FILE_PATH).description("Путь к файлу").build());
        variables.put(INCLUDE_CODE, TemplateVariable.builder()
                .name(INCLUDE_CODE)
                .description("Добавлять предлагаемые исправления")
                .required(false)
                .defaultValue(Boolean.FALSE)
                .build());
    }

    @Override
    public String getTemplateId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Security Audit Report";
    }

    @Override
    public String getDescription() {
        return "Подробный отчёт аудита безопасности";
    }

    @Override
    public Map<String, TemplateVariable> getVariables() {
        return variables;
    }

    @Override
    public List<ReportSection> render(Map<String, Object> context) {
        Map<String, Object> ctx = withDefaults(context);
        ReviewResponse review = (ReviewResponse) ctx.get(REVIEW);
        String filePath = (String) ctx.get(FILE_PATH);
        boolean includeCode = flag(ctx, INCLUDE_CODE);

        Map<String, Object> overviewMetrics = new LinkedHashMap<>();
        overviewMetrics.put("security_score", review.getScore());

        String overview = "# Аудит безопасности\n\n"
                + "## Файл\n"
                + "- **Файл:** `" + filePath + "`\n"
                + "- **Дата аудита:** " + reportDate(ctx) + "\n"
                + "- **Оценка безопасности:** " + MarkdownSupport.formatScore(review.getScore()) + "\n\n"
                + "## Итог\n"
                + review.getSummary();

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder()
                .title("Security Audit Overview")
                .content(overview)
                .metrics(overviewMetrics)
                .build());

        List<ReviewComment> security = review.getCommentsByCategory(ReviewCategory.SECURITY);
        for (CommentSeverity severity : REPORTED) {
            List<ReviewComment> comments = security.stream().filter(c -> c.getSeverity() == severity).toList();
            if (comments.isEmpty()) {
                continue;
            }

            StringBuilder sb = new StringBuilder("## ")
                    .append(MarkdownSupport.severityLabel(severity)).append(": проблемы безопасности\n\n");
            for (ReviewComment c : comments) {
                sb.append("### Строка ").append(MarkdownSupport.lineLabel(c.getLineNumber())).append('\n')
                        .append(c.getContent()).append("\n\n");
                if (includeCode && c.getSuggestedFix() != null) {
                    sb.append("**Исправление:**\n```\n").append(c.getSuggestedFix()).append("\n```\n\n");
                }
            }

            sections.add(ReportSection.builder()
                    .title(MarkdownSupport.capitalize(severity.getValue()) + " Security Issues")
                    .content(sb.toString())
                    .severity(severity)
                    .metrics(new LinkedHashMap<>(Map.of("count", comments.size())))
                    .build());
        }
        return sections;
    }
}
