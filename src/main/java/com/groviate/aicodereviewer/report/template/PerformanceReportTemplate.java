package com.groviate.aicodereviewer.report.template;

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
 * Анализ производительности с рекомендациями по оптимизации
 */
public class PerformanceReportTemplate extends ReportTemplate {

    public static final String ID = "performance-report";

    private final Map<String, TemplateVariable> variables = new LinkedHashMap<>();

    public PerformanceReportTemplate() {
        variables.put(REVIEW, TemplateVariable.builder().name(REVIEW).description("Результат ревью").build());
        variables.put(FILE_PATH, TemplateVariable.builder().name(FILE_PATH).description("Путь к файлу").build());
        variables.put(INCLUDE_METRICS, TemplateVariable.builder()
                .name(INCLUDE_METRICS)
                .description("Добавлять метрики в разделы")
                .required(false)
                .defaultValue(Boolean.TRUE)
                .build());
    }

    @Override
    public String getTemplateId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Performance Analysis Report";
    }

    @Override
    public String getDescription() {
        return "Анализ производительности с рекомендациями по оптимизации";
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
        boolean includeMetrics = flag(ctx, INCLUDE_METRICS);

        Map<String, Object> overviewMetrics = new LinkedHashMap<>();
        overviewMetrics.put("performance_score", review.getScore());

        String overview = "# Анализ производительности\n\n"
                + "## Файл\n"
                + "- **Файл:** `" + filePath + "`\n"
                + "- **Дата анализа:** " + reportDate(ctx) + "\n"
                + "- **Оценка производительности:** " + MarkdownSupport.formatScore(review.getScore()) + "\n\n"
                + "## Итог\n"
                + review.getSummary();

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder()
                .title("Performance Analysis Overview")
                .content(overview)
                .metrics(overviewMetrics)
                .build());

        List<ReviewComment> performance = review.getCommentsByCategory(ReviewCategory.PERFORMANCE);
        if (!performance.isEmpty()) {
            StringBuilder sb = new StringBuilder("## Проблемы производительности\n\n");
            for (ReviewComment c : performance) {
                sb.append("### ").append(MarkdownSupport.severityLabel(c.getSeverity()));
                if (c.getLineNumber() != null) {
                    sb.append(" (строка ").append(c.getLineNumber()).append(')');
                }
                sb.append('\n').append(c.getContent()).append("\n\n");
                if (c.getSuggestedFix() != null) {
                    sb.append("**Как оптимизировать:**\n```\n").append(c.getSuggestedFix()).append("\n```\n\n");
                }
            }

            Map<String, Object> metrics = new LinkedHashMap<>();
            if (includeMetrics) {
                metrics.put("total_issues", performance.size());
            }
            sections.add(ReportSection.builder()
                    .title("Performance Issues")
                    .content(sb.toString())
                    .metrics(metrics)
                    .build());
        }
        return sections;
    }
}
