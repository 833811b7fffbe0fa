package com.groviate.aicodereviewer.report;

import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.report.template.ReportTemplate;
import com.groviate.aicodereviewer.report.template.TemplateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Генератор отчётов в формате markdown.
 * <p>
 * Отчёт по файлу рисуется зарегистрированным шаблоном, если он указан и контекст для него полный,
 * иначе используется стандартный формат: обзор с метриками и по разделу на каждую серьёзность.
 */
@Service
@Slf4j
public class MarkdownReportGenerator implements ReportGenerator {

    private static final List<CommentSeverity> SEVERITY_ORDER = List.of(
            CommentSeverity.ERROR, CommentSeverity.WARNING, CommentSeverity.SUGGESTION, CommentSeverity.PRAISE);

    static final String HISTORY_TITLE = "Historical Review Analysis";
    static final String TREND_TITLE = "Review Trend Analysis";

    private final TemplateRegistry templateRegistry;
    private final Clock clock;

    public MarkdownReportGenerator(TemplateRegistry templateRegistry, Clock clock) {
        this.templateRegistry = templateRegistry;
        this.clock = clock;
    }

    @Override
    public ReviewReport generateFileReport(ReviewResponse review, String filePath, ReviewType reviewType,
                                           boolean includeCode, String templateId) {
        Instant now = Instant.now(clock);

        Optional<ReviewReport> templated = renderWithTemplate(review, filePath, reviewType, includeCode, templateId, now);
        if (templated.isPresent()) {
            return templated.get();
        }

        Map<String, Object> metrics = reviewMetrics(review);

        String overview = "## Итог ревью\n"
                + review.getSummary() + "\n\n"
                + "### Файл\n"
                + "- **Файл:** `" + filePath + "`\n"
                + "- **Тип ревью:** " + reviewType.getValue() + "\n"
                + "- **Время:** " + now + "\n\n"
                + MarkdownSupport.metricsTable(metrics);

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder().title("Overview").content(overview).metrics(metrics).build());

        for (CommentSeverity severity : SEVERITY_ORDER) {
            List<ReviewComment> comments = review.getCommentsBySeverity(severity);
            if (comments.isEmpty()) {
                continue;
            }

            StringBuilder sb = new StringBuilder("## ").append(MarkdownSupport.severityLabel(severity))
                    .append(" Comments\n\n");
            for (ReviewComment c : comments) {
                sb.append("### ").append(c.getLineNumber() != null ? "Строка " + c.getLineNumber() : "Весь файл")
                        .append('\n').append(c.getContent()).append("\n\n");
                if (includeCode && c.getSuggestedFix() != null) {
                    sb.append("**Исправление:**\n```\n").append(c.getSuggestedFix()).append("\n```\n\n");
                }
            }

            sections.add(ReportSection.builder()
                    .title(MarkdownSupport.capitalize(severity.getValue()) + " Comments")
                    .content(sb.toString())
                    .severity(severity)
                    .metrics(new LinkedHashMap<>(Map.of("count", comments.size())))
                    .build());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", filePath);
        metadata.put("review_type", reviewType.getValue());
        metadata.put("metrics", metrics);

        return ReviewReport.builder()
                .title("Code Review: " + filePath)
                .summary(review.getSummary())
                .sections(sections)
                .timestamp(now)
                .metadata(metadata)
                .build();
    }

    @Override
    public ReviewReport generateMultiFileReport(Map<String, ReviewResponse> reviews, ReviewType reviewType,
                                                boolean includeCode, String templateId) {
        Instant now = Instant.now(clock);
        List<ReportSection> fileSections = new ArrayList<>();
        int totalIssues = 0;

        for (Map.Entry<String, ReviewResponse> e : reviews.entrySet()) {
            ReviewReport fileReport = generateFileReport(e.getValue(), e.getKey(), reviewType, includeCode, templateId);
            Map<String, Object> metrics = reviewMetrics(e.getValue());
            totalIssues += e.getValue().getComments().size();

            fileSections.add(ReportSection.builder()
                    .title(e.getKey())
                    .content("## " + e.getKey() + "\n\n" + fileReport.getSummary() + "\n\n"
                            + MarkdownSupport.metricsTable(metrics))
                    .metrics(metrics)
                    .build());
        }

        List<Double> scores = reviews.values().stream()
                .map(ReviewResponse::getScore)
                .filter(Objects::nonNull)
                .toList();

        Map<String, Object> overall = new LinkedHashMap<>();
        overall.put("total_files", reviews.size());
        overall.put("total_issues", totalIssues);
        overall.put("avg_issues_per_file", reviews.isEmpty() ? 0.0 : (double) totalIssues / reviews.size());
        overall.put("avg_quality_score", average(scores));

        String overview = "# Отчёт по ревью нескольких файлов\n\n"
                + "## Итог\n"
                + "- Проверено файлов: " + reviews.size() + "\n"
                + "- Найдено замечаний: " + totalIssues + "\n"
                + "- Тип ревью: " + reviewType.getValue() + "\n"
                + "- Сформирован: " + now + "\n\n"
                + MarkdownSupport.metricsTable(overall);

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder().title("Overview").content(overview).metrics(overall).build());
        sections.addAll(fileSections);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("review_type", reviewType.getValue());
        metadata.put("file_count", reviews.size());
        metadata.put("metrics", overall);
        metadata.put("template_id", templateId);

        return ReviewReport.builder()
                .title("Multi-File Code Review Report")
                .summary("Ревью " + reviews.size() + " файлов")
                .sections(sections)
                .timestamp(now)
                .metadata(metadata)
                .build();
    }

    @Override
    public ReviewReport generateHistoricalReport(List<ReviewRecord> records, String filePath, ReviewType reviewType) {
        Instant now = Instant.now(clock);
        if (records == null || records.isEmpty()) {
            return ReviewReport.builder()
                    .title(HISTORY_TITLE)
                    .summary("История ревью отсутствует")
                    .timestamp(now)
                    .build();
        }

        List<ReviewRecord> chronological = records.stream()
                .sorted(Comparator.comparing(ReviewRecord::getTimestamp))
                .toList();
        List<Double> scores = chronological.stream()
                .map(r -> r.getResponse().getScore())
                .filter(Objects::nonNull)
                .toList();

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_reviews", records.size());
        metrics.put("avg_quality_score", average(scores));
        metrics.put("first_review", chronological.get(0).getTimestamp().toString());
        metrics.put("latest_review", chronological.get(chronological.size() - 1).getTimestamp().toString());

        String overview = "# История ревью\n"
                + (filePath != null ? "## Файл: `" + filePath + "`\n" : "## Все файлы\n")
                + (reviewType != null ? "Тип ревью: " + reviewType.getValue() + "\n" : "")
                + "\n" + MarkdownSupport.metricsTable(metrics);

        StringBuilder trend = new StringBuilder("## Динамика оценки качества\n\n");
        if (scores.isEmpty()) {
            trend.append("Нет оценок для анализа динамики.\n");
        } else {
            for (ReviewRecord r : chronological) {
                if (r.getResponse().getScore() != null) {
                    trend.append("- ").append(r.getTimestamp()).append(": ")
                            .append(MarkdownSupport.formatScore(r.getResponse().getScore())).append('\n');
                }
            }
        }

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder().title("Historical Analysis Overview").content(overview).metrics(metrics).build());
        sections.add(ReportSection.builder().title("Trend Analysis").content(trend.toString()).build());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("file_path", filePath);
        metadata.put("review_type", reviewType != null ? reviewType.getValue() : null);
        metadata.put("metrics", metrics);

        return ReviewReport.builder()
                .title(HISTORY_TITLE)
                .summary("Анализ " + records.size() + " ревью")
                .sections(sections)
                .timestamp(now)
                .metadata(metadata)
                .build();
    }

    @Override
    public ReviewReport generateTrendReport(List<ReviewRecord> records, Instant start, Instant end,
                                            ReviewType reviewType) {
        Instant now = Instant.now(clock);
        if (records == null || records.isEmpty()) {
            return ReviewReport.builder()
                    .title(TREND_TITLE)
                    .summary("Нет ревью для анализа динамики")
                    .timestamp(now)
                    .build();
        }

        Map<LocalDate, List<ReviewRecord>> byDay = new TreeMap<>();
        for (ReviewRecord r : records) {
            byDay.computeIfAbsent(r.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate(), d -> new ArrayList<>()).add(r);
        }

        List<Map<String, Object>> daily = new ArrayList<>();
        StringBuilder table = new StringBuilder("## Разбивка по дням\n\n")
                .append("| Дата | Ревью | Средняя оценка |\n|------|----------|------------|\n");
        byDay.forEach((day, dayRecords) -> {
            Double avg = average(dayRecords.stream()
                    .map(r -> r.getResponse().getScore())
                    .filter(Objects::nonNull)
                    .toList());

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", day.toString());
            row.put("review_count", dayRecords.size());
            row.put("avg_score", avg);
            daily.add(row);

            table.append("| ").append(day).append(" | ").append(dayRecords.size()).append(" | ")
                    .append(MarkdownSupport.formatScore(avg)).append(" |\n");
        });

        double perDay = (double) records.size() / byDay.size();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_reviews", records.size());
        metrics.put("days_with_reviews", byDay.size());
        metrics.put("avg_reviews_per_day", perDay);

        String overview = "# Динамика ревью\n"
                + "## Период: " + day(start) + " - " + day(end) + "\n"
                + (reviewType != null ? "Тип ревью: " + reviewType.getValue() + "\n" : "")
                + "\n### Общая статистика\n"
                + "- Всего ревью: " + records.size() + "\n"
                + "- Дней с ревью: " + byDay.size() + "\n"
                + "- В среднем ревью в день: " + MarkdownSupport.formatValue(perDay);

        List<ReportSection> sections = new ArrayList<>();
        sections.add(ReportSection.builder().title("Trend Analysis Overview").content(overview).metrics(metrics).build());
        sections.add(ReportSection.builder().title("Daily Breakdown").content(table.toString()).build());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("start_time", start != null ? start.toString() : null);
        metadata.put("end_time", end != null ? end.toString() : null);
        metadata.put("review_type", reviewType != null ? reviewType.getValue() : null);
        metadata.put("daily_metrics", daily);

        return ReviewReport.builder()
                .title(TREND_TITLE)
                .summary("Анализ " + records.size() + " ревью за " + byDay.size() + " дн.")
                .sections(sections)
                .timestamp(now)
                .metadata(metadata)
                .build();
    }

    /**
     * Собирает отчёт в markdown-документ: заголовок, итог, разделы по порядку
     */
    @Override
    public String render(ReviewReport report) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(report.getTitle()).append("\n\n");
        if (report.getSummary() != null && !report.getSummary().isBlank()) {
            md.append(report.getSummary()).append("\n\n");
        }
        for (ReportSection section : report.getSections()) {
            md.append(section.getContent().stripTrailing()).append("\n\n");
        }
        md.append("---\n*🤖 Автоматический AI code review, ").append(report.getTimestamp()).append("*\n");

        log.debug("Отчёт '{}' отрисован: разделов={}, размер={}", report.getTitle(),
                report.getTotalSections(), md.length());
        return md.toString();
    }

    private Optional<ReviewReport> renderWithTemplate(ReviewResponse review, String filePath, ReviewType reviewType,
                                                      boolean includeCode, String templateId, Instant now) {
        if (templateId == null) {
            return Optional.empty();
        }
        Optional<ReportTemplate> template = templateRegistry.get(templateId);
        if (template.isEmpty()) {
            log.warn("Шаблон отчёта '{}' не найден, используется стандартный формат", templateId);
            return Optional.empty();
        }

        Map<String, Object> context = new HashMap<>();
        context.put(ReportTemplate.REVIEW, review);
        context.put(ReportTemplate.FILE_PATH, filePath);
        context.put(ReportTemplate.REVIEW_TYPE, reviewType);
        context.put(ReportTemplate.INCLUDE_CODE, includeCode);
        context.put(ReportTemplate.GENERATED_AT, now);

        ReportTemplate t = template.get();
        if (!t.validateContext(context)) {
            log.warn("Контекст неполон для шаблона '{}', используется стандартный формат", templateId);
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("template_id", templateId);
        metadata.put("file_path", filePath);
        metadata.put("review_type", reviewType != null ? reviewType.getValue() : null);

        return Optional.of(ReviewReport.builder()
                .title(t.getName() + ": " + filePath)
                .summary(review.getSummary())
                .sections(t.render(context))
                .timestamp(now)
                .metadata(metadata)
                .build());
    }

    private Map<String, Object> reviewMetrics(ReviewResponse review) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_comments", review.getComments().size());
        metrics.put("errors", review.getCommentsBySeverity(CommentSeverity.ERROR).size());
        metrics.put("warnings", review.getCommentsBySeverity(CommentSeverity.WARNING).size());
        metrics.put("suggestions", review.getCommentsBySeverity(CommentSeverity.SUGGESTION).size());
        metrics.put("praise", review.getCommentsBySeverity(CommentSeverity.PRAISE).size());
        metrics.put("quality_score", review.getScore());
        return metrics;
    }

    private static Double average(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static String day(Instant instant) {
        return instant == null ? MarkdownSupport.NOT_AVAILABLE : instant.atZone(ZoneOffset.UTC).toLocalDate().toString();
    }
}
