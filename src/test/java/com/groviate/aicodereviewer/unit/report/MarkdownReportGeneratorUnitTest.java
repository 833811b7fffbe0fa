package com.groviate.aicodereviewer.unit.report;

import com.groviate.aicodereviewer.config.ReportTemplateConfig;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewCategory;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.report.MarkdownReportGenerator;
import com.groviate.aicodereviewer.report.ReportSection;
import com.groviate.aicodereviewer.report.ReviewReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class MarkdownReportGeneratorUnitTest {

    private static final Instant NOW = Instant.parse("2026-05-10T12:00:00Z");

    private MarkdownReportGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new MarkdownReportGenerator(new ReportTemplateConfig().templateRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("generateFileReport")
    class FileReportTests {

        @Test
        @DisplayName("Стандартный отчёт: обзор с метриками и раздел на каждую найденную серьёзность")
        void givenMixedCommentsWhenGenerateFileReportThenSectionPerSeverity() {
            ReviewReport report = generator.generateFileReport(review(0.75), "src/app.py", ReviewType.FULL,
                    false, null);

            assertThat(report.getTitle()).isEqualTo("Code Review: src/app.py");
            assertThat(report.getTimestamp()).isEqualTo(NOW);
            assertThat(report.getSections())
                    .extracting(ReportSection::getTitle)
                    .containsExactly("Overview", "Error Comments", "Warning Comments");

            ReportSection overview = report.getSections().get(0);
            assertThat(overview.getMetrics())
                    .containsEntry("total_comments", 3)
                    .containsEntry("errors", 2)
                    .containsEntry("warnings", 1)
                    .containsEntry("suggestions", 0)
                    .containsEntry("praise", 0)
                    .containsEntry("quality_score", 0.75);
            assertThat(overview.getContent()).contains("| quality_score | 0.75 |");

            assertThat(report.getSectionsBySeverity(CommentSeverity.ERROR)).singleElement()
                    .satisfies(s -> assertThat(s.getMetrics()).containsEntry("count", 2));
        }

        @Test
        @DisplayName("includeCode добавляет предлагаемые исправления")
        void givenIncludeCodeWhenGenerateFileReportThenSuggestedFixRendered() {
            ReviewReport withCode = generator.generateFileReport(review(0.5), "a.py", ReviewType.FULL, true, null);
            ReviewReport withoutCode = generator.generateFileReport(review(0.5), "a.py", ReviewType.FULL, false, null);

            assertThat(generator.render(withCode)).contains("cursor.execute(q, params)");
            assertThat(generator.render(withoutCode)).doesNotContain("cursor.execute(q, params)");
        }

        @Test
        @DisplayName("Известный шаблон рисует отчёт, неизвестный -> стандартный формат")
        void givenTemplateIdWhenGenerateFileReportThenTemplateOrDefault() {
            ReviewReport templated = generator.generateFileReport(review(0.5), "a.py", ReviewType.SECURITY,
                    false, "security-audit");
            ReviewReport fallback = generator.generateFileReport(review(0.5), "a.py", ReviewType.SECURITY,
                    false, "no-such-template");

            assertThat(templated.getTitle()).isEqualTo("Security Audit Report: a.py");
            assertThat(templated.getMetadata()).containsEntry("template_id", "security-audit");
            assertThat(templated.getSections().get(0).getTitle()).isEqualTo("Security Audit Overview");

            assertThat(fallback.getTitle()).isEqualTo("Code Review: a.py");
        }

        @Test
        @DisplayName("Без замечаний остаётся только обзор, оценка N/A")
        void givenEmptyReviewWhenGenerateFileReportThenOnlyOverview() {
            ReviewResponse empty = ReviewResponse.builder().summary("Всё хорошо").build();

            ReviewReport report = generator.generateFileReport(empty, "a.py", ReviewType.QUICK, false, null);

            assertThat(report.getTotalSections()).isEqualTo(1);
            assertThat(report.getSections().get(0).getContent()).contains("| quality_score | N/A |");
        }
    }

    @Test
    @DisplayName("Отчёт по нескольким файлам: общий обзор и раздел на файл, средняя оценка только по файлам с оценкой")
    void givenSeveralReviewsWhenGenerateMultiFileReportThenOverviewAndFileSections() {
        Map<String, ReviewResponse> reviews = new LinkedHashMap<>();
        reviews.put("a.py", review(0.6));
        reviews.put("b.py", review(0.8));
        reviews.put("c.py", ReviewResponse.builder().summary("без оценки").build());

        ReviewReport report = generator.generateMultiFileReport(reviews, ReviewType.FULL, false, null);

        assertThat(report.getTitle()).isEqualTo("Multi-File Code Review Report");
        assertThat(report.getSections())
                .extracting(ReportSection::getTitle)
                .containsExactly("Overview", "a.py", "b.py", "c.py");

        Map<String, Object> overall = report.getSections().get(0).getMetrics();
        assertThat(overall).containsEntry("total_files", 3).containsEntry("total_issues", 6);
        assertThat((Double) overall.get("avg_issues_per_file")).isEqualTo(2.0);
        assertThat((Double) overall.get("avg_quality_score")).isCloseTo(0.7, offset(1e-9));
    }

    @Nested
    @DisplayName("generateHistoricalReport")
    class HistoricalReportTests {

        @Test
        @DisplayName("Пустая история -> отчёт с заголовком и без разделов")
        void givenNoRecordsWhenGenerateHistoricalReportThenEmptyReport() {
            ReviewReport report = generator.generateHistoricalReport(List.of(), "a.py", null);

            assertThat(report.getTitle()).isEqualTo("Historical Review Analysis");
            assertThat(report.getSummary()).isEqualTo("История ревью отсутствует");
            assertThat(report.getSections()).isEmpty();
        }

        @Test
        @DisplayName("История: количество, средняя оценка, первое и последнее ревью, динамика по времени")
        void givenRecordsWhenGenerateHistoricalReportThenMetricsAndChronologicalTrend() {
            List<ReviewRecord> records = List.of(
                    record("3", "2026-05-03T10:00:00Z", 0.9),
                    record("1", "2026-05-01T10:00:00Z", 0.5),
                    record("2", "2026-05-02T10:00:00Z", null));

            ReviewReport report = generator.generateHistoricalReport(records, "a.py", ReviewType.FULL);

            assertThat(report.getSections())
                    .extracting(ReportSection::getTitle)
                    .containsExactly("Historical Analysis Overview", "Trend Analysis");

            Map<String, Object> metrics = report.getSections().get(0).getMetrics();
            assertThat(metrics)
                    .containsEntry("total_reviews", 3)
                    .containsEntry("first_review", "2026-05-01T10:00:00Z")
                    .containsEntry("latest_review", "2026-05-03T10:00:00Z");
            assertThat((Double) metrics.get("avg_quality_score")).isCloseTo(0.7, offset(1e-9));

            String trend = report.getSections().get(1).getContent();
            assertThat(trend.indexOf("0.50")).isLessThan(trend.indexOf("0.90"));
        }
    }

    @Nested
    @DisplayName("generateTrendReport")
    class TrendReportTests {

        @Test
        @DisplayName("Пустой интервал -> явный пустой отчёт")
        void givenNoRecordsWhenGenerateTrendReportThenEmptyReport() {
            ReviewReport report = generator.generateTrendReport(List.of(), NOW.minusSeconds(86_400), NOW, null);

            assertThat(report.getTitle()).isEqualTo("Review Trend Analysis");
            assertThat(report.getSections()).isEmpty();
        }

        @Test
        @DisplayName("Ревью группируются по дням UTC")
        void givenRecordsOnTwoDaysWhenGenerateTrendReportThenTwoDailyBuckets() {
            List<ReviewRecord> records = List.of(
                    record("1", "2026-05-01T01:00:00Z", 0.4),
                    record("2", "2026-05-01T23:30:00Z", 0.6),
                    record("3", "2026-05-02T08:00:00Z", 0.8));

            ReviewReport report = generator.generateTrendReport(records,
                    Instant.parse("2026-05-01T00:00:00Z"), Instant.parse("2026-05-03T00:00:00Z"), ReviewType.FULL);

            Map<String, Object> metrics = report.getSections().get(0).getMetrics();
            assertThat(metrics)
                    .containsEntry("total_reviews", 3)
                    .containsEntry("days_with_reviews", 2)
                    .containsEntry("avg_reviews_per_day", 1.5);

            @SuppressWarnings("unchecked")
            List<Map<String, Object>> daily = (List<Map<String, Object>>) report.getMetadata().get("daily_metrics");
            assertThat(daily).hasSize(2);
            assertThat(daily.get(0))
                    .containsEntry("date", "2026-05-01")
                    .containsEntry("review_count", 2);
            assertThat((Double) daily.get(0).get("avg_score")).isCloseTo(0.5, offset(1e-9));
            assertThat(report.getSections().get(1).getContent()).contains("| 2026-05-02 | 1 | 0.80 |");
        }
    }

    @Test
    @DisplayName("render: заголовок, итог, разделы по порядку и подпись")
    void givenReportWhenRenderThenMarkdownDocument() {
        ReviewReport report = generator.generateFileReport(review(0.5), "a.py", ReviewType.FULL, false, null);

        String md = generator.render(report);

        assertThat(md).startsWith("# Code Review: a.py\n\n");
        assertThat(md.indexOf("Error Comments")).isLessThan(md.indexOf("Warning Comments"));
        assertThat(md).contains("🔴 Error").contains("Автоматический AI code review");
    }

    private static ReviewResponse review(Double score) {
        return ReviewResponse.builder()
                .summary("Найдены проблемы")
                .score(score)
                .comments(List.of(
                        ReviewComment.builder().lineNumber(10).content("SQL injection")
                                .severity(CommentSeverity.ERROR).category(ReviewCategory.SECURITY)
                                .suggestedFix("cursor.execute(q, params)").build(),
                        ReviewComment.builder().lineNumber(20).content("N+1 query")
                                .severity(CommentSeverity.ERROR).category(ReviewCategory.PERFORMANCE).build(),
                        ReviewComment.builder().content("long method")
                                .severity(CommentSeverity.WARNING).category(ReviewCategory.STYLE).build()))
                .build();
    }

    private static ReviewRecord record(String id, String timestamp, Double score) {
        return ReviewRecord.builder()
                .id(id)
                .filePath("a.py")
                .reviewType(ReviewType.FULL)
                .timestamp(Instant.parse(timestamp))
                .response(ReviewResponse.builder().summary("s" + id).score(score).build())
                .build();
    }
}
