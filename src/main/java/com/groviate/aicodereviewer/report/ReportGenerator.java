package com.groviate.aicodereviewer.report;

import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Генератор отчётов по результатам ревью.
 * Пустые входные данные дают пустой отчёт (без разделов), а не исключение.
 */
public interface ReportGenerator {

    /**
     * @param templateId id шаблона из TemplateRegistry; null, неизвестный id или неполный контекст
     *                   означают стандартный формат
     */
    ReviewReport generateFileReport(ReviewResponse review, String filePath, ReviewType reviewType,
                                    boolean includeCode, String templateId);

    ReviewReport generateMultiFileReport(Map<String, ReviewResponse> reviews, ReviewType reviewType,
                                         boolean includeCode, String templateId);

    ReviewReport generateHistoricalReport(List<ReviewRecord> records, String filePath, ReviewType reviewType);

    ReviewReport generateTrendReport(List<ReviewRecord> records, Instant start, Instant end, ReviewType reviewType);

    /**
     * Собирает отчёт в один документ для публикации
     */
    String render(ReviewReport report);
}
