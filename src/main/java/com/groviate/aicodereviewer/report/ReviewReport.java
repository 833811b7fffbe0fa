package com.groviate.aicodereviewer.report;

import com.groviate.aicodereviewer.model.CommentSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Готовый отчёт по одному или нескольким ревью
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewReport {

    private String title;

    private String summary;

    @Builder.Default
    private List<ReportSection> sections = new ArrayList<>();

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public int getTotalSections() {
        return sections.size();
    }

    public List<ReportSection> getSectionsBySeverity(CommentSeverity severity) {
        return sections.stream().filter(s -> s.getSeverity() == severity).toList();
    }
}
