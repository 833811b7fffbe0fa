package com.groviate.aicodereviewer.report;

import com.groviate.aicodereviewer.model.CommentSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Раздел отчёта: заголовок, markdown-содержимое и метрики раздела
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSection {

    private String title;

    private String content;

    private CommentSeverity severity; //null - раздел без привязки к серьёзности

    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();
}
