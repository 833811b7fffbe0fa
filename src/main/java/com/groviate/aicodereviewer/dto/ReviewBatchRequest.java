package com.groviate.aicodereviewer.dto;

import com.groviate.aicodereviewer.model.ReviewSettings;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Тело POST /api/v1/reviews
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewBatchRequest {

    private Map<String, String> files; //путь -> содержимое

    private String reviewType; //null - тип по умолчанию

    private ReviewSettings settings;

    @Min(1)
    private Integer maxConcurrent; //null - code-review.max-concurrent

    private Boolean store;

    private boolean includeReport; //вернуть markdown-отчёт по пакету

    private boolean includeCode;

    private String templateId;
}
