package com.groviate.aicodereviewer.dto;

import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Итог пакетного ревью для REST-клиента
 */
@Value
@Builder
public class ReviewBatchResponse {

    int totalFiles;
    int successfulReviews;
    int failedReviews;
    long durationMs;

    Map<String, ReviewResponse> reviews;
    Map<String, String> errors;
    Map<String, String> reviewIds;

    String report;

    public static ReviewBatchResponse of(ReviewResult result, String report) {
        return ReviewBatchResponse.builder()
                .totalFiles(result.getTotalFiles())
                .successfulReviews(result.getSuccessfulReviews())
                .failedReviews(result.getFailedReviews())
                .durationMs(result.getDuration().toMillis())
                .reviews(result.getReviews())
                .errors(result.getErrors())
                .reviewIds(result.getReviewIds())
                .report(report)
                .build();
    }
}
