package com.groviate.aicodereviewer.controller;

import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.dto.ReviewBatchRequest;
import com.groviate.aicodereviewer.dto.ReviewBatchResponse;
import com.groviate.aicodereviewer.exception.ConfigurationException;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResult;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.report.ReviewReport;
import com.groviate.aicodereviewer.service.PullRequestReviewService;
import com.groviate.aicodereviewer.service.ReviewOrchestrator;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API ревьюера: пакетное ревью, история, отчёты, очистка, ревью MR.
 * Пример: {@code POST localhost:8080/api/v1/reviews} с телом {"files": {"a.py": "..."}}
 */
@RestController
@Slf4j
@RequestMapping("/api/v1/reviews")
public class ReviewController {

    private static final String MARKDOWN = "text/markdown;charset=UTF-8";

    private final ReviewOrchestrator orchestrator;
    private final PullRequestReviewService pullRequestReviewService;
    private final CodeReviewProperties props;

    public ReviewController(ReviewOrchestrator orchestrator,
                            PullRequestReviewService pullRequestReviewService,
                            CodeReviewProperties props) {
        this.orchestrator = orchestrator;
        this.pullRequestReviewService = pullRequestReviewService;
        this.props = props;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ReviewBatchResponse review(@Valid @RequestBody ReviewBatchRequest request) {
        if (request.getFiles() == null || request.getFiles().isEmpty()) {
            throw new ConfigurationException("files must not be empty");
        }

        ReviewType type = parseType(request.getReviewType());
        int maxConcurrent = request.getMaxConcurrent() != null ? request.getMaxConcurrent() : props.getMaxConcurrent();
        boolean store = request.getStore() != null ? request.getStore() : props.isStoreReviews();

        ReviewResult result = orchestrator.reviewFiles(request.getFiles(), type, request.getSettings(),
                maxConcurrent, store, null);

        String report = null;
        if (request.isIncludeReport()) {
            ReviewReport r = orchestrator.generateReport(result, type, request.isIncludeCode(), request.getTemplateId());
            report = orchestrator.renderReport(r);
        }
        return ReviewBatchResponse.of(result, report);
    }

    @PostMapping("/merge-requests/{projectId}/{mrIid}")
    public ReviewBatchResponse reviewMergeRequest(@PathVariable String projectId,
                                                  @PathVariable String mrIid,
                                                  @RequestParam(required = false) String baseBranch,
                                                  @RequestParam(required = false) String reviewType) {
        log.info("Ревью MR по запросу: project={}, mr={}", projectId, mrIid);
        ReviewResult result = pullRequestReviewService.reviewPullRequest(projectId, mrIid, baseBranch,
                parseType(reviewType), null);
        return ReviewBatchResponse.of(result, null);
    }

    @GetMapping("/history")
    public List<ReviewRecord> history(@RequestParam String filePath,
                                      @RequestParam(required = false) Integer limit,
                                      @RequestParam(required = false) String reviewType) {
        return orchestrator.getFileHistory(filePath, limit, parseType(reviewType));
    }

    @GetMapping(value = "/reports/history", produces = MARKDOWN)
    public String historyReport(@RequestParam String filePath,
                                @RequestParam(required = false) Integer limit,
                                @RequestParam(required = false) String reviewType) {
        return orchestrator.renderReport(orchestrator.generateHistoricalReport(filePath, parseType(reviewType), limit));
    }

    @GetMapping(value = "/reports/trend", produces = MARKDOWN)
    public String trendReport(@RequestParam Instant from,
                              @RequestParam Instant to,
                              @RequestParam(required = false) String reviewType) {
        if (from.isAfter(to)) {
            throw new ConfigurationException("from must not be after to");
        }
        return orchestrator.renderReport(orchestrator.generateTrendReport(from, to, parseType(reviewType)));
    }

    @DeleteMapping
    public Map<String, Object> cleanup(@RequestParam Instant olderThan) {
        int deleted = orchestrator.cleanupOldReviews(olderThan);
        log.info("Удалено ревью старше {}: {}", olderThan, deleted);
        return Map.of("deleted", deleted, "olderThan", olderThan.toString());
    }

    private static ReviewType parseType(String value) {
        return value == null || value.isBlank() ? null : ReviewType.fromValue(value);
    }
}
