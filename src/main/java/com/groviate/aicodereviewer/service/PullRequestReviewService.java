package com.groviate.aicodereviewer.service;

import com.groviate.aicodereviewer.client.SourceHostingClient;
import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.CodeContext;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.FeedbackComment;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewDisposition;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewResult;
import com.groviate.aicodereviewer.model.ReviewSettings;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.report.MarkdownSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Полный цикл ревью Merge Request:
 * <ol>
 *   <li>Получить изменённые файлы из системы хостинга кода</li>
 *   <li>Выполнить пакетное ревью через {@link ReviewOrchestrator#reviewChanges}</li>
 *   <li>Отобрать комментарии для публикации (порог серьёзности, лимит)</li>
 *   <li>Определить решение: REQUEST_CHANGES при error, APPROVE только если разрешено и замечаний нет</li>
 *   <li>Опубликовать результат</li>
 * </ol>
 */
@Service
@Slf4j
public class PullRequestReviewService {

    private final SourceHostingClient sourceHostingClient;
    private final ReviewOrchestrator orchestrator;
    private final CodeReviewProperties props;

    public PullRequestReviewService(SourceHostingClient sourceHostingClient,
                                    ReviewOrchestrator orchestrator,
                                    CodeReviewProperties props) {
        this.sourceHostingClient = sourceHostingClient;
        this.orchestrator = orchestrator;
        this.props = props;
    }

    /**
     * @param repository  id или путь проекта
     * @param revisionRef iid merge request
     * @param baseBranch  целевая ветка MR
     * @return результат пакетного ревью (в том числе ошибки по отдельным файлам)
     */
    public ReviewResult reviewPullRequest(String repository, String revisionRef, String baseBranch,
                                          ReviewType reviewType, ReviewSettings settings) {
        Map<String, ChangedFile> files = sourceHostingClient.fetchChangedFiles(repository, revisionRef);
        if (files.isEmpty()) {
            log.info("MR {}/{}: нет файлов для ревью", repository, revisionRef);
        }

        CodeContext context = CodeContext.builder().repository(repository).build();
        ReviewResult result = orchestrator.reviewChanges(files, baseBranch, reviewType, settings,
                props.getMaxConcurrent(), props.isStoreReviews(), context);

        List<FeedbackComment> comments = selectComments(result);
        ReviewDisposition disposition = decide(result, comments);
        sourceHostingClient.submitFeedback(repository, revisionRef, comments, buildSummary(result), disposition);

        log.info("MR {}/{}: опубликовано комментариев={}, решение={}", repository, revisionRef, comments.size(),
                disposition);
        return result;
    }

    /**
     * Комментарии не ниже порога, сначала самые серьёзные, не более feedback.max-comments
     */
    List<FeedbackComment> selectComments(ReviewResult result) {
        CommentSeverity min = props.getFeedback().getMinSeverity();

        List<Map.Entry<String, ReviewComment>> candidates = new ArrayList<>();
        result.getReviews().forEach((path, review) -> review.getComments().stream()
                .filter(c -> c.getSeverity().isAtLeast(min))
                .forEach(c -> candidates.add(Map.entry(path, c))));

        return candidates.stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, ReviewComment> e) -> e.getValue().getSeverity().getRank())
                        .reversed())
                .limit(Math.max(0, props.getFeedback().getMaxComments()))
                .map(e -> FeedbackComment.builder()
                        .path(e.getKey())
                        .line(e.getValue().getLineNumber())
                        .body(formatBody(e.getValue()))
                        .build())
                .toList();
    }

    ReviewDisposition decide(ReviewResult result, List<FeedbackComment> comments) {
        if (!result.getCriticalIssues().isEmpty()) {
            return ReviewDisposition.REQUEST_CHANGES;
        }
        boolean clean = result.getFailedReviews() == 0 && result.getReviews().values().stream()
                .allMatch(r -> r.getComments().stream()
                        .allMatch(c -> c.getSeverity() == CommentSeverity.PRAISE));
        if (props.getFeedback().isAllowApprove() && clean) {
            return ReviewDisposition.APPROVE;
        }
        return ReviewDisposition.COMMENT;
    }

    private String formatBody(ReviewComment c) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(c.getSeverity().getValue()).append("** [")
                .append(c.getCategory().getValue()).append("] ").append(c.getContent());
        if (c.getSuggestedFix() != null && !c.getSuggestedFix().isBlank()) {
            sb.append("\n\n**Исправление:**\n```\n").append(c.getSuggestedFix()).append("\n```");
        }
        return sb.toString();
    }

    private String buildSummary(ReviewResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Проверено файлов: ").append(result.getTotalFiles())
                .append(", успешно: ").append(result.getSuccessfulReviews())
                .append(", с ошибкой: ").append(result.getFailedReviews()).append("\n");

        result.getReviews().forEach((path, review) -> sb.append("\n- `").append(path).append("`: ")
                .append(review.getSummary()).append(scoreSuffix(review)));

        if (!result.getErrors().isEmpty()) {
            sb.append("\n\nНе удалось проверить:\n");
            result.getErrors().forEach((path, error) -> sb.append("- `").append(path).append("`: ")
                    .append(truncate(error, 300)).append('\n'));
        }
        return sb.toString();
    }

    private static String scoreSuffix(ReviewResponse review) {
        return review.getScore() == null ? "" : " (оценка " + MarkdownSupport.formatScore(review.getScore()) + ")";
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
