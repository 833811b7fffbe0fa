package com.groviate.aicodereviewer.unit.service;

import com.groviate.aicodereviewer.client.SourceHostingClient;
import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.CodeContext;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.FeedbackComment;
import com.groviate.aicodereviewer.model.ReviewCategory;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewDisposition;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewResult;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.service.PullRequestReviewService;
import com.groviate.aicodereviewer.service.ReviewOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Юнит тесты PullRequestReviewService")
class PullRequestReviewServiceUnitTest {

    private static final Map<String, ChangedFile> FILES = Map.of(
            "src/App.java", ChangedFile.builder().content("class App {}").diff("+class App {}").build());

    @Mock
    private SourceHostingClient sourceHostingClient;

    @Mock
    private ReviewOrchestrator orchestrator;

    @Captor
    private ArgumentCaptor<List<FeedbackComment>> commentsCaptor;

    @Captor
    private ArgumentCaptor<String> summaryCaptor;

    @Captor
    private ArgumentCaptor<ReviewDisposition> dispositionCaptor;

    private CodeReviewProperties props;
    private PullRequestReviewService service;

    @BeforeEach
    void setUp() {
        props = new CodeReviewProperties();
        service = new PullRequestReviewService(sourceHostingClient, orchestrator, props);
        when(sourceHostingClient.fetchChangedFiles("42", "7")).thenReturn(FILES);
    }

    private void givenResult(ReviewResult result) {
        result.complete();
        when(orchestrator.reviewChanges(eq(FILES), eq("main"), any(), any(), eq(props.getMaxConcurrent()),
                eq(props.isStoreReviews()), any(CodeContext.class))).thenReturn(result);
    }

    private void runReview() {
        service.reviewPullRequest("42", "7", "main", ReviewType.FULL, null);
        verify(sourceHostingClient).submitFeedback(eq("42"), eq("7"), commentsCaptor.capture(),
                summaryCaptor.capture(), dispositionCaptor.capture());
    }

    private static ReviewComment comment(CommentSeverity severity, Integer line, String content) {
        return ReviewComment.builder()
                .severity(severity)
                .category(ReviewCategory.LOGIC)
                .lineNumber(line)
                .content(content)
                .build();
    }

    private static ReviewResponse response(double score, ReviewComment... comments) {
        return ReviewResponse.builder()
                .summary("Итог по файлу")
                .score(score)
                .comments(List.of(comments))
                .build();
    }

    @Nested
    @DisplayName("Решение по MR")
    class DispositionTests {

        @Test
        @DisplayName("Ошибка уровня error приводит к REQUEST_CHANGES")
        void givenErrorCommentWhenReviewThenRequestChanges() {
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.3, comment(CommentSeverity.ERROR, 3, "NPE")), "id-1");
            givenResult(result);

            runReview();

            assertThat(dispositionCaptor.getValue()).isEqualTo(ReviewDisposition.REQUEST_CHANGES);
        }

        @Test
        @DisplayName("Без разрешения approve чистый MR получает COMMENT")
        void givenCleanResultAndApproveDisabledWhenReviewThenComment() {
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.95, comment(CommentSeverity.PRAISE, null, "Хорошо")), null);
            givenResult(result);

            runReview();

            assertThat(dispositionCaptor.getValue()).isEqualTo(ReviewDisposition.COMMENT);
        }

        @Test
        @DisplayName("С разрешённым approve и только похвалой MR получает APPROVE")
        void givenOnlyPraiseAndApproveEnabledWhenReviewThenApprove() {
            props.getFeedback().setAllowApprove(true);
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.95, comment(CommentSeverity.PRAISE, null, "Хорошо")), null);
            givenResult(result);

            runReview();

            assertThat(dispositionCaptor.getValue()).isEqualTo(ReviewDisposition.APPROVE);
        }

        @Test
        @DisplayName("Ошибка ревью файла не даёт approve")
        void givenFailedFileAndApproveEnabledWhenReviewThenComment() {
            props.getFeedback().setAllowApprove(true);
            ReviewResult result = new ReviewResult(2);
            result.addReview("src/App.java", response(0.9), null);
            result.addError("src/Other.java", "Provider error");
            givenResult(result);

            runReview();

            assertThat(dispositionCaptor.getValue()).isEqualTo(ReviewDisposition.COMMENT);
        }
    }

    @Nested
    @DisplayName("Отбор комментариев")
    class CommentSelectionTests {

        @Test
        @DisplayName("Комментарии ниже порога отбрасываются, остальные идут по убыванию серьёзности")
        void givenMixedSeveritiesWhenReviewThenFilterAndSort() {
            props.getFeedback().setMinSeverity(CommentSeverity.WARNING);
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.5,
                    comment(CommentSeverity.SUGGESTION, 1, "Переименовать"),
                    comment(CommentSeverity.WARNING, 2, "Пустой catch"),
                    comment(CommentSeverity.ERROR, 5, "NPE")), "id-1");
            givenResult(result);

            runReview();

            List<FeedbackComment> comments = commentsCaptor.getValue();
            assertThat(comments).extracting(FeedbackComment::getLine).containsExactly(5, 2);
            assertThat(comments).extracting(FeedbackComment::getPath).containsOnly("src/App.java");
            assertThat(comments.get(0).getBody()).isEqualTo("**error** [logic] NPE");
        }

        @Test
        @DisplayName("Количество комментариев ограничено max-comments")
        void givenMoreCommentsThanLimitWhenReviewThenCap() {
            props.getFeedback().setMaxComments(2);
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.5,
                    comment(CommentSeverity.SUGGESTION, 1, "a"),
                    comment(CommentSeverity.SUGGESTION, 2, "b"),
                    comment(CommentSeverity.WARNING, 3, "c")), "id-1");
            givenResult(result);

            runReview();

            assertThat(commentsCaptor.getValue()).hasSize(2);
            assertThat(commentsCaptor.getValue().get(0).getLine()).isEqualTo(3);
        }

        @Test
        @DisplayName("Предложенное исправление добавляется в тело комментария")
        void givenSuggestedFixWhenReviewThenAppendFixBlock() {
            ReviewComment withFix = comment(CommentSeverity.WARNING, 4, "Ресурс не закрыт");
            withFix.setSuggestedFix("try (var in = open()) {}");
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.6, withFix), "id-1");
            givenResult(result);

            runReview();

            assertThat(commentsCaptor.getValue().get(0).getBody())
                    .contains("**Исправление:**")
                    .contains("try (var in = open()) {}");
        }
    }

    @Test
    @DisplayName("Итоговый комментарий содержит счётчики, оценки и ошибки")
    void givenPartialFailureWhenReviewThenSummaryListsCountsAndErrors() {
        ReviewResult result = new ReviewResult(2);
        result.addReview("src/App.java", response(0.75), "id-1");
        result.addError("src/Broken.java", "x".repeat(400));
        givenResult(result);

        runReview();

        String summary = summaryCaptor.getValue();
        assertThat(summary).startsWith("Проверено файлов: 2, успешно: 1, с ошибкой: 1");
        assertThat(summary).contains("`src/App.java`: Итог по файлу");
        assertThat(summary).contains("Не удалось проверить:");
        assertThat(summary).contains("x".repeat(300) + "...");
        assertThat(summary).doesNotContain("x".repeat(301));
    }

    @Test
    @DisplayName("Оценка в итоговом комментарии не зависит от локали")
    void givenRussianLocaleWhenReviewThenScoreUsesDot() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("ru-RU"));
        try {
            ReviewResult result = new ReviewResult(1);
            result.addReview("src/App.java", response(0.9), "id-1");
            givenResult(result);

            runReview();

            assertThat(summaryCaptor.getValue()).contains("(оценка 0.90)").doesNotContain("0,90");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("В контекст ревью передаётся репозиторий")
    void givenRepositoryWhenReviewThenPassItInContext() {
        ReviewResult result = new ReviewResult(1);
        result.addReview("src/App.java", response(0.9), null);
        result.complete();
        ArgumentCaptor<CodeContext> contextCaptor = ArgumentCaptor.forClass(CodeContext.class);
        when(orchestrator.reviewChanges(any(), anyString(), any(), any(), eq(3), eq(true),
                contextCaptor.capture())).thenReturn(result);

        ReviewResult returned = service.reviewPullRequest("42", "7", "main", null, null);

        assertThat(returned).isSameAs(result);
        assertThat(contextCaptor.getValue().getRepository()).isEqualTo("42");
    }
}
