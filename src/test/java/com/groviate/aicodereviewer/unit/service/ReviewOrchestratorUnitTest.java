package com.groviate.aicodereviewer.unit.service;

import com.groviate.aicodereviewer.config.AsyncConfig;
import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.exception.ConfigurationException;
import com.groviate.aicodereviewer.exception.ProviderException;
import com.groviate.aicodereviewer.exception.ReviewException;
import com.groviate.aicodereviewer.exception.StorageException;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.CodeContext;
import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.FileReviewOutcome;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewRequest;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewResult;
import com.groviate.aicodereviewer.model.ReviewSettings;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.provider.ReviewProvider;
import com.groviate.aicodereviewer.report.ReportGenerator;
import com.groviate.aicodereviewer.service.ReviewMetricsService;
import com.groviate.aicodereviewer.service.ReviewOrchestrator;
import com.groviate.aicodereviewer.storage.ReviewStorage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewOrchestratorUnitTest {

    @Mock
    ReviewStorage storage;
    @Mock
    ReportGenerator reportGenerator;

    private RecordingProvider provider;
    private SimpleMeterRegistry meterRegistry;
    private ReviewMetricsService metrics;
    private CodeReviewProperties props;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        provider = new RecordingProvider();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ReviewMetricsService(meterRegistry);
        props = new CodeReviewProperties();
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ReviewOrchestrator orchestrator(ReviewStorage reviewStorage) {
        return new ReviewOrchestrator(provider, reviewStorage, reportGenerator, executor, metrics, props);
    }

    @Test
    @DisplayName("Одновременно к провайдеру обращается не больше maxConcurrent файлов")
    void givenSixFilesAndLimitTwoWhenReviewFilesThenAtMostTwoInFlight() {
        provider.delayMs = 60;
        Map<String, String> files = new LinkedHashMap<>();
        for (int i = 0; i < 6; i++) {
            files.put("f" + i + ".py", "x = " + i);
        }

        ReviewResult result = orchestrator(null).reviewFiles(files, ReviewType.FULL, null, 2, false, null);

        assertThat(provider.maxInFlight.get()).isEqualTo(2);
        assertThat(result.getSuccessfulReviews()).isEqualTo(6);
        assertThat(result.getFailedReviews()).isZero();
        assertThat(result.getTotalFiles()).isEqualTo(6);
        assertThat(result.isCompleted()).isTrue();
        assertThat(result.getEndTime()).isAfterOrEqualTo(result.getStartTime());
    }

    @Test
    @DisplayName("Пакет больше очереди пула проверяется целиком, без отклонённых задач")
    void givenBatchLargerThanExecutorQueueWhenReviewFilesThenAllFilesReviewed() {
        ThreadPoolTaskExecutor reviewExecutor = (ThreadPoolTaskExecutor) new AsyncConfig().reviewExecutor(props);
        try {
            provider.delayMs = 2;
            Map<String, String> files = new LinkedHashMap<>();
            for (int i = 0; i < 1100; i++) {
                files.put("src/f" + i + ".py", "x = " + i);
            }
            ReviewOrchestrator orchestrator =
                    new ReviewOrchestrator(provider, null, reportGenerator, reviewExecutor, metrics, props);

            ReviewResult result = orchestrator.reviewFiles(files, ReviewType.QUICK, null, 3, false, null);

            assertThat(result.getFailedReviews()).isZero();
            assertThat(result.getErrors()).isEmpty();
            assertThat(result.getSuccessfulReviews()).isEqualTo(1100);
            assertThat(provider.requests).hasSize(1100);
            assertThat(provider.maxInFlight.get()).isLessThanOrEqualTo(3);
        } finally {
            reviewExecutor.shutdown();
        }
    }

    @Test
    @DisplayName("Ошибка одного файла попадает в errors, остальные файлы проверяются")
    void givenFailingFileWhenReviewFilesThenOtherFilesStillReviewed() {
        provider.failing = Set.of("b.py");
        Map<String, String> files = new LinkedHashMap<>();
        files.put("a.py", "a = 1");
        files.put("b.py", "b = 2");
        files.put("c.py", "c = 3");

        ReviewResult result = orchestrator(null).reviewFiles(files, ReviewType.FULL, null, 2, false, null);

        assertThat(result.getReviews()).containsOnlyKeys("a.py", "c.py");
        assertThat(result.getErrors()).containsOnlyKeys("b.py");
        assertThat(result.getErrors().get("b.py")).contains("b.py").contains("backend down");
        assertThat(result.getSuccessfulReviews() + result.getFailedReviews()).isEqualTo(result.getTotalFiles());

        assertThat(meterRegistry.get("ai_review_file_total").tag("result", "success").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("ai_review_file_total").tag("result", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Пустой набор файлов -> пустой завершённый результат")
    void givenNoFilesWhenReviewFilesThenEmptyCompletedResult() {
        ReviewResult result = orchestrator(null).reviewFiles(Map.of());

        assertThat(result.getTotalFiles()).isZero();
        assertThat(result.isCompleted()).isTrue();
        assertThat(provider.requests).isEmpty();
    }

    @Test
    @DisplayName("maxConcurrent < 1 -> ConfigurationException, провайдер не вызывается")
    void givenZeroConcurrencyWhenReviewFilesThenConfigurationException() {
        ReviewOrchestrator orchestrator = orchestrator(null);
        Map<String, String> files = Map.of("a.py", "x");

        assertThatThrownBy(() -> orchestrator.reviewFiles(files, null, null, 0, false, null))
                .isInstanceOf(ConfigurationException.class);
        assertThat(provider.requests).isEmpty();
    }

    @Test
    @DisplayName("Сохранение успешно -> STORED и id записи, метаданные содержат провайдера и язык")
    void givenStorageWhenReviewFileThenStoredWithId() {
        when(storage.saveReview(eq("app/main.py"), eq(ReviewType.SECURITY), any(), anyMap())).thenReturn("id-1");

        FileReviewOutcome outcome = orchestrator(storage)
                .reviewFile("app/main.py", "print(1)", ReviewType.SECURITY, null, true, null);

        assertThat(outcome.getStorageStatus()).isEqualTo(FileReviewOutcome.StorageStatus.STORED);
        assertThat(outcome.getReviewId()).isEqualTo("id-1");
        assertThat(outcome.getResponse().getSummary()).isEqualTo("ok app/main.py");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(storage).saveReview(eq("app/main.py"), eq(ReviewType.SECURITY), any(), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry("provider", "fake")
                .containsEntry("language", "python");
    }

    @Test
    @DisplayName("Ошибка хранилища не ломает ревью: статус FAILED и метрика")
    void givenStorageFailureWhenReviewFileThenResponseReturnedAndFailureRecorded() {
        when(storage.saveReview(any(), any(), any(), anyMap())).thenThrow(new StorageException("disk full"));

        FileReviewOutcome outcome = orchestrator(storage).reviewFile("a.py", "x = 1", null, null, true, null);

        assertThat(outcome.getResponse()).isNotNull();
        assertThat(outcome.getStorageStatus()).isEqualTo(FileReviewOutcome.StorageStatus.FAILED);
        assertThat(outcome.getStorageError()).isEqualTo("disk full");
        assertThat(outcome.getReviewId()).isNull();
        assertThat(meterRegistry.get("ai_review_storage_failures_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("В пакете ошибка хранилища не переводит файл в errors")
    void givenStorageFailureInBatchWhenReviewFilesThenFileStillSuccessful() {
        when(storage.saveReview(any(), any(), any(), anyMap())).thenThrow(new StorageException("disk full"));

        ReviewResult result = orchestrator(storage).reviewFiles(Map.of("a.py", "x"), null, null, 1, true, null);

        assertThat(result.getReviews()).containsOnlyKeys("a.py");
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getReviewIds()).isEmpty();
    }

    @Test
    @DisplayName("store=false -> хранилище не вызывается, статус SKIPPED")
    void givenStoreDisabledWhenReviewFileThenSkipped() {
        FileReviewOutcome outcome = orchestrator(storage).reviewFile("a.py", "x", null, null, false, null);

        assertThat(outcome.getStorageStatus()).isEqualTo(FileReviewOutcome.StorageStatus.SKIPPED);
        verifyNoInteractions(storage);
    }

    @Test
    @DisplayName("Ошибка провайдера в одиночном ревью -> ReviewException с путём файла")
    void givenProviderFailureWhenReviewFileThenReviewException() {
        provider.failing = Set.of("a.py");
        ReviewOrchestrator orchestrator = orchestrator(null);

        assertThatThrownBy(() -> orchestrator.reviewFile("a.py", "x"))
                .isInstanceOf(ReviewException.class)
                .hasMessageContaining("a.py")
                .hasCauseInstanceOf(ProviderException.class);
        assertThat(meterRegistry.get("ai_review_file_total").tag("result", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Без хранилища операции истории -> StorageException")
    void givenNoStorageWhenHistoryRequestedThenStorageException() {
        ReviewOrchestrator orchestrator = orchestrator(null);
        Instant now = Instant.now();

        assertThat(orchestrator.isStorageConfigured()).isFalse();
        assertThatThrownBy(() -> orchestrator.getFileHistory("a.py", 10, null))
                .isInstanceOf(StorageException.class)
                .hasMessage("Storage is not configured");
        assertThatThrownBy(() -> orchestrator.getReviewsInTimeframe(now.minusSeconds(60), now, null))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> orchestrator.cleanupOldReviews(now))
                .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("reviewChanges передаёт diff файла, базовую ветку и список изменённых файлов")
    void givenChangedFilesWhenReviewChangesThenContextContainsDiffAndBranch() {
        Map<String, ChangedFile> files = new LinkedHashMap<>();
        files.put("svc/A.java", ChangedFile.builder().content("class A {}").diff("+class A {}").build());
        files.put("svc/B.java", ChangedFile.builder().content("class B {}").build());

        ReviewResult result = orchestrator(null).reviewChanges(files, "main", ReviewType.FULL, null, 2, false,
                CodeContext.builder().repository("group/app").build());

        assertThat(result.getSuccessfulReviews()).isEqualTo(2);

        CodeContext a = provider.contextFor("svc/A.java");
        assertThat(a.getDiff()).isEqualTo("+class A {}");
        assertThat(a.getBaseBranch()).isEqualTo("main");
        assertThat(a.getRepository()).isEqualTo("group/app");
        assertThat(a.getLanguage()).isEqualTo("java");
        assertThat(a.getChangedFiles()).containsExactly("svc/A.java", "svc/B.java");

        assertThat(provider.contextFor("svc/B.java").getDiff()).isNull();
    }

    @Test
    @DisplayName("Тип и настройки по умолчанию применяются, если вызывающий их не передал")
    void givenDefaultsWhenReviewFileWithoutTypeThenDefaultsUsed() {
        ReviewOrchestrator orchestrator = orchestrator(null);
        orchestrator.setDefaultReviewType(ReviewType.QUICK);

        orchestrator.reviewFile("a.py", "x");

        assertThat(provider.requests).singleElement()
                .satisfies(r -> {
                    assertThat(r.getReviewType()).isEqualTo(ReviewType.QUICK);
                    assertThat(r.getTemperature()).isEqualTo(props.getProvider().getTemperature());
                    assertThat(r.getMaxTokens()).isEqualTo(props.getProvider().getMaxTokens());
                });
    }

    @Test
    @DisplayName("Настройки из code-review.default-settings передаются провайдеру, явные настройки важнее")
    void givenDefaultSettingsInPropertiesWhenReviewThenProviderReceivesThem() {
        ReviewSettings defaults = ReviewSettings.builder().minSeverity(CommentSeverity.WARNING).maxComments(5).build();
        props.setDefaultSettings(defaults);
        ReviewOrchestrator orchestrator = orchestrator(null);

        orchestrator.reviewFile("a.py", "x");
        ReviewSettings explicit = ReviewSettings.builder().maxComments(1).build();
        orchestrator.reviewFiles(Map.of("b.py", "y"), ReviewType.FULL, explicit, 1, false, null);

        assertThat(provider.requests).hasSize(2);
        assertThat(provider.requests.get(0).getSettings()).isSameAs(defaults);
        assertThat(provider.requests.get(1).getSettings()).isSameAs(explicit);
    }

    /**
     * Провайдер-заглушка: запоминает запросы и считает одновременные вызовы
     */
    static class RecordingProvider implements ReviewProvider {

        final List<ReviewRequest> requests = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        volatile Set<String> failing = Set.of();
        volatile long delayMs;

        @Override
        public ReviewResponse generateReview(ReviewRequest request) {
            requests.add(request);
            String path = request.getCodeContext().getFilePath();
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if (delayMs > 0) {
                    Thread.sleep(delayMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }

            if (failing.contains(path)) {
                throw new ProviderException("backend down");
            }
            return ReviewResponse.builder()
                    .summary("ok " + path)
                    .score(0.9)
                    .comments(List.of(ReviewComment.builder()
                            .content("note for " + path)
                            .severity(CommentSeverity.WARNING)
                            .build()))
                    .build();
        }

        CodeContext contextFor(String path) {
            synchronized (requests) {
                return requests.stream()
                        .filter(r -> r.getCodeContext().getFilePath().equals(path))
                        .findFirst()
                        .orElseThrow()
                        .getCodeContext();
            }
        }

        @Override
        public boolean validateConfiguration() {
            return true;
        }

        @Override
        public int getTokenLimit() {
            return 100_000;
        }

        @Override
        public int estimateTokens(String text) {
            return text == null ? 0 : text.length() / 4;
        }

        @Override
        public String getProviderName() {
            return "fake";
        }
    }
}
