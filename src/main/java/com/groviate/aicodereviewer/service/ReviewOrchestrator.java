package com.groviate.aicodereviewer.service;

import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.exception.ConfigurationException;
import com.groviate.aicodereviewer.exception.ReviewException;
import com.groviate.aicodereviewer.exception.StorageException;
import com.groviate.aicodereviewer.model.ChangedFile;
import com.groviate.aicodereviewer.model.CodeContext;
import com.groviate.aicodereviewer.model.FileReviewOutcome;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewRequest;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewResult;
import com.groviate.aicodereviewer.model.ReviewSettings;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.provider.ReviewProvider;
import com.groviate.aicodereviewer.report.ReportGenerator;
import com.groviate.aicodereviewer.report.ReviewReport;
import com.groviate.aicodereviewer.storage.ReviewStorage;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Главный оркестратор ревью файлов
 * <p>
 * Координирует работу провайдера, хранилища и генератора отчётов:
 * <ol>
 *   <li>Собирает {@link ReviewRequest} из файла, настроек и контекста изменения</li>
 *   <li>Вызывает {@link ReviewProvider} с ограничением параллельности (семафор на пакет)</li>
 *   <li>Сохраняет результат в историю (best-effort: ошибка сохранения не ломает ревью)</li>
 *   <li>Собирает итоги пакета в {@link ReviewResult}: ошибка одного файла не прерывает остальные</li>
 * </ol>
 * <p>
 * Состояния задачи файла: PENDING → REQUESTING → SUCCEEDED | FAILED. Автоматических повторов
 * на этом уровне нет, ретраи выполняются внутри шлюза провайдера. Отмена пакета не поддерживается:
 * пакет всегда доводится до конца.
 */
@Service
@Slf4j
public class ReviewOrchestrator {

    private static final String STORAGE_NOT_CONFIGURED = "Storage is not configured";

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"), Map.entry("kt", "kotlin"), Map.entry("py", "python"),
            Map.entry("js", "javascript"), Map.entry("ts", "typescript"), Map.entry("go", "go"),
            Map.entry("rb", "ruby"), Map.entry("cs", "csharp"), Map.entry("cpp", "cpp"),
            Map.entry("c", "c"), Map.entry("rs", "rust"), Map.entry("php", "php"),
            Map.entry("sql", "sql"), Map.entry("yml", "yaml"), Map.entry("yaml", "yaml"),
            Map.entry("xml", "xml"), Map.entry("sh", "shell"));

    private final ReviewProvider provider;
    private final ReviewStorage storage;
    private final ReportGenerator reportGenerator;
    private final Executor reviewExecutor;
    private final ReviewMetricsService metrics;
    private final CodeReviewProperties props;

    private volatile ReviewType defaultReviewType;
    private volatile ReviewSettings defaultSettings;

    /**
     * @param provider        - активный AI-провайдер (общий для всех задач пакета)
     * @param storage         - хранилище истории; null если code-review.storage.enabled=false
     * @param reportGenerator - генератор отчётов
     * @param reviewExecutor  - пул потоков для задач пакета
     * @param metrics         - метрики ревью файлов
     * @param props           - настройки ревьюера (тип по умолчанию, лимит параллельности, сохранение)
     */
    public ReviewOrchestrator(ReviewProvider provider,
                              @Nullable ReviewStorage storage,
                              ReportGenerator reportGenerator,
                              @Qualifier("reviewExecutor") Executor reviewExecutor,
                              ReviewMetricsService metrics,
                              CodeReviewProperties props) {
        this.provider = provider;
        this.storage = storage;
        this.reportGenerator = reportGenerator;
        this.reviewExecutor = reviewExecutor;
        this.metrics = metrics;
        this.props = props;
        this.defaultReviewType = props.getDefaultReviewType();
        this.defaultSettings = props.getDefaultSettings();
    }

    public void setDefaultReviewType(ReviewType reviewType) {
        this.defaultReviewType = reviewType;
    }

    public void setDefaultSettings(ReviewSettings settings) {
        this.defaultSettings = settings;
    }

    public boolean isStorageConfigured() {
        return storage != null;
    }

    /**
     * Ревью одного файла с настройками по умолчанию
     */
    public FileReviewOutcome reviewFile(String filePath, String content) {
        return reviewFile(filePath, content, null, null, props.isStoreReviews(), null);
    }

    /**
     * Ревью одного файла
     *
     * @param filePath   путь к файлу
     * @param content    текст файла
     * @param reviewType тип ревью (null - тип по умолчанию)
     * @param settings   настройки (null - настройки по умолчанию)
     * @param store      сохранить результат в историю, если хранилище настроено
     * @param context    дополнительный контекст (repository, baseBranch, diff...); может быть null
     * @return ответ провайдера и статус сохранения
     * @throws ReviewException если ревью не удалось (с путём файла в сообщении)
     */
    public FileReviewOutcome reviewFile(String filePath, String content, ReviewType reviewType,
                                        ReviewSettings settings, boolean store, CodeContext context) {
        Timer.Sample sample = metrics.start();
        ReviewType type = resolveType(reviewType);
        CodeContext ctx = buildContext(filePath, content, context != null ? context.getDiff() : null, context);

        try {
            ReviewResponse response = generate(ctx, type, resolveSettings(settings));
            FileReviewOutcome outcome = persist(ctx, type, response, store);
            metrics.markSuccess(sample);
            return outcome;
        } catch (RuntimeException e) {
            metrics.markFailed(sample);
            throw e;
        }
    }

    /**
     * Ревью набора файлов с настройками по умолчанию
     */
    public ReviewResult reviewFiles(Map<String, String> files) {
        return reviewFiles(files, null, null, props.getMaxConcurrent(), props.isStoreReviews(), null);
    }

    /**
     * Ревью набора независимых файлов с ограничением параллельности.
     * <p>
     * Никогда не бросает исключение из-за ошибки отдельного файла: ошибки попадают в
     * {@link ReviewResult#getErrors()}.
     *
     * @param files         путь -> содержимое
     * @param maxConcurrent сколько файлов одновременно может ждать ответа провайдера (>= 1)
     * @throws ConfigurationException если maxConcurrent < 1
     */
    public ReviewResult reviewFiles(Map<String, String> files, ReviewType reviewType, ReviewSettings settings,
                                    int maxConcurrent, boolean store, CodeContext context) {
        Map<String, CodeContext> contexts = new LinkedHashMap<>();
        files.forEach((path, content) -> contexts.put(path, buildContext(path, content, null, context)));
        return runBatch(contexts, reviewType, settings, maxConcurrent, store);
    }

    /**
     * Ревью изменённых файлов: как {@link #reviewFiles}, но diff каждого файла попадает в его контекст,
     * а базовая ветка и список изменённых файлов - в общий контекст.
     *
     * @param files      путь -> (содержимое, diff); diff может отсутствовать
     * @param baseBranch ветка, с которой сравниваем
     */
    public ReviewResult reviewChanges(Map<String, ChangedFile> files, String baseBranch, ReviewType reviewType,
                                      ReviewSettings settings, int maxConcurrent, boolean store,
                                      CodeContext context) {
        CodeContext shared = (context != null ? context.toBuilder() : CodeContext.builder())
                .baseBranch(baseBranch)
                .changedFiles(new ArrayList<>(files.keySet()))
                .build();

        Map<String, CodeContext> contexts = new LinkedHashMap<>();
        files.forEach((path, file) -> contexts.put(path,
                buildContext(path, file.getContent(), file.getDiff(), shared)));
        return runBatch(contexts, reviewType, settings, maxConcurrent, store);
    }

    public ReviewResult reviewChanges(Map<String, ChangedFile> files, String baseBranch) {
        return reviewChanges(files, baseBranch, null, null, props.getMaxConcurrent(), props.isStoreReviews(), null);
    }

    // История и отчёты

    public List<ReviewRecord> getFileHistory(String filePath, Integer limit, ReviewType reviewType) {
        return requireStorage().getFileReviews(filePath, limit, reviewType);
    }

    public List<ReviewRecord> getReviewsInTimeframe(Instant start, Instant end, ReviewType reviewType) {
        return requireStorage().getReviewsInTimeframe(start, end, reviewType);
    }

    public int cleanupOldReviews(Instant olderThan) {
        return requireStorage().cleanupOldReviews(olderThan);
    }

    public ReviewReport generateReport(ReviewResult result, ReviewType reviewType, boolean includeCode,
                                       String templateId) {
        return reportGenerator.generateMultiFileReport(result.getReviews(), resolveType(reviewType), includeCode,
                templateId);
    }

    public ReviewReport generateFileReport(String filePath, ReviewResponse review, ReviewType reviewType,
                                           boolean includeCode, String templateId) {
        return reportGenerator.generateFileReport(review, filePath, resolveType(reviewType), includeCode, templateId);
    }

    /**
     * История ревью файла. Без filePath отчёт пустой.
     */
    public ReviewReport generateHistoricalReport(String filePath, ReviewType reviewType, Integer limit) {
        ReviewStorage s = requireStorage();
        List<ReviewRecord> records = filePath != null ? s.getFileReviews(filePath, limit, reviewType) : List.of();
        return reportGenerator.generateHistoricalReport(records, filePath, reviewType);
    }

    public ReviewReport generateTrendReport(Instant start, Instant end, ReviewType reviewType) {
        List<ReviewRecord> records = requireStorage().getReviewsInTimeframe(start, end, reviewType);
        return reportGenerator.generateTrendReport(records, start, end, reviewType);
    }

    public String renderReport(ReviewReport report) {
        return reportGenerator.render(report);
    }

    /**
     * Выполняет пакет: по задаче на файл, семафор на maxConcurrent берётся до отправки задачи в пул
     * и освобождается по её завершении, барьер на завершение всех задач.
     */
    private ReviewResult runBatch(Map<String, CodeContext> contexts, ReviewType reviewType, ReviewSettings settings,
                                  int maxConcurrent, boolean store) {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("max concurrent reviews must be >= 1, got " + maxConcurrent);
        }

        ReviewType type = resolveType(reviewType);
        ReviewSettings resolvedSettings = resolveSettings(settings);
        String batchId = UUID.randomUUID().toString().substring(0, 8);

        ReviewResult result = new ReviewResult(contexts.size());
        Semaphore gate = new Semaphore(maxConcurrent);
        List<CompletableFuture<Void>> tasks = new ArrayList<>(contexts.size());

        log.info("[{}] Старт пакета ревью: files={}, type={}, maxConcurrent={}", batchId, contexts.size(),
                type.getValue(), maxConcurrent);

        // в пул уходит не больше maxConcurrent задач пакета, поэтому очередь пула не переполняется
        for (Map.Entry<String, CodeContext> entry : contexts.entrySet()) {
            String path = entry.getKey();
            CodeContext ctx = entry.getValue();
            try {
                gate.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.addError(path, "Review interrupted for " + path);
                metrics.markFailed(null);
                continue;
            }
            try {
                tasks.add(CompletableFuture.runAsync(
                        () -> runTask(batchId, ctx, type, resolvedSettings, store, gate, result), reviewExecutor));
            } catch (RejectedExecutionException e) {
                gate.release();
                log.warn("[{}] Задача для {} отклонена пулом: {}", batchId, path, e.getMessage());
                result.addError(path, "Review task rejected: " + e.getMessage());
                metrics.markFailed(null);
            }
        }

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        result.complete();

        log.info("[{}] Пакет завершён: успешно={}, с ошибкой={}, за {} мс", batchId, result.getSuccessfulReviews(),
                result.getFailedReviews(), result.getDuration().toMillis());
        return result;
    }

    /**
     * Задача одного файла. Ничего не бросает наружу: исход записывается в свой слот ReviewResult,
     * место в семафоре пакета освобождается всегда.
     */
    private void runTask(String batchId, CodeContext ctx, ReviewType type, ReviewSettings settings, boolean store,
                         Semaphore gate, ReviewResult result) {
        String path = ctx.getFilePath();
        Timer.Sample sample = metrics.start();
        try {
            ReviewResponse response = generate(ctx, type, settings);
            FileReviewOutcome outcome = persist(ctx, type, response, store);
            result.addReview(path, response, outcome.getReviewId());
            metrics.markSuccess(sample);

        } catch (Exception e) {
            log.warn("[{}] Ревью {} завершилось ошибкой: {}", batchId, path, e.getMessage());
            result.addError(path, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            metrics.markFailed(sample);
        } finally {
            gate.release();
        }
    }

    /**
     * Вызов провайдера. Любая ошибка превращается в ReviewException с путём файла.
     */
    private ReviewResponse generate(CodeContext ctx, ReviewType type, ReviewSettings settings) {
        ReviewRequest request = ReviewRequest.builder()
                .codeContext(ctx)
                .reviewType(type)
                .settings(settings)
                .temperature(props.getProvider().getTemperature())
                .maxTokens(props.getProvider().getMaxTokens())
                .build();

        try {
            return provider.generateReview(request);
        } catch (RuntimeException e) {
            log.error("Не удалось выполнить ревью {}: {}", ctx.getFilePath(), e.getMessage());
            throw new ReviewException("Review failed for " + ctx.getFilePath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Best-effort сохранение. Ошибка хранилища логируется и отражается в статусе, но не бросается.
     */
    private FileReviewOutcome persist(CodeContext ctx, ReviewType type, ReviewResponse response, boolean store) {
        if (!store || storage == null) {
            return FileReviewOutcome.builder()
                    .response(response)
                    .storageStatus(FileReviewOutcome.StorageStatus.SKIPPED)
                    .build();
        }

        try {
            String id = storage.saveReview(ctx.getFilePath(), type, response, storageMetadata(ctx));
            return FileReviewOutcome.builder()
                    .response(response)
                    .storageStatus(FileReviewOutcome.StorageStatus.STORED)
                    .reviewId(id)
                    .build();

        } catch (RuntimeException e) {
            metrics.markStorageFailure();
            log.warn("Не удалось сохранить ревью {} в историю: {}", ctx.getFilePath(), e.getMessage());
            log.debug("Storage failure details", e);
            return FileReviewOutcome.builder()
                    .response(response)
                    .storageStatus(FileReviewOutcome.StorageStatus.FAILED)
                    .storageError(e.getMessage())
                    .build();
        }
    }

    private Map<String, Object> storageMetadata(CodeContext ctx) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("provider", provider.getProviderName());
        putIfPresent(metadata, "language", ctx.getLanguage());
        putIfPresent(metadata, "repository", ctx.getRepository());
        putIfPresent(metadata, "base_branch", ctx.getBaseBranch());
        putIfPresent(metadata, "commit_hash", ctx.getCommitHash());
        putIfPresent(metadata, "author", ctx.getAuthor());
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private CodeContext buildContext(String filePath, String content, String diff, CodeContext shared) {
        CodeContext.CodeContextBuilder b = shared != null ? shared.toBuilder() : CodeContext.builder();
        b.filePath(filePath).content(content).diff(diff);
        if (shared == null || shared.getLanguage() == null) {
            b.language(detectLanguage(filePath));
        }
        return b.build();
    }

    private static String detectLanguage(String filePath) {
        if (filePath == null) {
            return null;
        }
        int dot = filePath.lastIndexOf('.');
        if (dot < 0 || dot == filePath.length() - 1) {
            return null;
        }
        return LANGUAGES.get(filePath.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private ReviewType resolveType(ReviewType reviewType) {
        return reviewType != null ? reviewType : defaultReviewType;
    }

    private ReviewSettings resolveSettings(ReviewSettings settings) {
        return settings != null ? settings : defaultSettings;
    }

    private ReviewStorage requireStorage() {
        if (storage == null) {
            throw new StorageException(STORAGE_NOT_CONFIGURED);
        }
        return storage;
    }
}
