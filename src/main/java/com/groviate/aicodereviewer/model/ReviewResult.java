package com.groviate.aicodereviewer.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Агрегат результатов одного пакетного ревью.
 * <p>
 * Создаётся пустым в начале пакета, заполняется оркестратором по мере завершения задач
 * (задачи завершаются в любом порядке, поэтому мутации синхронизированы) и замораживается
 * вызовом {@link #complete()} после завершения всех задач.
 * Каждая задача пишет только в свой слот file_path.
 */
public class ReviewResult {

    private final Map<String, ReviewResponse> reviews = new LinkedHashMap<>();
    private final Map<String, String> errors = new LinkedHashMap<>();
    private final Map<String, String> reviewIds = new LinkedHashMap<>();

    @Getter
    private final Instant startTime;
    private Instant endTime;

    @Getter
    private final int totalFiles;
    private int successfulReviews;
    private int failedReviews;

    public ReviewResult(int totalFiles) {
        this(totalFiles, Instant.now());
    }

    public ReviewResult(int totalFiles, Instant startTime) {
        this.totalFiles = totalFiles;
        this.startTime = startTime;
    }

    /**
     * Фиксирует успешное ревью файла
     *
     * @param filePath путь к файлу
     * @param review   ответ провайдера
     * @param reviewId id сохранённой записи (null, если не сохраняли или сохранить не удалось)
     */
    public synchronized void addReview(String filePath, ReviewResponse review, String reviewId) {
        checkNotCompleted();
        reviews.put(filePath, review);
        successfulReviews++;
        if (reviewId != null) {
            reviewIds.put(filePath, reviewId);
        }
    }

    /**
     * Фиксирует ошибку ревью файла
     */
    public synchronized void addError(String filePath, String error) {
        checkNotCompleted();
        errors.put(filePath, error);
        failedReviews++;
    }

    /**
     * Замораживает результат: проставляет endTime. Повторный вызов ничего не меняет.
     */
    public synchronized void complete() {
        if (endTime == null) {
            endTime = Instant.now();
        }
    }

    public synchronized boolean isCompleted() {
        return endTime != null;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized int getSuccessfulReviews() {
        return successfulReviews;
    }

    public synchronized int getFailedReviews() {
        return failedReviews;
    }

    public synchronized Map<String, ReviewResponse> getReviews() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(reviews));
    }

    public synchronized Map<String, String> getErrors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public synchronized Map<String, String> getReviewIds() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(reviewIds));
    }

    /**
     * @return длительность пакета; {@link Duration#ZERO}, пока пакет не завершён
     */
    public synchronized Duration getDuration() {
        return endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
    }

    /**
     * Все замечания уровня error по всем успешно проверенным файлам
     */
    public synchronized List<Map.Entry<String, ReviewComment>> getCriticalIssues() {
        List<Map.Entry<String, ReviewComment>> critical = new ArrayList<>();
        reviews.forEach((path, review) -> review.getCommentsBySeverity(CommentSeverity.ERROR)
                .forEach(c -> critical.add(Map.entry(path, c))));
        return critical;
    }

    private void checkNotCompleted() {
        if (endTime != null) {
            throw new IllegalStateException("ReviewResult уже завершён");
        }
    }
}
