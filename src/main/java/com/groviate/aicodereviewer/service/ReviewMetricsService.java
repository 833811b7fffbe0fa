package com.groviate.aicodereviewer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Сервис для сбора метрик по ревью файлов.
 * <p>
 * Использует единые имена метрик {@code ai_review_file_total} и {@code ai_review_file_duration}
 * и тег {@code result} для разбиения по исходу операции.
 * Неудачные best-effort сохранения считаются в {@code ai_review_storage_failures_total}.
 */
@Service
public class ReviewMetricsService {

    private static final String METRIC_FILE_TOTAL = "ai_review_file_total";
    private static final String METRIC_FILE_DURATION = "ai_review_file_duration";
    private static final String METRIC_STORAGE_FAILURES = "ai_review_storage_failures_total";
    private static final String TAG_RESULT = "result";

    private final MeterRegistry registry;

    private final Counter success;
    private final Counter failed;
    private final Counter storageFailures;

    private final Timer durationSuccess;
    private final Timer durationFailed;

    public ReviewMetricsService(MeterRegistry registry) {
        this.registry = registry;

        this.success = Counter.builder(METRIC_FILE_TOTAL)
                .tag(TAG_RESULT, "success")
                .register(registry);

        this.failed = Counter.builder(METRIC_FILE_TOTAL)
                .tag(TAG_RESULT, "failed")
                .register(registry);

        this.storageFailures = Counter.builder(METRIC_STORAGE_FAILURES)
                .register(registry);

        this.durationSuccess = Timer.builder(METRIC_FILE_DURATION)
                .tag(TAG_RESULT, "success")
                .register(registry);

        this.durationFailed = Timer.builder(METRIC_FILE_DURATION)
                .tag(TAG_RESULT, "failed")
                .register(registry);
    }

    public Timer.Sample start() {
        return Timer.start(registry);
    }

    public void markSuccess(Timer.Sample sample) {
        success.increment();
        if (sample != null) sample.stop(durationSuccess);
    }

    public void markFailed(Timer.Sample sample) {
        failed.increment();
        if (sample != null) sample.stop(durationFailed);
    }

    public void markStorageFailure() {
        storageFailures.increment();
    }
}
