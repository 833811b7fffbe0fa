package com.groviate.aicodereviewer.scheduler;

import com.groviate.aicodereviewer.config.CodeReviewProperties;
import com.groviate.aicodereviewer.service.ReviewOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Периодическая очистка истории ревью старше code-review.storage.retention-days
 */
@Slf4j
@Component
public class ReviewRetentionScheduler {

    private final CodeReviewProperties props;
    private final ReviewOrchestrator orchestrator;
    private final Clock clock;

    public ReviewRetentionScheduler(CodeReviewProperties props, ReviewOrchestrator orchestrator, Clock clock) {
        this.props = props;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    /**
     * Выполняется по расписанию code-review.storage.cleanup-cron.
     * Ничего не делает, если очистка выключена или хранилище не настроено.
     */
    @Scheduled(cron = "${code-review.storage.cleanup-cron:0 0 3 * * *}")
    public void tick() {
        CodeReviewProperties.Storage storage = props.getStorage();
        if (!storage.isCleanupEnabled() || !orchestrator.isStorageConfigured()) return;

        if (storage.getRetentionDays() <= 0) {
            log.warn("Очистка истории пропущена: retention-days={}", storage.getRetentionDays());
            return;
        }

        Instant olderThan = Instant.now(clock).minus(Duration.ofDays(storage.getRetentionDays()));
        try {
            int deleted = orchestrator.cleanupOldReviews(olderThan);
            log.info("Очистка истории ревью: удалено={}, olderThan={}", deleted, olderThan);
        } catch (Exception e) {
            log.warn("Очистка истории ревью не удалась: {}", e.getMessage());
        }
    }
}
