package com.groviate.aicodereviewer.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.aicodereviewer.entity.ReviewRecordEntity;
import com.groviate.aicodereviewer.exception.CodeReviewException;
import com.groviate.aicodereviewer.exception.StorageException;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;
import com.groviate.aicodereviewer.repository.ReviewRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Хранилище истории ревью поверх Spring Data JPA (таблица reviews).
 * <p>
 * Ответ и метаданные хранятся JSON-документами. Каждая операция выполняется в собственной
 * транзакции: соединение берётся из пула на время операции и сразу возвращается.
 */
@Component
@ConditionalOnProperty(prefix = "code-review.storage", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class JpaReviewStorage implements ReviewStorage {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ReviewRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaReviewStorage(ReviewRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public String saveReview(String filePath, ReviewType reviewType, ReviewResponse response,
                             Map<String, Object> metadata) {
        String reviewId = UUID.randomUUID().toString();

        return execute("Failed to save review", () -> {
            ReviewRecordEntity entity = ReviewRecordEntity.builder()
                    .id(reviewId)
                    .filePath(filePath)
                    .reviewType(reviewType.getValue())
                    .reviewResponse(writeJson(ReviewDocument.from(response)))
                    .reviewedAt(Instant.now(clock))
                    .metadata(metadata == null || metadata.isEmpty() ? null : writeJson(metadata))
                    .build();

            repository.saveAndFlush(entity);
            log.debug("Ревью сохранено: id={}, file={}, type={}", reviewId, filePath, reviewType.getValue());
            return reviewId;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ReviewRecord> getReview(String reviewId) {
        return execute("Failed to get review", () -> repository.findById(reviewId).map(this::toRecord));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> getFileReviews(String filePath, Integer limit, ReviewType reviewType) {
        Pageable page = (limit == null || limit <= 0) ? Pageable.unpaged() : PageRequest.of(0, limit);

        return execute("Failed to get file reviews", () -> {
            List<ReviewRecordEntity> rows = (reviewType == null)
                    ? repository.findByFilePathOrderByReviewedAtDesc(filePath, page)
                    : repository.findByFilePathAndReviewTypeOrderByReviewedAtDesc(filePath, reviewType.getValue(), page);
            return rows.stream().map(this::toRecord).toList();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> getReviewsInTimeframe(Instant start, Instant end, ReviewType reviewType) {
        return execute("Failed to get reviews in timeframe", () -> {
            List<ReviewRecordEntity> rows = (reviewType == null)
                    ? repository.findByReviewedAtBetweenOrderByReviewedAtDesc(start, end)
                    : repository.findByReviewedAtBetweenAndReviewTypeOrderByReviewedAtDesc(start, end,
                    reviewType.getValue());
            return rows.stream().map(this::toRecord).toList();
        });
    }

    @Override
    @Transactional
    public boolean deleteReview(String reviewId) {
        return execute("Failed to delete review", () -> repository.deleteRecord(reviewId) > 0);
    }

    @Override
    @Transactional
    public int cleanupOldReviews(Instant olderThan) {
        return execute("Failed to cleanup old reviews", () -> {
            int removed = repository.deleteOlderThan(olderThan);
            log.info("Очистка истории ревью: удалено {} записей старше {}", removed, olderThan);
            return removed;
        });
    }

    /**
     * Выполняет операцию и переводит любую ошибку хранилища в {@link StorageException}
     */
    private <T> T execute(String errorMessage, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (StorageException e) {
            throw e;
        } catch (CodeReviewException e) {
            throw new StorageException(errorMessage + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("{}: {}", errorMessage, e.getMessage());
            throw new StorageException(errorMessage + ": " + e.getMessage(), e);
        }
    }

    private ReviewRecord toRecord(ReviewRecordEntity entity) {
        try {
            ReviewDocument document = objectMapper.readValue(entity.getReviewResponse(), ReviewDocument.class);
            Map<String, Object> metadata = entity.getMetadata() == null
                    ? Map.of()
                    : objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);

            return ReviewRecord.builder()
                    .id(entity.getId())
                    .filePath(entity.getFilePath())
                    .reviewType(ReviewType.fromValue(entity.getReviewType()))
                    .response(document.toResponse())
                    .timestamp(entity.getReviewedAt())
                    .metadata(metadata)
                    .build();

        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Failed to deserialize review " + entity.getId() + ": " + e.getMessage(), e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize review: " + e.getOriginalMessage(), e);
        }
    }
}
