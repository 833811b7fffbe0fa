package com.groviate.aicodereviewer.storage;

import com.groviate.aicodereviewer.exception.StorageException;
import com.groviate.aicodereviewer.model.ReviewRecord;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.model.ReviewType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище истории ревью.
 * <p>
 * Все методы сообщают об ошибках ввода-вывода и десериализации через {@link StorageException}.
 */
public interface ReviewStorage {

    /**
     * Сохраняет ревью и возвращает сгенерированный id
     *
     * @param filePath   путь к файлу
     * @param reviewType тип выполненного ревью
     * @param response   ответ провайдера
     * @param metadata   произвольные метаданные (может быть null)
     * @return новый уникальный id записи
     */
    String saveReview(String filePath, ReviewType reviewType, ReviewResponse response, Map<String, Object> metadata);

    /**
     * @return запись или пустой Optional, если id не найден
     */
    Optional<ReviewRecord> getReview(String reviewId);

    /**
     * История ревью файла, новые первыми
     *
     * @param limit      максимум записей (null или <= 0 - без ограничения)
     * @param reviewType фильтр по типу (null - любые)
     */
    List<ReviewRecord> getFileReviews(String filePath, Integer limit, ReviewType reviewType);

    /**
     * Ревью в интервале [start, end] включительно, новые первыми
     */
    List<ReviewRecord> getReviewsInTimeframe(Instant start, Instant end, ReviewType reviewType);

    /**
     * @return true если запись существовала и была удалена
     */
    boolean deleteReview(String reviewId);

    /**
     * Удаляет записи со временем строго меньше olderThan
     *
     * @return количество удалённых записей
     */
    int cleanupOldReviews(Instant olderThan);
}
