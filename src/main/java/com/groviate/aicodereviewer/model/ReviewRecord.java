package com.groviate.aicodereviewer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Сохранённое ревью. Создаётся только хранилищем, id генерируется при сохранении.
 */
@Value
@Builder
public class ReviewRecord {

    String id;

    String filePath;

    ReviewType reviewType;

    ReviewResponse response;

    Instant timestamp;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
