package com.groviate.aicodereviewer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Итог ревью одного файла: основной результат всегда есть,
 * сохранение в хранилище - побочный эффект со своим статусом.
 */
@Value
@Builder
public class FileReviewOutcome {

    ReviewResponse response;

    StorageStatus storageStatus;

    String reviewId; //заполнен только при STORED

    String storageError; //заполнен только при FAILED

    public boolean isStored() {
        return storageStatus == StorageStatus.STORED;
    }

    public enum StorageStatus {
        STORED,
        SKIPPED,
        FAILED
    }
}
