package com.groviate.aicodereviewer.model;

/**
 * Итоговое решение по MR/PR при публикации ревью
 */
public enum ReviewDisposition {
    APPROVE,
    REQUEST_CHANGES,
    COMMENT
}
