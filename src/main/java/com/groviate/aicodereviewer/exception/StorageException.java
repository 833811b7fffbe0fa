package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Ошибка хранилища истории ревью (I/O, десериализация, хранилище не настроено).
 */
public class StorageException extends CodeReviewException {

    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }

    public StorageException(String message) {
        super("STORAGE_ERROR", HttpStatus.SERVICE_UNAVAILABLE, message);
    }
}
