package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Ответ модели не удалось разобрать, либо ревью файла завершилось ошибкой целиком.
 */
public class ReviewException extends CodeReviewException {

    public ReviewException(String message, Throwable cause) {
        super("REVIEW_ERROR", HttpStatus.UNPROCESSABLE_ENTITY, message, cause);
    }

    public ReviewException(String message) {
        super("REVIEW_ERROR", HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
