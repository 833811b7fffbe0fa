package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Ошибка при обращении к GitLab API / публикации комментариев / чтении изменений.
 */
public class SourceHostingException extends CodeReviewException {

    public SourceHostingException(String message, Throwable cause) {
        super("SOURCE_HOSTING_ERROR", HttpStatus.BAD_GATEWAY, message, cause);
    }

    public SourceHostingException(String message) {
        super("SOURCE_HOSTING_ERROR", HttpStatus.BAD_GATEWAY, message);
    }
}
