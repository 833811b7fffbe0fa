package com.groviate.aicodereviewer.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение ревьюера.
 * Хранит "машинный" код ошибки и HTTP-статус, чтобы ExceptionHandler мог
 * централизованно вернуть корректный ответ.
 */
@Getter
public abstract class CodeReviewException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected CodeReviewException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected CodeReviewException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
