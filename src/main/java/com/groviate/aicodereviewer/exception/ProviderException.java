package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Ошибка обращения к AI-провайдеру: транспорт, авторизация, модель,
 * либо невалидный запрос, отклонённый до вызова провайдера.
 */
public class ProviderException extends CodeReviewException {

    public ProviderException(String message, Throwable cause) {
        super("PROVIDER_ERROR", HttpStatus.BAD_GATEWAY, message, cause);
    }

    public ProviderException(String message) {
        super("PROVIDER_ERROR", HttpStatus.BAD_GATEWAY, message);
    }

    protected ProviderException(String code, HttpStatus status, String message, Throwable cause) {
        super(code, status, message, cause);
    }
}
