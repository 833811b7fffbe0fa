package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Ошибка провайдера, которую не имеет смысла ретраить.
 * Примеры: 400 (плохой запрос), 401/403 (ключ/права), NonTransientAiException.
 */
public class NonRetryableProviderException extends ProviderException {

    public NonRetryableProviderException(String message, Throwable cause) {
        super("PROVIDER_NON_RETRYABLE", HttpStatus.BAD_GATEWAY, message, cause);
    }

    public NonRetryableProviderException(String message) {
        this(message, null);
    }
}
