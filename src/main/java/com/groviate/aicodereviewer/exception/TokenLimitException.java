package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Запрос не помещается в контекстное окно модели.
 */
public class TokenLimitException extends ProviderException {

    public TokenLimitException(String message) {
        super("TOKEN_LIMIT", HttpStatus.PAYLOAD_TOO_LARGE, message, null);
    }
}
