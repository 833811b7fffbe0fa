package com.groviate.aicodereviewer.exception;

import org.springframework.http.HttpStatus;

/**
 * Неизвестные или некорректные настройки (провайдер, ключ, тип ревью, лимиты).
 */
public class ConfigurationException extends CodeReviewException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", HttpStatus.BAD_REQUEST, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", HttpStatus.BAD_REQUEST, message, cause);
    }
}
