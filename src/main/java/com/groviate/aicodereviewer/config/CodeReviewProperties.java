package com.groviate.aicodereviewer.config;

import com.groviate.aicodereviewer.model.CommentSeverity;
import com.groviate.aicodereviewer.model.ReviewSettings;
import com.groviate.aicodereviewer.model.ReviewType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Управление и хранение настроек AI-ревьюера.
 * Свойства загружаются из конфигурационного файла application.yml с префиксом "code-review".
 */
@Component
@ConfigurationProperties(prefix = "code-review")
@Data
public class CodeReviewProperties {

    // Основное управление

    /**
     * Тип ревью по умолчанию, если вызывающий не указал свой
     */
    private ReviewType defaultReviewType = ReviewType.FULL;

    /**
     * Настройки ревью по умолчанию (code-review.default-settings.*), если вызывающий не передал свои
     */
    private ReviewSettings defaultSettings;

    /**
     * Сколько файлов одновременно может ждать ответа провайдера
     */
    private int maxConcurrent = 3;

    /**
     * Сохранять результаты ревью в историю
     */
    private boolean storeReviews = true;

    // Провайдер

    private Provider provider = new Provider();

    // Хранилище

    private Storage storage = new Storage();

    // Публикация в GitLab

    private Feedback feedback = new Feedback();

    @Data
    public static class Provider {

        /**
         * Имя провайдера в ProviderRegistry (openai, anthropic)
         */
        private String name = "openai";

        /**
         * API ключ провайдера
         */
        private String apiKey;

        /**
         * Модель (пусто = модель провайдера по умолчанию)
         */
        private String model;

        /**
         * Базовый URL API (пусто = официальный endpoint)
         */
        private String baseUrl;

        /**
         * Температура генерации
         */
        private Double temperature = 0.2;

        /**
         * Максимум токенов ответа
         */
        private Integer maxTokens = 4000;

        /**
         * Таймаут подключения к API модели
         */
        private Duration connectTimeout = Duration.ofSeconds(30);

        /**
         * Таймаут ожидания ответа модели
         */
        private Duration readTimeout = Duration.ofSeconds(180);

        /**
         * Собирает конфиг для ProviderRegistry.create
         */
        public Map<String, Object> toConfig() {
            Map<String, Object> config = new LinkedHashMap<>();
            putIfPresent(config, "model", model);
            putIfPresent(config, "base-url", baseUrl);
            putIfPresent(config, "temperature", temperature);
            putIfPresent(config, "max-tokens", maxTokens);
            return config;
        }

        private static void putIfPresent(Map<String, Object> config, String key, Object value) {
            if (value instanceof String s && s.isBlank()) {
                return;
            }
            if (value != null) {
                config.put(key, value);
            }
        }
    }

    @Data
    public static class Storage {

        /**
         * Включить хранилище истории ревью
         */
        private boolean enabled = true;

        /**
         * Включить периодическую очистку старых ревью
         */
        private boolean cleanupEnabled = false;

        /**
         * Сколько дней хранить ревью
         */
        private int retentionDays = 90;

        /**
         * Cron для очистки (по умолчанию каждую ночь в 03:00)
         */
        private String cleanupCron = "0 0 3 * * *";
    }

    @Data
    public static class Feedback {

        /**
         * Минимальная серьёзность замечаний, которые публикуются в MR
         */
        private CommentSeverity minSeverity = CommentSeverity.SUGGESTION;

        /**
         * Максимум комментариев на весь MR
         */
        private int maxComments = 50;

        /**
         * Разрешить боту approve, если замечаний нет
         */
        private boolean allowApprove = false;
    }
}
