package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.exception.NonRetryableProviderException;
import com.groviate.aicodereviewer.exception.ProviderException;
import com.groviate.aicodereviewer.exception.ReviewException;
import com.groviate.aicodereviewer.exception.TokenLimitException;
import com.groviate.aicodereviewer.model.ReviewComment;
import com.groviate.aicodereviewer.model.ReviewRequest;
import com.groviate.aicodereviewer.model.ReviewResponse;
import com.groviate.aicodereviewer.service.PromptTemplateService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Общий алгоритм ревью через чат-модель.
 * <p>
 * Процесс работы:
 * 1. Проверить запрос ({@link ReviewRequest#validate()})
 * 2. Подготовить system/user промпты через {@link PromptTemplateService}
 * 3. Проверить, что промпт и ответ помещаются в контекстное окно модели
 * 4. Отправить промпт через {@link AiChatGateway}
 * 5. Разобрать ответ через {@link ReviewResponseParser} и применить настройки ревью
 */
@Slf4j
public abstract class AbstractChatReviewProvider implements ReviewProvider {

    private static final int CHARS_PER_TOKEN = 4;

    private final AiChatGateway gateway;
    private final PromptTemplateService prompts;
    private final ReviewResponseParser parser;

    @Getter
    private final String model;
    private final Double defaultTemperature;
    private final Integer defaultMaxTokens;

    protected AbstractChatReviewProvider(AiChatGateway gateway,
                                         PromptTemplateService prompts,
                                         ReviewResponseParser parser,
                                         String model,
                                         Double defaultTemperature,
                                         Integer defaultMaxTokens) {
        this.gateway = gateway;
        this.prompts = prompts;
        this.parser = parser;
        this.model = model;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
    }

    @Override
    public ReviewResponse generateReview(ReviewRequest request) {
        if (request == null || !request.validate()) {
            throw new ProviderException("Invalid review request: file path, content, review type "
                    + "and temperature in [0, 1] are required");
        }

        String filePath = request.getCodeContext().getFilePath();
        String systemPrompt = prompts.getSystemPrompt();
        String userPrompt = prompts.preparePrompt(request);

        Integer maxTokens = request.getMaxTokens() != null ? request.getMaxTokens() : defaultMaxTokens;
        int promptTokens = estimateTokens(systemPrompt) + estimateTokens(userPrompt);
        int required = promptTokens + (maxTokens != null ? maxTokens : 0);
        if (required > getTokenLimit()) {
            throw new TokenLimitException("Request for " + filePath + " needs ~" + required
                    + " tokens, " + getProviderName() + " limit is " + getTokenLimit());
        }

        Double temperature = request.getTemperature() != null ? request.getTemperature() : defaultTemperature;

        log.debug("Запрос к {}: file={}, type={}, promptTokens~{}", getProviderName(), filePath,
                request.getReviewType().getValue(), promptTokens);

        String raw = gateway.ask(systemPrompt, userPrompt, temperature, maxTokens);

        ReviewResponse response = parser.parse(raw);

        List<ReviewComment> comments = request.getSettings() == null
                ? response.getComments()
                : request.getSettings().apply(response.getComments());

        Map<String, Object> metadata = new LinkedHashMap<>(response.getMetadata());
        metadata.put("provider", getProviderName());
        metadata.put("model", model);
        metadata.put("review_type", request.getReviewType().getValue());
        metadata.put("prompt_tokens_estimate", promptTokens);
        if (request.getGenerationParams() != null && !request.getGenerationParams().isEmpty()) {
            metadata.put("generation_params", request.getGenerationParams());
        }

        response.setComments(comments);
        response.setMetadata(metadata);

        log.info("Ревью {} получено от {}: замечаний={}, score={}", filePath, getProviderName(),
                comments.size(), response.getScore());
        return response;
    }

    /**
     * Минимальный реальный вызов модели. Любая ошибка означает false.
     */
    @Override
    public boolean validateConfiguration() {
        try {
            String answer = gateway.ask("Ответь одним словом.", "ping", 0.0, 5);
            return answer != null;
        } catch (NonRetryableProviderException e) {
            log.warn("{}: конфигурация отклонена бэкендом: {}", getProviderName(), e.getMessage());
            return false;
        } catch (ProviderException | ReviewException e) {
            log.warn("{}: бэкенд недоступен: {}", getProviderName(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("{}: проверка конфигурации завершилась ошибкой: {}", getProviderName(), e.getMessage());
            log.debug("Validation failure details", e);
            return false;
        }
    }

    /**
     * Грубая оценка: ~4 символа на токен
     */
    @Override
    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
