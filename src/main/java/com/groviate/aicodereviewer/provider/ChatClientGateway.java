package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.exception.NonRetryableProviderException;
import com.groviate.aicodereviewer.exception.ProviderException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * Шлюз для обращения к модели через Spring AI {@link ChatClient}.
 * <p>
 * Вызов обёрнут в resilience4j {@link Retry} и {@link CircuitBreaker} (инстанс {@code ai-provider}).
 * Non-retryable ошибки (4xx, кроме 408/429, и NonTransientAiException) пробрасываются как
 * {@link NonRetryableProviderException}: retry их игнорирует, circuit breaker не считает отказами.
 * Остальные ошибки считаются временными и оборачиваются в {@link ProviderException}.
 */
@Slf4j
public class ChatClientGateway implements AiChatGateway {

    private final String providerName;
    private final ChatClient chatClient;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ChatClientGateway(String providerName, ChatClient chatClient, Retry retry, CircuitBreaker circuitBreaker) {
        this.providerName = providerName;
        this.chatClient = chatClient;
        this.retry = retry;
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * Выполняет запрос к модели и возвращает текстовый ответ.
     * <ul>
     *   <li>{@link NonTransientAiException} → {@link NonRetryableProviderException}</li>
     *   <li>HTTP 4xx (кроме 408/429) → {@link NonRetryableProviderException}</li>
     *   <li>HTTP 408/429, 5xx и прочие ошибки → {@link ProviderException} (retryable)</li>
     *   <li>circuit breaker открыт → {@link ProviderException} без обращения к модели</li>
     * </ul>
     *
     * @return текстовый ответ модели (content)
     */
    @Override
    public String ask(String systemPrompt, String userPrompt, Double temperature, Integer maxTokens) {
        Supplier<String> call = () -> doAsk(systemPrompt, userPrompt, temperature, maxTokens);
        Supplier<String> decorated = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call));

        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker '{}' открыт, запрос к {} не выполнен", circuitBreaker.getName(), providerName);
            throw new ProviderException(providerName + " is temporarily unavailable (circuit breaker open)", e);
        }
    }

    private String doAsk(String systemPrompt, String userPrompt, Double temperature, Integer maxTokens) {
        try {
            ChatOptions options = ChatOptions.builder()
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .build();

            return chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .options(options)
                    .call()
                    .content();

        } catch (NonTransientAiException e) {
            throw new NonRetryableProviderException(providerName + " non-transient error: " + safeMsg(e), e);

        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            if (isNonRetryable4xx(code)) {
                throw new NonRetryableProviderException(providerName + " rejected request (HTTP " + code + "): "
                        + safeMsg(e), e);
            }
            throw new ProviderException(providerName + " error (HTTP " + code + "): " + safeMsg(e), e);

        } catch (Exception e) {
            // timeouts, IO, 5xx без статуса
            throw new ProviderException("Ошибка обращения к " + providerName + ": " + safeMsg(e), e);
        }
    }

    /**
     * Определяет, относится ли HTTP статус к non-retryable клиентским ошибкам (4xx), которые не ретраим.
     *
     * @param statusCode HTTP статус-код
     * @return true если ошибка non-retryable (4xx кроме 408/429)
     */
    private boolean isNonRetryable4xx(int statusCode) {
        if (statusCode < 400 || statusCode >= 500) {
            return false;
        }
        return statusCode != 429 && statusCode != 408;
    }

    private String safeMsg(Throwable t) {
        if (t == null) return "unknown";
        String m = t.getMessage();
        if (m == null) return t.getClass().getSimpleName();
        return (m.length() > 200) ? m.substring(0, 200) : m;
    }
}
