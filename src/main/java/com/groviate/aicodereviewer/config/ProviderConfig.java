package com.groviate.aicodereviewer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.groviate.aicodereviewer.exception.ConfigurationException;
import com.groviate.aicodereviewer.provider.AiChatGateway;
import com.groviate.aicodereviewer.provider.AnthropicReviewProvider;
import com.groviate.aicodereviewer.provider.ChatClientGateway;
import com.groviate.aicodereviewer.provider.OpenAiReviewProvider;
import com.groviate.aicodereviewer.provider.ProviderRegistry;
import com.groviate.aicodereviewer.provider.ReviewProvider;
import com.groviate.aicodereviewer.provider.ReviewResponseParser;
import com.groviate.aicodereviewer.service.PromptTemplateService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.Map;

/**
 * Конфигурация AI-провайдеров.
 * <p>
 * Реестр заполняется один раз при старте, активный провайдер создаётся по настройкам
 * {@code code-review.provider.*}. Ретраи выполняет resilience4j (инстанс {@code ai-provider}),
 * собственный RetryTemplate Spring AI отключён, чтобы попытки не перемножались.
 */
@Configuration
@Slf4j
public class ProviderConfig {

    public static final String RESILIENCE_INSTANCE = "ai-provider";

    @Bean
    public ReviewResponseParser reviewResponseParser(ObjectMapper objectMapper, Clock clock) {
        return new ReviewResponseParser(objectMapper, clock);
    }

    @Bean
    public ProviderRegistry providerRegistry(PromptTemplateService prompts,
                                             ReviewResponseParser parser,
                                             RetryRegistry retryRegistry,
                                             CircuitBreakerRegistry circuitBreakerRegistry,
                                             ObjectProvider<RestClient.Builder> restClientBuilder) {
        ProviderRegistry registry = new ProviderRegistry();

        registry.register(OpenAiReviewProvider.NAME, (apiKey, config) -> {
            String model = stringValue(config, "model", OpenAiReviewProvider.DEFAULT_MODEL);
            Double temperature = doubleValue(config, "temperature");
            Integer maxTokens = intValue(config, "max-tokens");

            OpenAiApi.Builder api = OpenAiApi.builder()
                    .apiKey(apiKey)
                    .restClientBuilder(restClientBuilder.getObject());
            String baseUrl = stringValue(config, "base-url", null);
            if (baseUrl != null) {
                api.baseUrl(baseUrl);
            }

            ChatModel chatModel = OpenAiChatModel.builder()
                    .openAiApi(api.build())
                    .defaultOptions(OpenAiChatOptions.builder()
                            .model(model)
                            .temperature(temperature)
                            .maxTokens(maxTokens)
                            .build())
                    .retryTemplate(singleAttempt())
                    .build();

            AiChatGateway gateway = gateway(OpenAiReviewProvider.NAME, chatModel, retryRegistry, circuitBreakerRegistry);
            return new OpenAiReviewProvider(gateway, prompts, parser, model, temperature, maxTokens);
        });

        registry.register(AnthropicReviewProvider.NAME, (apiKey, config) -> {
            String model = stringValue(config, "model", AnthropicReviewProvider.DEFAULT_MODEL);
            Double temperature = doubleValue(config, "temperature");
            Integer maxTokens = intValue(config, "max-tokens");

            AnthropicApi.Builder api = AnthropicApi.builder()
                    .apiKey(apiKey)
                    .restClientBuilder(restClientBuilder.getObject());
            String baseUrl = stringValue(config, "base-url", null);
            if (baseUrl != null) {
                api.baseUrl(baseUrl);
            }

            ChatModel chatModel = AnthropicChatModel.builder()
                    .anthropicApi(api.build())
                    .defaultOptions(AnthropicChatOptions.builder()
                            .model(model)
                            .temperature(temperature)
                            .maxTokens(maxTokens)
                            .build())
                    .retryTemplate(singleAttempt())
                    .build();

            AiChatGateway gateway = gateway(AnthropicReviewProvider.NAME, chatModel, retryRegistry, circuitBreakerRegistry);
            return new AnthropicReviewProvider(gateway, prompts, parser, model, temperature, maxTokens);
        });

        log.info("AI-провайдеры зарегистрированы: {}", registry.availableProviders());
        return registry;
    }

    @Bean
    public ReviewProvider reviewProvider(ProviderRegistry registry, CodeReviewProperties props) {
        CodeReviewProperties.Provider p = props.getProvider();
        ReviewProvider provider = registry.create(p.getName(), p.getApiKey(), p.toConfig());
        log.info("Активный AI-провайдер: {}", provider.getProviderName());
        return provider;
    }

    private static AiChatGateway gateway(String name,
                                         ChatModel chatModel,
                                         RetryRegistry retryRegistry,
                                         CircuitBreakerRegistry circuitBreakerRegistry) {
        return new ChatClientGateway(name,
                ChatClient.create(chatModel),
                retryRegistry.retry(RESILIENCE_INSTANCE),
                circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE));
    }

    private static RetryTemplate singleAttempt() {
        return RetryTemplate.builder().maxAttempts(1).build();
    }

    private static String stringValue(Map<String, Object> config, String key, String defaultValue) {
        Object value = config.get(key);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString().trim();
    }

    private static Double doubleValue(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Provider option '" + key + "' must be a number: " + value, e);
        }
    }

    private static Integer intValue(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Provider option '" + key + "' must be an integer: " + value, e);
        }
    }
}
