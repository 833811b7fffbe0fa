package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.service.PromptTemplateService;

/**
 * Ревью через Anthropic Messages API (Spring AI Anthropic).
 */
public class AnthropicReviewProvider extends AbstractChatReviewProvider {

    public static final String NAME = "anthropic";
    public static final String DEFAULT_MODEL = "claude-3-5-sonnet-latest";

    private static final int TOKEN_LIMIT = 200_000;

    public AnthropicReviewProvider(AiChatGateway gateway,
                                   PromptTemplateService prompts,
                                   ReviewResponseParser parser,
                                   String model,
                                   Double temperature,
                                   Integer maxTokens) {
        super(gateway, prompts, parser, model != null ? model : DEFAULT_MODEL, temperature, maxTokens);
    }

    @Override
    public int getTokenLimit() {
        return TOKEN_LIMIT;
    }

    @Override
    public String getProviderName() {
        return NAME;
    }
}
