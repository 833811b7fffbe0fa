package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.service.PromptTemplateService;

/**
 * Ревью через OpenAI Chat Completions (Spring AI OpenAI).
 */
public class OpenAiReviewProvider extends AbstractChatReviewProvider {

    public static final String NAME = "openai";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private static final int TOKEN_LIMIT = 128_000;

    public OpenAiReviewProvider(AiChatGateway gateway,
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
