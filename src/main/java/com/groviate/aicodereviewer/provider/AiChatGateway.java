package com.groviate.aicodereviewer.provider;

/**
 * Тонкий слой над ChatClient.
 */
public interface AiChatGateway {

    /**
     * @param temperature температура генерации (null - значение модели по умолчанию)
     * @param maxTokens   лимит токенов ответа (null - значение модели по умолчанию)
     */
    String ask(String systemPrompt, String userPrompt, Double temperature, Integer maxTokens);
}
