package com.groviate.aicodereviewer.provider;

import java.util.Map;

/**
 * Фабрика конкретного провайдера, регистрируется в {@link ProviderRegistry} под именем.
 */
@FunctionalInterface
public interface ProviderConstructor {

    ReviewProvider create(String apiKey, Map<String, Object> config);
}
