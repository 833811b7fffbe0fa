package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.exception.ConfigurationException;
import com.groviate.aicodereviewer.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр провайдеров: имя (без учёта регистра) -> конструктор.
 * <p>
 * Заполняется один раз при старте приложения (см. ProviderConfig), дальше используется только на чтение.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderConstructor> constructors = new ConcurrentHashMap<>();

    /**
     * Добавляет или переопределяет провайдера
     *
     * @param name        имя провайдера, регистр не важен
     * @param constructor фабрика экземпляров
     */
    public void register(String name, ProviderConstructor constructor) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Provider name must not be blank");
        }
        if (constructor == null) {
            throw new ConfigurationException("Provider constructor must not be null: " + name);
        }
        ProviderConstructor previous = constructors.put(normalize(name), constructor);
        if (previous != null) {
            log.info("Провайдер '{}' переопределён", normalize(name));
        } else {
            log.debug("Провайдер '{}' зарегистрирован", normalize(name));
        }
    }

    /**
     * Создаёт провайдера по имени
     *
     * @param name   имя провайдера
     * @param apiKey API ключ бэкенда
     * @param config параметры провайдера (model, base-url, temperature, max-tokens)
     * @return новый экземпляр провайдера
     * @throws ConfigurationException пустой API ключ
     * @throws ProviderException      неизвестное имя провайдера
     */
    public ReviewProvider create(String name, String apiKey, Map<String, Object> config) {
        ProviderConstructor constructor = name == null ? null : constructors.get(normalize(name));
        if (constructor == null) {
            throw new ProviderException("Unknown provider: " + name
                    + ". Available providers: " + String.join(", ", availableProviders()));
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("API key is not configured for provider " + normalize(name));
        }

        ReviewProvider provider = constructor.create(apiKey, config == null ? Map.of() : config);
        log.info("Создан AI-провайдер: {}", provider.getProviderName());
        return provider;
    }

    /**
     * @return имена зарегистрированных провайдеров в алфавитном порядке
     */
    public List<String> availableProviders() {
        return constructors.keySet().stream().sorted().toList();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
