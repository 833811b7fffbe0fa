package com.groviate.aicodereviewer.provider;

import com.groviate.aicodereviewer.model.ReviewRequest;
import com.groviate.aicodereviewer.model.ReviewResponse;

/**
 * Единый контракт над AI-бэкендом, который выполняет ревью одного файла.
 * <p>
 * Экземпляр используется одновременно из нескольких потоков оркестратора,
 * поэтому реализации не должны хранить изменяемое состояние между вызовами.
 */
public interface ReviewProvider {

    /**
     * Выполняет ревью файла.
     *
     * @param request запрос (проверяется через {@link ReviewRequest#validate()} до обращения к бэкенду)
     * @return разобранный ответ модели
     * @throws com.groviate.aicodereviewer.exception.ProviderException невалидный запрос или ошибка бэкенда
     * @throws com.groviate.aicodereviewer.exception.ReviewException   ответ модели не удалось разобрать
     */
    ReviewResponse generateReview(ReviewRequest request);

    /**
     * Дешёвая проверка доступности бэкенда и валидности ключа. Никогда не бросает исключений.
     *
     * @return true если провайдер готов к работе
     */
    boolean validateConfiguration();

    /**
     * @return размер контекстного окна модели в токенах
     */
    int getTokenLimit();

    /**
     * Быстрая оценка количества токенов без обращения к сети. Монотонна по длине текста.
     */
    int estimateTokens(String text);

    /**
     * @return стабильный идентификатор провайдера в нижнем регистре (openai, anthropic)
     */
    String getProviderName();
}
