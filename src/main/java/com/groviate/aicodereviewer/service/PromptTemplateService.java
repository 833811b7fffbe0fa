package com.groviate.aicodereviewer.service;

import com.groviate.aicodereviewer.model.CodeContext;
import com.groviate.aicodereviewer.model.ReviewRequest;
import com.groviate.aicodereviewer.model.ReviewSettings;
import com.groviate.aicodereviewer.model.ReviewType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Сервис для подготовки инструкций для AI
 * <p>
 * 1. Взять системный промпт (формат ответа и правила оценки)
 * 2. Подставить в шаблон пользовательского промпта файл, diff и контекст изменения
 * 3. Добавить блок инструкций под выбранный тип ревью и настройки
 * 4. Вернуть готовый промпт для отправки модели
 */
@Service
@Slf4j
public class PromptTemplateService {

    private static final Map<ReviewType, String> TYPE_INSTRUCTIONS = new EnumMap<>(ReviewType.class);

    static {
        TYPE_INSTRUCTIONS.put(ReviewType.FULL, """
                Проведи полное ревью: корректность логики, безопасность, производительность,
                читаемость, стиль, документация и соответствие лучшим практикам.""");
        TYPE_INSTRUCTIONS.put(ReviewType.SECURITY, """
                Сосредоточься на безопасности: инъекции, небезопасная работа с секретами и токенами,
                проверка входных данных, права доступа, криптография, утечки данных в логи.""");
        TYPE_INSTRUCTIONS.put(ReviewType.PERFORMANCE, """
                Сосредоточься на производительности: сложность алгоритмов, лишние аллокации,
                запросы в цикле, блокировки и конкурентность, кэширование, работа с I/O.""");
        TYPE_INSTRUCTIONS.put(ReviewType.MAINTAINABILITY, """
                Сосредоточься на сопровождаемости: размер и связность методов, дублирование,
                именование, разделение ответственности, тестируемость.""");
        TYPE_INSTRUCTIONS.put(ReviewType.STYLE, """
                Сосредоточься на стиле: форматирование, соглашения об именовании, идиомы языка,
                единообразие кода в файле.""");
        TYPE_INSTRUCTIONS.put(ReviewType.DOCUMENTATION, """
                Сосредоточься на документации: комментарии к публичному API, актуальность описаний,
                понятность назначения модулей и неочевидных решений.""");
        TYPE_INSTRUCTIONS.put(ReviewType.QUICK, """
                Быстрый обзор: укажи только критичные ошибки и серьёзные риски, не более 5 замечаний.""");
    }

    @Getter
    private final String systemPrompt;
    private final String userPromptTemplate;

    /**
     * @param systemPromptResource       - Resource с содержимым system-prompt.txt
     * @param userPromptTemplateResource - Resource с содержимым user-prompt.txt
     * @throws IllegalStateException если файлы не найдены в src/main/resources/prompts/
     */
    public PromptTemplateService(
            @Value("classpath:prompts/system-prompt.txt") Resource systemPromptResource,
            @Value("classpath:prompts/user-prompt.txt") Resource userPromptTemplateResource
    ) {
        try {
            this.systemPrompt = systemPromptResource.getContentAsString(StandardCharsets.UTF_8);
            log.info("Системный промпт загружен из файла, размер: {} символов", systemPrompt.length());

            this.userPromptTemplate = userPromptTemplateResource.getContentAsString(StandardCharsets.UTF_8);
            log.info("Шаблон пользовательского промпта загружен, размер: {} символов", userPromptTemplate.length());
        } catch (Exception e) {
            log.error("Не удалось загрузить промпты из файлов", e);
            throw new IllegalStateException("""
                    Не удалось загрузить промпты из resources/prompts/
                    Проверь что существуют файлы:
                    - src/main/resources/prompts/system-prompt.txt
                    - src/main/resources/prompts/user-prompt.txt
                    """, e);
        }
    }

    /**
     * Подготавливает пользовательский промпт для ревью одного файла
     *
     * @param request запрос на ревью (уже провалидирован)
     * @return готовый пользовательский промпт
     */
    public String preparePrompt(ReviewRequest request) {
        CodeContext ctx = request.getCodeContext();
        log.debug("Подготавливаю промпт: file={}, type={}", ctx.getFilePath(), request.getReviewType().getValue());

        String diff = (ctx.getDiff() == null || ctx.getDiff().isBlank()) ? "(diff отсутствует, проверь файл целиком)" : ctx.getDiff();

        return userPromptTemplate
                .replace("{review_type}", request.getReviewType().getValue())
                .replace("{review_instructions}", buildInstructions(request))
                .replace("{settings}", formatSettings(request.getSettings()))
                .replace("{context}", formatContext(ctx))
                .replace("{file_path}", ctx.getFilePath())
                .replace("{language}", ctx.getLanguage() != null ? ctx.getLanguage() : "не указан")
                .replace("{diff}", diff)
                .replace("{code}", ctx.getContent());
    }

    private String buildInstructions(ReviewRequest request) {
        StringBuilder sb = new StringBuilder(TYPE_INSTRUCTIONS.get(request.getReviewType()));

        if (request.getReviewType() != ReviewType.SECURITY && request.isSecuritySensitive()) {
            sb.append("\nКод работает с секретами или доступами: обязательно проверь аспекты безопасности.");
        }
        if (request.getReviewType() != ReviewType.PERFORMANCE && request.isPerformanceCritical()) {
            sb.append("\nКод содержит циклы, запросы или потоки: оцени влияние на производительность.");
        }
        return sb.toString();
    }

    private String formatSettings(ReviewSettings settings) {
        if (settings == null) {
            return "- нет";
        }
        StringBuilder sb = new StringBuilder();
        if (settings.getMaxComments() != null) {
            sb.append("- Не более ").append(settings.getMaxComments()).append(" замечаний\n");
        }
        if (settings.getMinSeverity() != null) {
            sb.append("- Минимальная серьёзность: ").append(settings.getMinSeverity().getValue()).append('\n');
        }
        appendList(sb, "Фокус", settings.getFocusAreas());
        appendList(sb, "Не комментировать", settings.getIgnorePatterns());
        if (settings.getCustomRules() != null && !settings.getCustomRules().isEmpty()) {
            settings.getCustomRules().forEach((k, v) ->
                    sb.append("- Правило ").append(k).append(": ").append(v).append('\n'));
        }
        return sb.length() == 0 ? "- нет" : sb.toString().stripTrailing();
    }

    private String formatContext(CodeContext ctx) {
        StringBuilder sb = new StringBuilder();
        appendLine(sb, "Репозиторий", ctx.getRepository());
        appendLine(sb, "Базовая ветка", ctx.getBaseBranch());
        appendLine(sb, "Коммит", ctx.getCommitHash());
        appendLine(sb, "Автор", ctx.getAuthor());
        appendList(sb, "Другие изменённые файлы", ctx.getChangedFiles());
        return sb.length() == 0 ? "- нет" : sb.toString().stripTrailing();
    }

    private static void appendLine(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append("- ").append(label).append(": ").append(value).append('\n');
        }
    }

    private static void appendList(StringBuilder sb, String label, List<String> values) {
        if (values != null && !values.isEmpty()) {
            sb.append("- ").append(label).append(": ").append(String.join(", ", values)).append('\n');
        }
    }
}
