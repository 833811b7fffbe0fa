package com.groviate.aicodereviewer.report.template;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реестр шаблонов отчётов: id -> шаблон.
 * Создаётся и заполняется один раз при старте (см. ReportTemplateConfig).
 */
@Slf4j
public class TemplateRegistry {

    private final Map<String, ReportTemplate> templates = new ConcurrentHashMap<>();

    public void register(ReportTemplate template) {
        ReportTemplate previous = templates.put(template.getTemplateId(), template);
        if (previous != null) {
            log.info("Шаблон отчёта '{}' переопределён", template.getTemplateId());
        }
    }

    public Optional<ReportTemplate> get(String templateId) {
        return templateId == null ? Optional.empty() : Optional.ofNullable(templates.get(templateId));
    }

    /**
     * @return шаблоны, отсортированные по id
     */
    public List<ReportTemplate> list() {
        List<ReportTemplate> all = new ArrayList<>(templates.values());
        all.sort((a, b) -> a.getTemplateId().compareTo(b.getTemplateId()));
        return all;
    }

    /**
     * Описание шаблона и его переменных (для справки/API)
     */
    public Optional<Map<String, Object>> getTemplateInfo(String templateId) {
        return get(templateId).map(t -> {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("id", t.getTemplateId());
            info.put("name", t.getName());
            info.put("description", t.getDescription());

            Map<String, Object> variables = new LinkedHashMap<>();
            t.getVariables().forEach((name, v) -> {
                Map<String, Object> var = new LinkedHashMap<>();
                var.put("description", v.getDescription());
                var.put("required", v.isRequired());
                var.put("default", v.getDefaultValue());
                variables.put(name, var);
            });
            info.put("variables", variables);
            return info;
        });
    }
}
