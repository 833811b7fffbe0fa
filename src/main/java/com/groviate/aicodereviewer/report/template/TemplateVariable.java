package com.groviate.aicodereviewer.report.template;

import lombok.Builder;
import lombok.Value;

/**
 * Переменная контекста шаблона отчёта
 */
@Value
@Builder
public class TemplateVariable {

    String name;

    String description;

    @Builder.Default
    boolean required = true;

    Object defaultValue; //используется, если необязательная переменная не передана
}
