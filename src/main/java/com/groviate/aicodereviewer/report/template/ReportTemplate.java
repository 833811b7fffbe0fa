package com.groviate.aicodereviewer.report.template;

import com.groviate.aicodereviewer.report.ReportSection;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Именованный переиспользуемый способ отрисовки ревью.
 * <p>
 * {@link #render(Map)} вызывается только после того, как {@link #validateContext(Map)}
 * подтвердил наличие всех обязательных переменных.
 */
public abstract class ReportTemplate {

    public static final String REVIEW = "review";
    public static final String FILE_PATH = "file_path";
    public static final String REVIEW_TYPE = "review_type";
    public static final String INCLUDE_CODE = "include_code";
    public static final String INCLUDE_METRICS = "include_metrics";
    public static final String GENERATED_AT = "generated_at";

    public abstract String getTemplateId();

    public abstract String getName();

    public abstract String getDescription();

    public abstract Map<String, TemplateVariable> getVariables();

    public abstract List<ReportSection> render(Map<String, Object> context);

    /**
     * @return true если все обязательные переменные присутствуют и не null
     */
    public boolean validateContext(Map<String, Object> context) {
        if (context == null) {
            return false;
        }
        return getVariables().values().stream()
                .filter(TemplateVariable::isRequired)
                .allMatch(v -> context.get(v.getName()) != null);
    }

    /**
     * Дополняет контекст значениями по умолчанию для необязательных переменных
     */
    protected Map<String, Object> withDefaults(Map<String, Object> context) {
        Map<String, Object> resolved = new HashMap<>(context);
        getVariables().values().forEach(v -> {
            if (resolved.get(v.getName()) == null && v.getDefaultValue() != null) {
                resolved.put(v.getName(), v.getDefaultValue());
            }
        });
        return resolved;
    }

    protected static LocalDate reportDate(Map<String, Object> context) {
        Object generatedAt = context.get(GENERATED_AT);
        Instant instant = generatedAt instanceof Instant i ? i : Instant.now();
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    protected static boolean flag(Map<String, Object> context, String name) {
        return Boolean.TRUE.equals(context.get(name));
    }
}
