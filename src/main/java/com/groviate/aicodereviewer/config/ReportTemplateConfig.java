package com.groviate.aicodereviewer.config;

import com.groviate.aicodereviewer.report.template.ExecutiveSummaryTemplate;
import com.groviate.aicodereviewer.report.template.PerformanceReportTemplate;
import com.groviate.aicodereviewer.report.template.SecurityAuditTemplate;
import com.groviate.aicodereviewer.report.template.TemplateRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Реестр шаблонов отчётов со стандартными шаблонами
 */
@Configuration
@Slf4j
public class ReportTemplateConfig {

    @Bean
    public TemplateRegistry templateRegistry() {
        TemplateRegistry registry = new TemplateRegistry();
        registry.register(new ExecutiveSummaryTemplate());
        registry.register(new SecurityAuditTemplate());
        registry.register(new PerformanceReportTemplate());

        log.info("Шаблоны отчётов зарегистрированы: {}", registry.list().size());
        return registry;
    }
}
