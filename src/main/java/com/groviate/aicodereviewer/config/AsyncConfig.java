package com.groviate.aicodereviewer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Конфигурирует пул потоков для параллельного ревью файлов.
 * <p>
 * Реальное число одновременных обращений к провайдеру ограничивает семафор оркестратора
 * (max-concurrent), пул лишь должен быть не меньше этого лимита.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "reviewExecutor")
    public Executor reviewExecutor(CodeReviewProperties props) {
        int threads = Math.max(4, props.getMaxConcurrent());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(threads);
        ex.setMaxPoolSize(threads);
        ex.setQueueCapacity(1000); // пакет держит в пуле не больше max-concurrent задач
        ex.setThreadNamePrefix("file-review-");
        ex.initialize();
        return ex;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
