package com.groviate.aicodereviewer.health;

import com.groviate.aicodereviewer.config.ProviderConfig;
import com.groviate.aicodereviewer.provider.ReviewProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ReviewProviderHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ReviewProvider provider;

    public ReviewProviderHealthIndicator(CircuitBreakerRegistry circuitBreakerRegistry, ReviewProvider provider) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.provider = provider;
    }

    @Override
    public Health health() {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(ProviderConfig.RESILIENCE_INSTANCE);
        CircuitBreaker.State state = cb.getState();

        Health.Builder builder = (state == CircuitBreaker.State.OPEN)
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("provider", provider.getProviderName())
                .withDetail("circuitBreakerState", state.name())
                .withDetail("failureRate", cb.getMetrics().getFailureRate())
                .build();
    }
}
