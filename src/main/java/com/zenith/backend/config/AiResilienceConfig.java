package com.zenith.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AiResilienceConfig {

    @Bean
    public CircuitBreaker aiCircuitBreaker(ZenithAiProperties aiProperties) {
        ZenithAiProperties.Circuit circuit = aiProperties.getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("ai-gateway", config);
    }

    /**
     * Abandons, but does not interrupt, calls that exceed the timeout; the worker finishes in the background.
     */
    @Bean
    public TimeLimiter aiTimeLimiter(ZenithAiProperties aiProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(aiProperties.getCallTimeoutSeconds()))
                .cancelRunningFuture(false)
                .build();
        return TimeLimiter.of("ai-chat", config);
    }
}
