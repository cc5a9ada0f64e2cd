package com.zenith.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final ZenithAiProperties aiProperties;

    /**
     * Fixed-size pool for blocking calls to the AI gateway, so slow replies cannot starve request threads.
     */
    @Bean(name = "aiExecutor")
    public Executor aiExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiProperties.getWorkers());
        executor.setMaxPoolSize(aiProperties.getWorkers());
        executor.setQueueCapacity(aiProperties.getQueueCapacity());
        executor.setThreadNamePrefix("ai-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
