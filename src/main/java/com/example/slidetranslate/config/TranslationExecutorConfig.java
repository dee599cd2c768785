package com.example.slidetranslate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for backend calls. Only the network round trips run here; documents
 * are mutated on the thread that owns them.
 */
@Configuration
public class TranslationExecutorConfig {

    @Bean(name = "translationExecutor")
    public ThreadPoolTaskExecutor translationExecutor(TranslationSettings settings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getMaxParallelRequests());
        executor.setMaxPoolSize(settings.getMaxParallelRequests());
        executor.setThreadNamePrefix("translate-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
