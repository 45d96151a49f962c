package com.emtech.scan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by the scan pipeline. Page work and engine calls run on separate pools so a
 * page worker waiting on its two engine calls can never starve them.
 */
@Configuration
public class ExecutorConfiguration {

    @Bean
    public ThreadPoolTaskExecutor pageExecutor(ScanProperties properties) {
        int workers = properties.pipeline().effectivePageWorkers();
        return build("page-", workers);
    }

    @Bean
    public ThreadPoolTaskExecutor engineExecutor(ScanProperties properties) {
        int workers = properties.pipeline().effectiveEngineWorkers();
        return build("ocr-", workers);
    }

    @Bean
    public ThreadPoolTaskExecutor scanExecutor(ScanProperties properties) {
        return build("scan-", Math.max(1, properties.pipeline().scanWorkers()));
    }

    static ThreadPoolTaskExecutor build(String prefix, int workers) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
