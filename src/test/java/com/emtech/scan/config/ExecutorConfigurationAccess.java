package com.emtech.scan.config;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Exposes the executor factory to tests in other packages.
 */
public final class ExecutorConfigurationAccess {

    private ExecutorConfigurationAccess() {
    }

    public static ThreadPoolTaskExecutor executor(String prefix, int workers) {
        return ExecutorConfiguration.build(prefix, workers);
    }
}
