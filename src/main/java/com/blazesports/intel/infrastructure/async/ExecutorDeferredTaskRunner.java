package com.blazesports.intel.infrastructure.async;

import com.blazesports.intel.domain.port.out.DeferredTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;

/**
 * Deferred tasks on the shared {@code asyncExecutor} pool.
 * Tasks are dropped, not queued on the caller, when the pool is missing or saturated.
 */
@Component
public class ExecutorDeferredTaskRunner implements DeferredTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorDeferredTaskRunner.class);

    private final ObjectProvider<TaskExecutor> executorProvider;

    public ExecutorDeferredTaskRunner(@Qualifier("asyncExecutor") ObjectProvider<TaskExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    @Override
    public boolean defer(String description, Runnable task) {
        TaskExecutor executor = executorProvider.getIfAvailable();
        if (executor == null) {
            logger.debug("No executor available, dropping deferred task '{}'", description);
            return false;
        }

        try {
            executor.execute(() -> runContained(description, task));
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Executor rejected deferred task '{}': {}", description, e.getMessage());
            return false;
        }
    }

    private void runContained(String description, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.warn("Deferred task '{}' failed", description, e);
        }
    }
}
