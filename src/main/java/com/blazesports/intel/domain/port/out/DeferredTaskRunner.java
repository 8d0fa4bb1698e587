package com.blazesports.intel.domain.port.out;

/**
 * Runs work after the current request has been answered.
 */
public interface DeferredTaskRunner {

    /**
     * Schedule a task without waiting for it.
     *
     * @param description short label used when logging the task's outcome
     * @param task work to run; its failures are contained by the runner
     * @return false when nothing could be scheduled (no executor, shut down or saturated)
     */
    boolean defer(String description, Runnable task);

    /**
     * Runner for contexts without background execution; every task is dropped.
     */
    static DeferredTaskRunner unavailable() {
        return (description, task) -> false;
    }
}
