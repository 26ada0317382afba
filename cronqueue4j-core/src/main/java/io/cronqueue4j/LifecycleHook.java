package io.cronqueue4j;

/**
 * Hook for scheduler lifecycle events (start, stop, idle).
 */
@FunctionalInterface
public interface LifecycleHook {

    LifecycleHook NOOP = () -> {
    };

    void run() throws Exception;
}
