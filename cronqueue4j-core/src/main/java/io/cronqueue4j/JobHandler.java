package io.cronqueue4j;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Callback invoked with the pre-lock snapshot of each claimed job.
 */
@FunctionalInterface
public interface JobHandler<J> {

    void execute(J job) throws Exception;

    static <J> JobHandler<J> noop() {
        return job -> {
        };
    }

    /**
     * Adapts an asynchronous callback; the returned stage is awaited before the job is rescheduled.
     */
    static <J> JobHandler<J> async(Function<? super J, ? extends CompletionStage<?>> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        return job -> {
            try {
                callback.apply(job).toCompletableFuture().join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        };
    }
}
