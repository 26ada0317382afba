package io.cronqueue4j.core;

/**
 * Result of canceling a job.
 *
 * modified : number of jobs modified (due time cleared)
 * deleted  : number of jobs deleted
 */
public record CancelResult(
        long modified,
        long deleted
) {

    public static CancelResult empty() {
        return new CancelResult(0, 0);
    }

    public boolean hasEffect() {
        return modified > 0 || deleted > 0;
    }
}
