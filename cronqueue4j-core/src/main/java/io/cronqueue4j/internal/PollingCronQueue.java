package io.cronqueue4j.internal;

import io.cronqueue4j.CronQueue;
import io.cronqueue4j.JobBuilder;
import io.cronqueue4j.config.SchedulerConfig;
import io.cronqueue4j.core.CancelMode;
import io.cronqueue4j.core.CancelResult;
import io.cronqueue4j.core.JobAccessor;
import io.cronqueue4j.core.JobSpec;
import io.cronqueue4j.core.SchedulerException;
import io.cronqueue4j.core.SchedulerState;
import io.cronqueue4j.cron.CronExpressionEngine;
import io.cronqueue4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CronQueue is a store-agnostic job scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-time jobs (due at a specific Instant)</li>
 *   <li>Recurring jobs (cron expression, optionally bounded by repeatUntil)</li>
 *   <li>Distributed-safe execution via transactional claim/lock</li>
 * </ul>
 *
 * <p>A single ticker thread runs one tick at a time: claim one due job, hand it to {@code onNewJob},
 * reschedule it, then schedule the next tick. A tick that finds nothing waits {@code idleDelay}
 * extra. Failures go to {@code onError} and never end the loop.
 *
 * <p>Typical usage:
 * <pre>{@code
 * CronQueue<CronJob> queue = new PollingCronQueue<>(config, store, CronJob.ACCESSOR, new QuartzCronExpressionEngine());
 * queue.start();
 *
 * queue.schedule(Instant.parse("2026-01-20T09:30:00Z")).save();
 * queue.every("0 0 * * * *", JobBuilder.RepeatOptions.defaults());
 *
 * queue.stop();
 * }</pre>
 */
public class PollingCronQueue<J> implements CronQueue<J> {
    private static final Logger log = LoggerFactory.getLogger(PollingCronQueue.class);

    private final SchedulerConfig<J> config;
    private final JobStore<J> jobStore;
    private final JobAccessor<J> accessor;
    private final CronExpressionEngine cronEngine;
    private final LockAcquirer<J> lockAcquirer;
    private final Rescheduler<J> rescheduler;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.stopped());

    // guarded by this
    private ScheduledExecutorService ticker;
    private ScheduledFuture<?> pendingTick;
    private boolean ticking;
    private CompletableFuture<Void> drained;

    private volatile Thread tickThread;

    public PollingCronQueue(SchedulerConfig<J> config, JobStore<J> jobStore, JobAccessor<J> accessor, CronExpressionEngine cronEngine) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");

        IntervalCalculator<J> intervalCalculator = new IntervalCalculator<>(
                accessor, cronEngine, config.getReprocessDelay(), config.getClock());
        this.lockAcquirer = new LockAcquirer<>(jobStore, accessor, config.getLockDuration(), config.getClock());
        this.rescheduler = new Rescheduler<>(jobStore, accessor, intervalCalculator);
    }

    /**
     * Start polling. Idempotent; the first tick runs on the ticker thread after {@code nextDelay}.
     *
     * @throws SchedulerException    if the {@code onStart} hook fails (the queue stays stopped)
     * @throws IllegalStateException if a previous {@link #stop()} is still draining
     */
    @Override
    public void start() {
        synchronized (this) {
            if (state.get().running()) {
                return;
            }
            if (drained != null && !drained.isDone()) {
                throw new IllegalStateException("CronQueue is still stopping");
            }
            state.set(state.get().start());
            drained = new CompletableFuture<>();
            ticker = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setName("cronqueue.ticker");
                t.setDaemon(true);
                return t;
            });
        }

        log.info("CronQueue starting with nextDelay={}, idleDelay={}, lockDuration={}, reprocessDelay={}",
                config.getNextDelay(),
                config.getIdleDelay(),
                config.getLockDuration(),
                config.getReprocessDelay());

        try {
            config.getOnStart().run();
        } catch (Exception e) {
            synchronized (this) {
                state.set(SchedulerState.stopped());
                if (ticker != null) {
                    ticker.shutdownNow();
                    ticker = null;
                }
                drained.complete(null);
            }
            throw new SchedulerException("CronQueue onStart hook failed", e);
        }

        synchronized (this) {
            // stop() may have been called while onStart was running
            if (state.get().running()) {
                scheduleTick(config.getNextDelay());
            }
        }
        log.info("CronQueue started successfully.");
    }

    /**
     * Stop polling. Blocks until the in-flight tick (if any) has finished, then runs {@code onStop}.
     * A callback that never returns blocks this method indefinitely. Idempotent.
     *
     * <p>When called from a hook running on the ticker thread, returns immediately and {@code onStop}
     * runs once the current tick completes.
     */
    @Override
    public void stop() {
        CompletableFuture<Void> waitFor;
        ScheduledExecutorService stoppedTicker;
        boolean drainNow = false;
        boolean fromTickThread;

        synchronized (this) {
            SchedulerState current = state.get();
            if (!current.running()) {
                return;
            }
            state.set(current.stop());
            waitFor = drained;
            stoppedTicker = ticker;
            ticker = null;
            fromTickThread = Thread.currentThread() == tickThread;

            if (!ticking) {
                if (pendingTick != null) {
                    pendingTick.cancel(false);
                    pendingTick = null;
                }
                drainNow = true;
            }
        }

        log.info("CronQueue stopping...");

        if (drainNow) {
            waitFor.complete(null);
        }

        if (fromTickThread) {
            waitFor.thenRun(() -> finishStop(stoppedTicker));
            return;
        }

        waitFor.join();
        finishStop(stoppedTicker);
    }

    @Override
    public boolean isRunning() {
        return state.get().running();
    }

    @Override
    public boolean isProcessing() {
        return state.get().processing();
    }

    @Override
    public boolean isIdle() {
        return state.get().idle();
    }

    /**
     * Current loop state, for diagnostics.
     */
    public SchedulerState state() {
        return state.get();
    }

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    @Override
    public JobBuilder<J> create() {
        return new SimpleJobBuilder<>(cronEngine, config.getClock(), this::persist);
    }

    @Override
    public JobBuilder<J> schedule(Instant time) {
        return this.create()
                .schedule(time);
    }

    @Override
    public J now() {
        return this.create()
                .schedule(config.getClock().instant())
                .save();
    }

    @Override
    public J every(String cron, JobBuilder.RepeatOptions options) {
        JobBuilder<J> b = this.create();
        if (options != null) {
            b.repeatEvery(cron, options);
        } else {
            b.repeatEvery(cron);
        }
        return b.save();
    }

    @Override
    public CancelResult cancel(String id, CancelMode mode) {
        Objects.requireNonNull(id, "id must not be null");
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }

        return switch (mode) {
            case DISABLE -> new CancelResult(jobStore.updateDueAt(id, null), 0);
            case DELETE -> new CancelResult(0, jobStore.deleteById(id));
        };
    }

    private J persist(JobSpec spec) {
        J job = accessor.newInstance();
        accessor.setDueAt(job, spec.dueAt());
        accessor.setInterval(job, spec.interval());
        accessor.setRepeatUntil(job, spec.repeatUntil());
        accessor.setAutoRemove(job, spec.autoRemove());
        return jobStore.insert(job);
    }

    private void scheduleTick(Duration delay) {
        // a tick only acts for the run that scheduled it
        CompletableFuture<Void> drainSignal = drained;
        pendingTick = ticker.schedule(() -> tick(drainSignal), delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void tick(CompletableFuture<Void> drainSignal) {
        boolean running;
        synchronized (this) {
            running = state.get().running() && drainSignal == drained;
            if (running) {
                pendingTick = null;
                ticking = true;
                tickThread = Thread.currentThread();
            }
        }
        if (!running) {
            drainSignal.complete(null);
            return;
        }

        Duration extraDelay = Duration.ZERO;
        try {
            extraDelay = processNext();
        } catch (Error e) {
            log.error("cronqueue tick failed msg={}", e.getMessage(), e);
            throw e;
        } finally {
            boolean stopped;
            synchronized (this) {
                ticking = false;
                tickThread = null;
                stopped = !state.get().running() || drainSignal != drained;
                if (!stopped) {
                    scheduleTick(config.getNextDelay().plus(extraDelay));
                }
            }
            if (stopped) {
                drainSignal.complete(null);
            }
        }
    }

    /**
     * Claims and processes at most one job.
     *
     * @return extra delay before the next tick, {@code idleDelay} only when nothing was due
     */
    private Duration processNext() {
        state.updateAndGet(SchedulerState::beginProcessing);
        try {
            Optional<J> claimed = lockAcquirer.claim();

            if (claimed.isEmpty()) {
                SchedulerState previous = state.getAndUpdate(SchedulerState::noJobFound);
                if (!previous.idle()) {
                    log.debug("cronqueue idle, no due jobs");
                    config.getOnIdle().run();
                }
                return config.getIdleDelay();
            }

            state.updateAndGet(SchedulerState::jobFound);
            J job = claimed.get();

            log.debug("cronqueue job started id={}", accessor.getId(job));
            config.getOnNewJob().execute(job);
            rescheduler.reschedule(job);
            log.debug("cronqueue job finished id={}", accessor.getId(job));
            return Duration.ZERO;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            handleError(e);
            return Duration.ZERO;
        } finally {
            state.updateAndGet(SchedulerState::endProcessing);
        }
    }

    private void handleError(Throwable error) {
        try {
            config.getOnError().handle(error);
        } catch (Exception hookError) {
            log.error("cronqueue onError hook failed msg={}", hookError.getMessage(), hookError);
        }
    }

    private void finishStop(ScheduledExecutorService stoppedTicker) {
        if (stoppedTicker != null) {
            stoppedTicker.shutdown();
        }
        try {
            config.getOnStop().run();
        } catch (Exception e) {
            handleError(e);
        }
        log.info("CronQueue stopped successfully.");
    }
}
