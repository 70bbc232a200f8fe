package io.cronpulse.core.worker;

import io.cronpulse.core.job.ExecutionOutcome;
import io.cronpulse.core.job.Job;
import io.cronpulse.core.job.JobStore;
import io.cronpulse.core.probe.ProbeExecutor;
import io.cronpulse.core.probe.ProbeFailure;
import io.cronpulse.core.reconcile.Reconciler;
import io.cronpulse.core.schedule.TimerSet;
import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root of the scheduling engine: owns the timer set, drives reconciliation on a fixed cadence
 * and turns every timer fire into a probe followed by an outcome write.
 *
 * <p>Fires are fire-and-forget. Probes run on their own pool, so a slow endpoint delays neither other jobs
 * nor the next reconcile tick. Successive fires of the same job may overlap unless
 * {@link WorkerSettings#singleFlight()} is set, in which case a fire is skipped while the previous probe
 * of that job is still running.
 */
public final class CronWorker implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CronWorker.class);

    private final JobStore store;
    private final ProbeExecutor probe;
    private final WorkerSettings settings;
    private final ScheduledThreadPoolExecutor timerScheduler;
    private final ScheduledExecutorService reconcileScheduler;
    private final ExecutorService executions;
    private final TimerSet timers;
    private final Reconciler reconciler;
    private final Set<Long> inFlight = new HashSet<>();
    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.CREATED);
    private ScheduledFuture<?> reconcileTask;
    private volatile boolean abandoned;

    public CronWorker(JobStore store, ProbeExecutor probe, WorkerSettings settings) {
        this(store, probe, settings, Clock.systemUTC());
    }

    public CronWorker(JobStore store, ProbeExecutor probe, WorkerSettings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.timerScheduler = new ScheduledThreadPoolExecutor(settings.timerThreads(), threads("cronpulse-timer"));
        this.timerScheduler.setRemoveOnCancelPolicy(true);
        this.reconcileScheduler = Executors.newSingleThreadScheduledExecutor(threads("cronpulse-reconcile"));
        this.executions = Executors.newCachedThreadPool(threads("cronpulse-probe"));
        this.timers = new TimerSet(timerScheduler, clock, settings.zone(), this::dispatch);
        this.reconciler = new Reconciler(store, timers, settings.refreshOnChange());
    }

    public void start() {
        if (!state.compareAndSet(WorkerState.CREATED, WorkerState.RUNNING)) {
            throw new IllegalStateException("Worker cannot start from state " + state.get());
        }
        LOG.info("[------------ Starting cron worker ------------]");
        LOG.info("Reconcile every {}s, probe timeout {}s, zone {}, singleFlight={}, refreshOnChange={}",
            settings.reconcileInterval().toSeconds(),
            settings.probeTimeout().toSeconds(),
            settings.zone(),
            settings.singleFlight(),
            settings.refreshOnChange());

        reconciler.tick();
        long intervalMs = settings.reconcileInterval().toMillis();
        synchronized (this) {
            if (state.get() == WorkerState.RUNNING) {
                reconcileTask = reconcileScheduler.scheduleAtFixedRate(
                    reconciler::tick,
                    intervalMs,
                    intervalMs,
                    TimeUnit.MILLISECONDS
                );
            }
        }
        LOG.info("Cron worker started with {} scheduled jobs", timers.size());
    }

    // Idempotent, safe before start and from a shutdown hook; never throws.
    public void stop() {
        WorkerState previous = state.getAndSet(WorkerState.STOPPED);
        if (previous == WorkerState.STOPPED) {
            return;
        }
        LOG.info("[------------ Stopping cron worker ------------]");
        try {
            synchronized (this) {
                if (reconcileTask != null) {
                    reconcileTask.cancel(false);
                }
            }
            reconcileScheduler.shutdown();
            int stopped = reconciler.stopAll();
            timerScheduler.shutdownNow();
            LOG.info("Stopped {} timers", stopped);
            drain();
        } catch (RuntimeException e) {
            LOG.error("Error while stopping cron worker", e);
        }
        LOG.info("[------------ Cron worker stopped ------------]");
    }

    @Override
    public void close() {
        stop();
    }

    public WorkerState state() {
        return state.get();
    }

    public Set<Long> scheduledJobIds() {
        return timers.keys();
    }

    public void reconcileNow() {
        if (state.get() == WorkerState.RUNNING) {
            reconciler.tick();
        }
    }

    // Runs on a timer thread while the timer's lock is held; must only hand off.
    private void dispatch(Job job) {
        if (state.get() != WorkerState.RUNNING) {
            return;
        }
        if (settings.singleFlight() && !acquire(job.id())) {
            LOG.warn("Skipping fire of job {}: previous probe still running", job.id());
            return;
        }
        try {
            executions.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            release(job.id());
            LOG.debug("Probe pool rejected job {}: {}", job.id(), e.getMessage());
        }
    }

    private void run(Job job) {
        try {
            ExecutionOutcome outcome = probe.execute(job);
            if (interrupted(outcome)) {
                LOG.warn("Discarding outcome of job {}: probe was interrupted by shutdown", job.id());
                return;
            }
            if (outcome.failed()) {
                LOG.info("Job {} \"{}\" failed: {} after {}ms", job.id(), job.name(), outcome.errorMessage(),
                    outcome.responseTimeMs());
            } else {
                LOG.info("Job {} \"{}\": {} in {}ms", job.id(), job.name(), outcome.status(), outcome.responseTimeMs());
            }
            record(outcome);
        } catch (RuntimeException e) {
            LOG.error("Probe of job {} raised an unexpected error", job.id(), e);
        } finally {
            release(job.id());
        }
    }

    // A probe cut short by shutdownNow() did not observe the endpoint; its outcome is not a result.
    private boolean interrupted(ExecutionOutcome outcome) {
        return abandoned
            || Thread.currentThread().isInterrupted()
            || ProbeFailure.ABORTED.code().equals(outcome.errorMessage());
    }

    private void record(ExecutionOutcome outcome) {
        try {
            store.appendOutcome(outcome);
        } catch (IOException e) {
            LOG.warn("Dropping outcome of job {}: {}", outcome.jobId(), e.getMessage());
        }
    }

    private boolean acquire(long jobId) {
        synchronized (inFlight) {
            return inFlight.add(jobId);
        }
    }

    private void release(long jobId) {
        if (!settings.singleFlight()) {
            return;
        }
        synchronized (inFlight) {
            inFlight.remove(jobId);
        }
    }

    private void drain() {
        executions.shutdown();
        try {
            if (!executions.awaitTermination(settings.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("In-flight probes did not finish within {}s, interrupting",
                    settings.drainTimeout().toSeconds());
                abandoned = true;
                executions.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandoned = true;
            executions.shutdownNow();
            LOG.warn("Interrupted while draining in-flight probes");
        }
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
