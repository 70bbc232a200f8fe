package io.cronpulse.core.schedule;

import io.cronpulse.core.job.Job;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one live periodic trigger per job id. Each trigger re-arms itself on the shared scheduler after
 * every fire and hands the job snapshot to the fire callback, which must return quickly.
 *
 * <p>Once {@link #remove(long)} returns, the removed trigger will not invoke the callback again.
 */
public final class TimerSet {
    private static final Logger LOG = LoggerFactory.getLogger(TimerSet.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ZoneId zone;
    private final Consumer<Job> onFire;
    private final Map<Long, Timer> timers = new LinkedHashMap<>();

    public TimerSet(ScheduledExecutorService scheduler, Clock clock, ZoneId zone, Consumer<Job> onFire) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.onFire = Objects.requireNonNull(onFire, "onFire must not be null");
    }

    // The set is unchanged when the schedule does not parse.
    public synchronized boolean add(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (timers.containsKey(job.id())) {
            return false;
        }
        CronSchedule schedule = CronSchedule.parse(job.schedule(), zone);
        Timer timer = new Timer(job, schedule);
        timers.put(job.id(), timer);
        timer.arm(clock.instant());
        LOG.info("Scheduled job {}: \"{}\" -> {} ({})", job.id(), job.name(), job.url(), schedule);
        return true;
    }

    public synchronized boolean remove(long jobId) {
        Timer timer = timers.remove(jobId);
        if (timer == null) {
            return false;
        }
        timer.stop();
        LOG.info("Removed job {}", jobId);
        return true;
    }

    public synchronized int clear() {
        int count = timers.size();
        for (Timer timer : timers.values()) {
            timer.stop();
        }
        timers.clear();
        return count;
    }

    public synchronized boolean has(long jobId) {
        return timers.containsKey(jobId);
    }

    public synchronized Set<Long> keys() {
        return Set.copyOf(timers.keySet());
    }

    public synchronized Optional<Job> scheduled(long jobId) {
        Timer timer = timers.get(jobId);
        return timer == null ? Optional.empty() : Optional.of(timer.job);
    }

    public synchronized int size() {
        return timers.size();
    }

    private final class Timer {
        private final Job job;
        private final CronSchedule schedule;
        private ScheduledFuture<?> future;
        private boolean stopped;

        private Timer(Job job, CronSchedule schedule) {
            this.job = job;
            this.schedule = schedule;
        }

        private synchronized void arm(Instant from) {
            if (stopped) {
                return;
            }
            Optional<Instant> next = schedule.next(from);
            if (next.isEmpty()) {
                LOG.warn("Job {} has no future fire time for {}", job.id(), schedule);
                return;
            }
            Instant fireAt = next.get();
            long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
            try {
                future = scheduler.schedule(() -> fire(fireAt), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.debug("Scheduler rejected next fire of job {}: {}", job.id(), e.getMessage());
            }
        }

        // Holding the lock across the callback makes stop() wait for a fire already in progress.
        private synchronized void fire(Instant scheduledAt) {
            if (stopped) {
                return;
            }
            try {
                onFire.accept(job);
            } catch (RuntimeException e) {
                LOG.warn("Fire callback failed for job {}", job.id(), e);
            }
            Instant now = clock.instant();
            arm(now.isAfter(scheduledAt) ? now : scheduledAt);
        }

        private synchronized void stop() {
            stopped = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
