package io.cronpulse.core.reconcile;

import io.cronpulse.core.job.Job;
import io.cronpulse.core.job.JobStore;
import io.cronpulse.core.schedule.InvalidScheduleException;
import io.cronpulse.core.schedule.TimerSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Jobs are compared by id only unless refreshOnChange is set, so an edited job keeps its old timer.
public final class Reconciler {
    private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

    private final JobStore store;
    private final TimerSet timers;
    private final boolean refreshOnChange;

    public Reconciler(JobStore store, TimerSet timers, boolean refreshOnChange) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.timers = Objects.requireNonNull(timers, "timers must not be null");
        this.refreshOnChange = refreshOnChange;
    }

    public synchronized ReconcileResult reconcile() throws IOException {
        Map<Long, Job> enabled = new LinkedHashMap<>();
        for (Job job : store.listEnabledJobs()) {
            enabled.putIfAbsent(job.id(), job);
        }

        List<Long> toRemove = new ArrayList<>();
        for (Long id : timers.keys()) {
            Job current = enabled.get(id);
            if (current == null || (refreshOnChange && changed(id, current))) {
                toRemove.add(id);
            }
        }

        List<Long> removed = new ArrayList<>();
        for (Long id : toRemove) {
            if (timers.remove(id)) {
                removed.add(id);
            }
        }

        List<Long> added = new ArrayList<>();
        List<Long> rejected = new ArrayList<>();
        for (Job job : enabled.values()) {
            if (timers.has(job.id())) {
                continue;
            }
            try {
                if (timers.add(job)) {
                    added.add(job.id());
                }
            } catch (InvalidScheduleException e) {
                rejected.add(job.id());
                LOG.warn("Skipping job {}: {}", job.id(), e.getMessage());
            }
        }

        ReconcileResult result = new ReconcileResult(added, removed, rejected);
        if (result.changed()) {
            LOG.info("Reconciled {} enabled jobs: +{} -{}", enabled.size(), added.size(), removed.size());
        } else {
            LOG.debug("Reconciled {} enabled jobs: no changes", enabled.size());
        }
        return result;
    }

    public Optional<ReconcileResult> tick() {
        try {
            return Optional.of(reconcile());
        } catch (IOException e) {
            LOG.warn("Reconcile failed, retrying next tick: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected reconcile failure", e);
        }
        return Optional.empty();
    }

    public synchronized int stopAll() {
        return timers.clear();
    }

    private boolean changed(long id, Job current) {
        return timers.scheduled(id)
            .map(scheduled -> !scheduled.fingerprint().equals(current.fingerprint()))
            .orElse(false);
    }
}
