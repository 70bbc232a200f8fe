package io.cronpulse.core.probe;

import io.cronpulse.core.job.ExecutionOutcome;
import io.cronpulse.core.job.Job;

@FunctionalInterface
public interface ProbeExecutor {
    ExecutionOutcome execute(Job job);
}
