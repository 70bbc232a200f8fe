package io.cronpulse.core.job;

public record JobSummary(
    Job job,
    long executionCount,
    Integer lastStatus
) {
}
