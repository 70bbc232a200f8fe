package io.cronpulse.core.job;

import java.time.Instant;

public record ExecutionLog(
    long id,
    long jobId,
    long userId,
    int status,
    long responseTimeMs,
    String errorMessage,
    Instant createdAt
) {
}
