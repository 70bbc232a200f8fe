package io.cronpulse.core.job;

public record ExecutionOutcome(
    long jobId,
    long userId,
    int status,
    long responseTimeMs,
    String errorMessage
) {
    public static final int TRANSPORT_FAILURE = 0;

    public ExecutionOutcome {
        responseTimeMs = Math.max(0, responseTimeMs);
        if (errorMessage != null && errorMessage.isBlank()) {
            errorMessage = null;
        }
    }

    public static ExecutionOutcome success(Job job, int status, long responseTimeMs) {
        return new ExecutionOutcome(job.id(), job.userId(), status, responseTimeMs, null);
    }

    public static ExecutionOutcome failure(Job job, String errorCode, long responseTimeMs) {
        return new ExecutionOutcome(job.id(), job.userId(), TRANSPORT_FAILURE, responseTimeMs, errorCode);
    }

    public boolean failed() {
        return status == TRANSPORT_FAILURE;
    }
}
