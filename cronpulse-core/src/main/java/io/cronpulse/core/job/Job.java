package io.cronpulse.core.job;

import java.time.Instant;

public record Job(
    long id,
    String name,
    String url,
    String schedule,
    boolean enabled,
    long userId,
    Instant createdAt
) {
    public Job {
        name = name == null ? "" : name.trim();
        url = url == null ? "" : url.trim();
        schedule = schedule == null ? "" : schedule.trim();
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    // Parts of the job a live timer depends on.
    public String fingerprint() {
        return schedule + "|" + url;
    }
}
