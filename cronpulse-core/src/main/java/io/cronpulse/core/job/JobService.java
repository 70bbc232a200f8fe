package io.cronpulse.core.job;

import io.cronpulse.core.schedule.CronSchedule;
import java.io.IOException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;

public final class JobService {
    public static final int DEFAULT_LOG_LIMIT = 100;

    private final JobRepository repository;
    private final ZoneId zone;

    public JobService(JobRepository repository, ZoneId zone) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public Job create(long userId, String name, String url, String schedule) throws IOException {
        String cleanName = required(name, "name");
        String cleanUrl = validateUrl(url);
        String cleanSchedule = validateSchedule(schedule);
        return repository.createJob(userId, cleanName, cleanUrl, cleanSchedule);
    }

    public List<JobSummary> list(long userId) throws IOException {
        return repository.listJobs(userId);
    }

    public Optional<Job> find(long jobId, long userId) throws IOException {
        return repository.findJob(jobId, userId);
    }

    // Empty when the user owns no such job.
    public Optional<Boolean> toggle(long jobId, long userId) throws IOException {
        Optional<Job> job = repository.findJob(jobId, userId);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        boolean enabled = !job.get().enabled();
        if (!repository.setEnabled(jobId, userId, enabled)) {
            return Optional.empty();
        }
        return Optional.of(enabled);
    }

    public boolean update(long jobId, long userId, String name, String url, String schedule) throws IOException {
        return repository.updateJob(
            jobId,
            userId,
            required(name, "name"),
            validateUrl(url),
            validateSchedule(schedule)
        );
    }

    public boolean delete(long jobId, long userId) throws IOException {
        return repository.deleteJob(jobId, userId);
    }

    public List<ExecutionLog> logs(long jobId, long userId, int limit) throws IOException {
        return repository.listLogs(jobId, userId, limit <= 0 ? DEFAULT_LOG_LIMIT : limit);
    }

    private String validateUrl(String url) {
        String clean = required(url, "url");
        if (HttpUrl.parse(clean) == null) {
            throw new IllegalArgumentException("url must be an absolute http or https URL: " + clean);
        }
        return clean;
    }

    private String validateSchedule(String schedule) {
        return CronSchedule.parse(required(schedule, "schedule"), zone).expression();
    }

    private String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }
}
