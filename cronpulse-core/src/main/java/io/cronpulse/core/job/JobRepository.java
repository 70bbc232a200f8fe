package io.cronpulse.core.job;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JobStore {
    Job createJob(long userId, String name, String url, String schedule) throws IOException;

    Optional<Job> findJob(long jobId, long userId) throws IOException;

    List<JobSummary> listJobs(long userId) throws IOException;

    boolean setEnabled(long jobId, long userId, boolean enabled) throws IOException;

    boolean updateJob(long jobId, long userId, String name, String url, String schedule) throws IOException;

    boolean deleteJob(long jobId, long userId) throws IOException;

    List<ExecutionLog> listLogs(long jobId, long userId, int limit) throws IOException;
}
