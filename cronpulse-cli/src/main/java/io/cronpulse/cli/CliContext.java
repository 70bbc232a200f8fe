package io.cronpulse.cli;

import io.cronpulse.core.config.ConfigService;
import io.cronpulse.core.job.JobService;
import java.nio.file.Path;
import java.util.function.Supplier;

public record CliContext(
    Supplier<JobService> jobServiceSupplier,
    ConfigService configService,
    Path configPath,
    WorkerRunner workerRunner
) {
    public CliContext(Supplier<JobService> jobServiceSupplier, ConfigService configService, Path configPath) {
        this(jobServiceSupplier, configService, configPath, () -> {
            throw new UnsupportedOperationException("worker runner is not configured");
        });
    }

    public CliContext(JobService jobService, ConfigService configService, Path configPath, WorkerRunner workerRunner) {
        this(() -> jobService, configService, configPath, workerRunner);
    }

    public CliContext(JobService jobService, ConfigService configService, Path configPath) {
        this(() -> jobService, configService, configPath);
    }

    // Resolved per call so that commands which never touch jobs never open the database.
    public JobService jobService() {
        return jobServiceSupplier.get();
    }
}
