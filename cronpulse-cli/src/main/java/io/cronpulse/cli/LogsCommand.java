package io.cronpulse.cli;

import io.cronpulse.core.job.ExecutionLog;
import io.cronpulse.core.job.Job;
import io.cronpulse.core.job.JobService;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "logs", description = "Show recent executions of a job, newest first")
public final class LogsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    @Option(names = {"-n", "--limit"}, description = "Maximum number of entries", defaultValue = "" + JobService.DEFAULT_LOG_LIMIT)
    int limit;

    @Parameters(index = "0", description = "Job id")
    long jobId;

    public LogsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<Job> job = context.jobService().find(jobId, userId);
            if (job.isEmpty()) {
                System.err.println("Job " + jobId + " not found");
                return 1;
            }
            System.out.println("Job " + jobId + ": \"" + job.get().name() + "\" -> " + job.get().url());
            List<ExecutionLog> logs = context.jobService().logs(jobId, userId, limit);
            for (ExecutionLog log : logs) {
                String result = log.status() == 0 ? "ERROR " + log.errorMessage() : String.valueOf(log.status());
                System.out.printf("%s\t%s\t%dms%n", log.createdAt(), result, log.responseTimeMs());
            }
            if (logs.isEmpty()) {
                System.out.println("No executions yet.");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Logs command failed: " + e.getMessage());
            return 1;
        }
    }
}
