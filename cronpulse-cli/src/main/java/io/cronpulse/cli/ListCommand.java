package io.cronpulse.cli;

import io.cronpulse.core.job.Job;
import io.cronpulse.core.job.JobSummary;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List jobs with execution counts")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<JobSummary> jobs = context.jobService().list(userId);
            if (jobs.isEmpty()) {
                System.out.println("No jobs.");
                return 0;
            }
            for (JobSummary summary : jobs) {
                Job job = summary.job();
                System.out.printf("%d\t%s\t%s\t%s\t%s\truns=%d\tlast=%s%n",
                    job.id(),
                    job.enabled() ? "enabled" : "disabled",
                    job.schedule(),
                    job.name(),
                    job.url(),
                    summary.executionCount(),
                    summary.lastStatus() == null ? "-" : summary.lastStatus());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
