package io.cronpulse.cli;

import io.cronpulse.core.job.Job;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "add", description = "Register a new health-check job")
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    @Parameters(index = "0", description = "Job name")
    String name;

    @Parameters(index = "1", description = "URL to probe with GET")
    String url;

    @Parameters(index = "2", description = "Cron expression, e.g. \"*/5 * * * *\"")
    String schedule;

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Job job = context.jobService().create(userId, name, url, schedule);
            System.out.println("Created job " + job.id() + ": \"" + job.name() + "\" -> " + job.url() + " (" + job.schedule() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Add command failed: " + e.getMessage());
            return 1;
        }
    }
}
