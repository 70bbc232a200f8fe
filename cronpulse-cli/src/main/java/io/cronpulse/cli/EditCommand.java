package io.cronpulse.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "edit", description = "Change the name, url and schedule of a job")
public final class EditCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    @Parameters(index = "0", description = "Job id")
    long jobId;

    @Parameters(index = "1", description = "Job name")
    String name;

    @Parameters(index = "2", description = "URL to probe with GET")
    String url;

    @Parameters(index = "3", description = "Cron expression, e.g. \"*/5 * * * *\"")
    String schedule;

    public EditCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.jobService().update(jobId, userId, name, url, schedule)) {
                System.err.println("Job " + jobId + " not found");
                return 1;
            }
            System.out.println("Updated job " + jobId + ". A running worker keeps the old schedule until the job is toggled off and on, unless refreshOnChange is set.");
            return 0;
        } catch (Exception e) {
            System.err.println("Edit command failed: " + e.getMessage());
            return 1;
        }
    }
}
