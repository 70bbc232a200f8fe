package io.cronpulse.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Delete a job and its execution logs")
public final class RemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    @Parameters(index = "0", description = "Job id")
    long jobId;

    public RemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (!context.jobService().delete(jobId, userId)) {
                System.err.println("Job " + jobId + " not found");
                return 1;
            }
            System.out.println("Removed job " + jobId);
            return 0;
        } catch (Exception e) {
            System.err.println("Remove command failed: " + e.getMessage());
            return 1;
        }
    }
}
