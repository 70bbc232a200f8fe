package io.cronpulse.cli;

import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "toggle", description = "Enable a disabled job or disable an enabled one")
public final class ToggleCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-u", "--user"}, description = "Owner id", defaultValue = "1")
    long userId;

    @Parameters(index = "0", description = "Job id")
    long jobId;

    public ToggleCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Optional<Boolean> enabled = context.jobService().toggle(jobId, userId);
            if (enabled.isEmpty()) {
                System.err.println("Job " + jobId + " not found");
                return 1;
            }
            System.out.println("Job " + jobId + (enabled.get() ? " enabled" : " disabled"));
            return 0;
        } catch (Exception e) {
            System.err.println("Toggle command failed: " + e.getMessage());
            return 1;
        }
    }
}
