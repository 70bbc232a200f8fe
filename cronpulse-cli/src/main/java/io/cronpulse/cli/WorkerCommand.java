package io.cronpulse.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "worker", description = "Run the scheduler in the foreground until interrupted")
public final class WorkerCommand implements Callable<Integer> {
    private final CliContext context;

    public WorkerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.workerRunner().run();
        } catch (Exception e) {
            System.err.println("Worker command failed: " + e.getMessage());
            return 1;
        }
    }
}
