package io.cronpulse.cli;

import io.cronpulse.core.config.ConfigPaths;
import io.cronpulse.core.config.model.CronPulseConfig;
import io.cronpulse.core.config.model.WorkerConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration and worker settings")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--json", description = "Print the effective configuration as JSON")
    boolean json;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronPulseConfig config = context.configService().load(context.configPath());
            if (json) {
                System.out.println(context.configService().toPrettyJson(config));
                return 0;
            }
            WorkerConfig worker = config.worker();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolveDatabase(config.store().path()));
            System.out.println("Reconcile interval: " + worker.reconcileIntervalSeconds() + "s");
            System.out.println("Probe timeout: " + worker.probeTimeoutSeconds() + "s");
            System.out.println("Drain timeout: " + worker.drainTimeoutSeconds() + "s");
            System.out.println("Timezone: " + worker.timezone());
            System.out.println("Single flight: " + worker.singleFlight());
            System.out.println("Refresh on change: " + worker.refreshOnChange());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
