package io.cronpulse.app;

import io.cronpulse.cli.AddCommand;
import io.cronpulse.cli.CliContext;
import io.cronpulse.cli.CronPulseCliCommand;
import io.cronpulse.cli.EditCommand;
import io.cronpulse.cli.ListCommand;
import io.cronpulse.cli.LogsCommand;
import io.cronpulse.cli.RemoveCommand;
import io.cronpulse.cli.StatusCommand;
import io.cronpulse.cli.ToggleCommand;
import io.cronpulse.cli.WorkerCommand;
import io.cronpulse.core.config.ConfigPaths;
import io.cronpulse.core.config.ConfigService;
import io.cronpulse.core.config.model.CronPulseConfig;
import io.cronpulse.core.job.JobService;
import io.cronpulse.core.job.SqliteJobStore;
import io.cronpulse.core.probe.HttpProbeExecutor;
import io.cronpulse.core.worker.CronWorker;
import io.cronpulse.core.worker.WorkerSettings;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CronPulseApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CronPulseApplication.class);

    private CronPulseApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        CronPulseConfig config = loadConfig(configService, configPath);

        JobStoreHolder stores = new JobStoreHolder(ConfigPaths.resolveDatabase(config.store().path()));

        CliContext context = new CliContext(
            () -> {
                WorkerSettings settings = WorkerSettings.from(config.worker());
                return new JobService(stores.get(), settings.zone());
            },
            configService,
            configPath,
            () -> runWorker(stores, config)
        );

        CommandLine commandLine = new CommandLine(new CronPulseCliCommand());
        commandLine.addSubcommand("worker", new WorkerCommand(context));
        commandLine.addSubcommand("add", new AddCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("edit", new EditCommand(context));
        commandLine.addSubcommand("toggle", new ToggleCommand(context));
        commandLine.addSubcommand("remove", new RemoveCommand(context));
        commandLine.addSubcommand("logs", new LogsCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static CronPulseConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return CronPulseConfig.defaults();
        }
    }

    // Opens the database on first use; --help and status never touch it.
    private static final class JobStoreHolder {
        private final Path databasePath;
        private SqliteJobStore store;

        private JobStoreHolder(Path databasePath) {
            this.databasePath = databasePath;
        }

        synchronized SqliteJobStore get() {
            if (store == null) {
                try {
                    store = new SqliteJobStore(databasePath);
                } catch (Exception e) {
                    throw new IllegalStateException("Failed to initialize SQLite job store at " + databasePath, e);
                }
            }
            return store;
        }
    }

    private static int runWorker(JobStoreHolder stores, CronPulseConfig config) throws InterruptedException {
        WorkerSettings settings = WorkerSettings.from(config.worker());
        HttpProbeExecutor probe = new HttpProbeExecutor(settings.probeTimeout(), config.worker().userAgent());
        CronWorker worker = new CronWorker(stores.get(), probe, settings);

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            worker.stop();
            shutdown.countDown();
        }, "cronpulse-shutdown"));

        worker.start();
        System.out.println("Worker running with " + worker.scheduledJobIds().size() + " jobs. Press Ctrl+C to stop.");
        shutdown.await();
        return 0;
    }
}
