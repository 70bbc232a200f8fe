package io.cronpulse.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronpulse.core.config.ConfigService;
import io.cronpulse.core.job.ExecutionOutcome;
import io.cronpulse.core.job.Job;
import io.cronpulse.core.job.JobService;
import io.cronpulse.core.job.SqliteJobStore;
import io.cronpulse.core.probe.ProbeFailure;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class JobCommandsIntegrationTest {

    @TempDir
    Path tempDir;

    private SqliteJobStore store;
    private JobService jobService;
    private CliContext context;

    @BeforeEach
    void setUp() throws Exception {
        store = new SqliteJobStore(tempDir.resolve("cronpulse.db"));
        jobService = new JobService(store, ZoneOffset.UTC);
        context = new CliContext(jobService, new ConfigService(), tempDir.resolve("config.json"));
    }

    @Test
    void shouldAddJobAndListIt() throws Exception {
        Result added = run(new AddCommand(context), "health", "https://example.com/health", "*/5 * * * *");

        assertThat(added.code()).isEqualTo(0);
        assertThat(added.out()).contains("Created job 1").contains("https://example.com/health");

        Result listed = run(new ListCommand(context));
        assertThat(listed.code()).isEqualTo(0);
        assertThat(listed.out())
            .contains("enabled")
            .contains("*/5 * * * *")
            .contains("runs=0")
            .contains("last=-");
    }

    @Test
    void shouldRejectInvalidScheduleWithoutCreatingJob() throws Exception {
        Result result = run(new AddCommand(context), "broken", "https://example.com", "not a cron");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Add command failed").contains("Invalid cron expression");
        assertThat(jobService.list(1)).isEmpty();
    }

    @Test
    void shouldRejectNonHttpUrl() throws Exception {
        Result result = run(new AddCommand(context), "ftp", "ftp://example.com", "* * * * *");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("url must be an absolute http or https URL");
    }

    @Test
    void shouldScopeJobsByUser() throws Exception {
        run(new AddCommand(context), "--user", "7", "mine", "https://example.com", "* * * * *");

        assertThat(run(new ListCommand(context), "--user", "7").out()).contains("mine");
        assertThat(run(new ListCommand(context)).out()).contains("No jobs.");
    }

    @Test
    void shouldToggleJobBackAndForth() throws Exception {
        Job job = jobService.create(1, "toggle-me", "https://example.com", "* * * * *");

        Result first = run(new ToggleCommand(context), String.valueOf(job.id()));
        assertThat(first.code()).isEqualTo(0);
        assertThat(first.out()).contains("disabled");
        assertThat(store.listEnabledJobs()).isEmpty();

        Result second = run(new ToggleCommand(context), String.valueOf(job.id()));
        assertThat(second.out()).contains("enabled");
        assertThat(store.listEnabledJobs()).extracting(Job::id).containsExactly(job.id());
    }

    @Test
    void shouldEditJob() throws Exception {
        Job job = jobService.create(1, "before", "https://example.com", "* * * * *");

        Result result = run(new EditCommand(context), String.valueOf(job.id()), "after", "https://example.org", "*/10 * * * *");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("Updated job " + job.id());
        Job edited = jobService.find(job.id(), 1).orElseThrow();
        assertThat(edited.name()).isEqualTo("after");
        assertThat(edited.schedule()).isEqualTo("*/10 * * * *");
    }

    @Test
    void shouldRejectEditWithInvalidSchedule() throws Exception {
        Job job = jobService.create(1, "before", "https://example.com", "* * * * *");

        Result result = run(new EditCommand(context), String.valueOf(job.id()), "after", "https://example.org", "bogus");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Edit command failed").contains("Invalid cron expression");
        assertThat(jobService.find(job.id(), 1).orElseThrow().name()).isEqualTo("before");
    }

    @Test
    void shouldReportMissingJobWithNonZeroExit() throws Exception {
        assertThat(run(new ToggleCommand(context), "42").code()).isEqualTo(1);
        assertThat(run(new RemoveCommand(context), "42").err()).contains("Job 42 not found");
        assertThat(run(new LogsCommand(context), "42").code()).isEqualTo(1);
        assertThat(run(new EditCommand(context), "42", "x", "https://example.com", "* * * * *").code()).isEqualTo(1);
    }

    @Test
    void shouldNotLetAnotherUserRemoveJob() throws Exception {
        Job job = jobService.create(1, "owned", "https://example.com", "* * * * *");

        Result result = run(new RemoveCommand(context), "--user", "2", String.valueOf(job.id()));

        assertThat(result.code()).isEqualTo(1);
        assertThat(jobService.find(job.id(), 1)).isPresent();
    }

    @Test
    void shouldRemoveJobTogetherWithLogs() throws Exception {
        Job job = jobService.create(1, "gone", "https://example.com", "* * * * *");
        store.appendOutcome(ExecutionOutcome.success(job, 200, 12));

        Result result = run(new RemoveCommand(context), String.valueOf(job.id()));

        assertThat(result.code()).isEqualTo(0);
        assertThat(jobService.find(job.id(), 1)).isEmpty();
        assertThat(jobService.logs(job.id(), 1, 0)).isEmpty();
    }

    @Test
    void shouldPrintLogsNewestFirstWithinLimit() throws Exception {
        Job job = jobService.create(1, "logged", "https://example.com", "* * * * *");
        store.appendOutcome(ExecutionOutcome.success(job, 200, 15));
        store.appendOutcome(ExecutionOutcome.failure(job, ProbeFailure.TIMEOUT.code(), 30_000));
        store.appendOutcome(ExecutionOutcome.success(job, 503, 40));

        Result result = run(new LogsCommand(context), "--limit", "2", String.valueOf(job.id()));

        assertThat(result.code()).isEqualTo(0);
        String out = result.out();
        assertThat(out).contains("503").contains("ERROR " + ProbeFailure.TIMEOUT.code()).doesNotContain("15ms");
        assertThat(out.indexOf("40ms")).isLessThan(out.indexOf("30000ms"));
    }

    @Test
    void shouldShowStatusFromConfigFile() throws Exception {
        Files.writeString(context.configPath(), """
            {
              "worker": {
                "reconcileIntervalSeconds": 15,
                "singleFlight": true
              }
            }
            """, StandardCharsets.UTF_8);

        Result result = run(new StatusCommand(context));

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Config exists: true")
            .contains("Reconcile interval: 15s")
            .contains("Probe timeout: 30s")
            .contains("Single flight: true");
    }

    @Test
    void shouldPrintEffectiveConfigAsJson() {
        Result result = run(new StatusCommand(context), "--json");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("\"reconcileIntervalSeconds\" : 60")
            .contains("\"path\" : \"~/.cronpulse/cronpulse.db\"");
    }

    @Test
    void shouldNotOpenJobStoreForStatusOrHelp() {
        AtomicInteger lookups = new AtomicInteger();
        CliContext lazy = new CliContext(() -> {
            lookups.incrementAndGet();
            throw new IllegalStateException("database unavailable");
        }, new ConfigService(), context.configPath());

        assertThat(run(new StatusCommand(lazy)).code()).isEqualTo(0);
        CommandLine root = new CommandLine(new CronPulseCliCommand());
        root.addSubcommand("status", new StatusCommand(lazy));
        root.addSubcommand("list", new ListCommand(lazy));
        assertThat(run(root, "--help").code()).isEqualTo(0);
        assertThat(lookups).hasValue(0);

        Result list = run(new ListCommand(lazy));
        assertThat(list.code()).isEqualTo(1);
        assertThat(list.err()).contains("List command failed: database unavailable");
        assertThat(lookups).hasValue(1);
    }

    @Test
    void shouldDelegateWorkerCommandToRunner() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CliContext withRunner = new CliContext(jobService, new ConfigService(), context.configPath(), () -> {
            calls.incrementAndGet();
            return 0;
        });

        assertThat(run(new WorkerCommand(withRunner)).code()).isEqualTo(0);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldFailWorkerCommandWhenRunnerThrows() throws Exception {
        Result result = run(new WorkerCommand(context));

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Worker command failed");
    }

    private Result run(Object command, String... args) {
        return run(new CommandLine(command), args);
    }

    private Result run(CommandLine commandLine, String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = commandLine.execute(args);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Result(int code, String out, String err) {
    }
}
