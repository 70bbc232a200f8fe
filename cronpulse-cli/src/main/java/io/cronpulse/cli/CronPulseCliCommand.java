package io.cronpulse.cli;

import picocli.CommandLine.Command;

@Command(name = "cronpulse", mixinStandardHelpOptions = true, description = "Scheduled HTTP health checks")
public final class CronPulseCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
