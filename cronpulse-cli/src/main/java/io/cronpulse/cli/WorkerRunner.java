package io.cronpulse.cli;

@FunctionalInterface
public interface WorkerRunner {
    int run() throws Exception;
}
