package io.cronpulse.core.worker;

public enum WorkerState {
    CREATED,
    RUNNING,
    STOPPED
}
