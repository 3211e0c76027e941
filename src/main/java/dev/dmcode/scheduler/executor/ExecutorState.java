package dev.dmcode.scheduler.executor;

public enum ExecutorState {
    IDLE,
    RUNNING,
    PAUSED
}
