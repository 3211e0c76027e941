package dev.dmcode.scheduler.backend;

import dev.dmcode.scheduler.TaskExecutionException;

@FunctionalInterface
public interface ExecutorHandle {

    boolean justNext() throws TaskExecutionException;
}
