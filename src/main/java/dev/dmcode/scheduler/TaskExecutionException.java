package dev.dmcode.scheduler;

import java.util.Objects;

public class TaskExecutionException extends Exception {

    private final TaskId taskId;

    public TaskExecutionException(TaskId taskId, Throwable cause) {
        super("Task " + taskId + " execution failed", cause);
        this.taskId = Objects.requireNonNull(taskId, "Task ID must be provided");
    }

    public TaskId taskId() {
        return taskId;
    }
}
