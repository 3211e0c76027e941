package dev.dmcode.scheduler;

@FunctionalInterface
public interface Task {

    void execute() throws Exception;
}
