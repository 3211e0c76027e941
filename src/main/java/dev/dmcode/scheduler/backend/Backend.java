package dev.dmcode.scheduler.backend;

/**
 * External trigger source that invokes {@link ExecutorHandle#justNext()} on its own schedule.
 */
public interface Backend {

    void register(ExecutorHandle handle);

    void unregister();
}
