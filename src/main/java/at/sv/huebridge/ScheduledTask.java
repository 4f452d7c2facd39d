package at.sv.huebridge;

@FunctionalInterface
public interface ScheduledTask {
    /**
     * Cancels the task, if it did not run yet. Does nothing otherwise.
     */
    void cancel();
}
