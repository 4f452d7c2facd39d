package at.sv.huebridge;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Runs all work of a bridge node. Implementations run tasks one after the other, never in parallel.
 */
public interface BridgeTaskScheduler extends Executor {
    /**
     * Runs the given task after the delay. A zero delay still defers the task, it never runs inline.
     */
    ScheduledTask schedule(Runnable runnable, Duration delay);

    @Override
    default void execute(Runnable command) {
        schedule(command, Duration.ZERO);
    }
}
