package at.sv.huebridge;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public final class BridgeTaskSchedulerImpl implements BridgeTaskScheduler {

    private final ScheduledExecutorService scheduler;

    /**
     * @param scheduler a single threaded executor, so tasks never overlap
     */
    public BridgeTaskSchedulerImpl(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public ScheduledTask schedule(Runnable runnable, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(logUncaughtException(runnable), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void execute(Runnable command) {
        scheduler.execute(logUncaughtException(command));
    }

    private Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            }
        };
    }
}
