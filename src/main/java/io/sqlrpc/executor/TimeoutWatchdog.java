package io.sqlrpc.executor;

import io.sqlrpc.task.Task;
import io.sqlrpc.task.TaskRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls running tasks and asks the executor to terminate those past their timeout. Never changes task
 * state itself; the executor's monitor thread records the timeout error once the worker is gone.
 */
public final class TimeoutWatchdog implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(TimeoutWatchdog.class);

    private final TaskRegistry registry;
    private final TaskExecutor executor;
    private final Duration interval;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    public TimeoutWatchdog(TaskRegistry registry, TaskExecutor executor, Duration interval) {
        this(registry, executor, interval, Clock.systemUTC());
    }

    TimeoutWatchdog(TaskRegistry registry, TaskExecutor executor, Duration interval, Clock clock) {
        this.registry = registry;
        this.executor = executor;
        this.interval = interval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sqlrpc-timeout-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long millis = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::safeTick, millis, millis, TimeUnit.MILLISECONDS);
        LOG.debug("Timeout watchdog polling every {} ms", millis);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An exception would cancel the schedule.
            LOG.error("Timeout watchdog tick failed", e);
        }
    }

    int tick() {
        Instant now = clock.instant();
        int signalled = 0;
        for (Task task : registry.running()) {
            Duration timeout = task.timeout();
            Instant started = task.startedAt();
            if (timeout == null || started == null) {
                continue;
            }
            if (Duration.between(started, now).compareTo(timeout) > 0) {
                if (executor.terminate(task, TerminationReason.TIMEOUT)) {
                    LOG.warn("Task {} exceeded its timeout of {}", task.taskId(), timeout);
                    signalled++;
                }
            }
        }
        return signalled;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
