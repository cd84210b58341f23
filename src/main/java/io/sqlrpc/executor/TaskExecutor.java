package io.sqlrpc.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.TaskError;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.rpc.TaskErrors;
import io.sqlrpc.task.Task;
import io.sqlrpc.util.Jsons;
import io.sqlrpc.util.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs each task in its own worker process and finalizes the task from what the worker reports.
 *
 * <p>One monitor thread per task feeds the request to the worker, streams the worker's log messages
 * into the task as they arrive and, once the worker exits, performs the single terminal transition.
 * Forced termination ({@link #terminate}) only signals the worker; the monitor thread observes the exit
 * and decides the final state.
 */
public final class TaskExecutor implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(TaskExecutor.class);

    private final WorkerLauncher launcher;
    private final Duration killGrace;
    private final Consumer<Task> onFinished;
    private final ExecutorService monitors;
    private final ScheduledExecutorService escalations;
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicLong killTotal = new AtomicLong();
    private final AtomicLong timeoutTotal = new AtomicLong();

    public TaskExecutor(WorkerLauncher launcher, Duration killGrace, Consumer<Task> onFinished) {
        this.launcher = launcher;
        this.killGrace = killGrace;
        this.onFinished = onFinished;
        AtomicInteger monitorIds = new AtomicInteger();
        this.monitors = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sqlrpc-task-monitor-" + monitorIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.escalations = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sqlrpc-kill-escalation");
            t.setDaemon(true);
            return t;
        });
    }

    public Future<?> submit(Task task, TaskRequest request) {
        return monitors.submit(() -> execute(task, request));
    }

    public void execute(Task task, TaskRequest request) {
        try {
            runWorker(task, request);
        } catch (RuntimeException e) {
            LOG.error("Task {} failed inside the executor", task.taskId(), e);
            task.finishWithError(TaskErrors.internal(e.getClass().getSimpleName(), String.valueOf(e.getMessage()), task.logs()));
        } finally {
            if (onFinished != null && task.isTerminal()) {
                try {
                    onFinished.accept(task);
                } catch (RuntimeException e) {
                    LOG.warn("Task {} finish listener failed: {}", task.taskId(), e.getMessage());
                }
            }
        }
    }

    private void runWorker(Task task, TaskRequest request) {
        if (task.killRequested()) {
            LOG.info("Task {} was killed before it started", task.taskId());
            task.finishKilled(TaskErrors.killed(TerminationReason.KILL.signum(), task.logs()));
            return;
        }
        WorkerProcess process;
        try {
            process = launcher.launch(task);
        } catch (IOException e) {
            LOG.error("Failed to start a worker for task {}", task.taskId(), e);
            task.finishWithError(TaskErrors.internal("WorkerStartFailed", "Failed to start worker: " + e.getMessage(), task.logs()));
            return;
        }
        WorkerHandle handle = new WorkerHandle(process);
        if (!task.markRunning(handle)) {
            process.destroyForcibly();
            LOG.info("Task {} was killed while its worker was starting", task.taskId());
            task.finishKilled(TaskErrors.killed(TerminationReason.KILL.signum(), task.logs()));
            return;
        }
        activeWorkers.incrementAndGet();
        LOG.info("Task {} ({}) running in worker pid {}", task.taskId(), task.method(), handle.pid());

        WorkerMessage outcome = null;
        Integer exitCode = null;
        String failure = null;
        try {
            sendRequest(task, process, request);
            outcome = readMessages(task, process);
            exitCode = process.waitFor();
        } catch (IOException e) {
            failure = "Lost contact with worker: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "Interrupted while waiting for worker";
        } finally {
            release(handle);
        }
        finish(task, handle, outcome, exitCode, failure);
    }

    private void sendRequest(Task task, WorkerProcess process, TaskRequest request) {
        try (OutputStream in = process.stdin()) {
            in.write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
            in.write('\n');
            in.flush();
        } catch (IOException e) {
            // The worker may already be gone (killed right after start); its exit is reported below.
            LOG.debug("Could not write request to worker of task {}: {}", task.taskId(), e.getMessage());
        }
    }

    private WorkerMessage readMessages(Task task, WorkerProcess process) throws IOException {
        WorkerMessage outcome = null;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.stdout(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = Jsons.compact().readValue(line, WorkerMessage.class);
                } catch (JsonProcessingException e) {
                    task.appendLog(stray(line));
                    continue;
                }
                switch (message.type()) {
                    case LOG -> {
                        if (message.log() != null) {
                            task.appendLog(message.log());
                        }
                    }
                    case RESULT, ERROR -> {
                        if (outcome == null) {
                            outcome = message;
                        }
                    }
                }
            }
        }
        return outcome;
    }

    private void finish(Task task, WorkerHandle handle, WorkerMessage outcome, Integer exitCode, String failure) {
        List<LogRecord> logs = task.logs();
        TerminationReason forced = handle.forcedBy();
        if (forced == TerminationReason.KILL) {
            task.finishKilled(TaskErrors.killed(forced.signum(), logs));
            LOG.info("Task {} killed", task.taskId());
            return;
        }
        if (forced == TerminationReason.TIMEOUT) {
            task.finishWithError(TaskErrors.timeout(task.timeout(), logs));
            LOG.info("Task {} timed out after {}", task.taskId(), task.timeout());
            return;
        }
        if (outcome != null && outcome.type() == WorkerMessage.Type.RESULT && outcome.result() != null) {
            ObjectNode result = outcome.result().deepCopy();
            ArrayNode array = result.putArray("logs");
            for (LogRecord record : logs) {
                array.add(Jsons.mapper().valueToTree(record));
            }
            task.finishWithResult(result);
            LOG.info("Task {} finished", task.taskId());
            return;
        }
        if (outcome != null && outcome.type() == WorkerMessage.Type.ERROR && outcome.error() != null) {
            TaskError error = TaskErrors.withLogs(outcome.error(), logs);
            task.finishWithError(error);
            LOG.info("Task {} failed with {} {}", task.taskId(), error.code(), error.message());
            return;
        }
        String message = failure != null
                ? failure
                : "Worker exited with code " + exitCode + " before returning a result";
        LOG.warn("Task {}: {}", task.taskId(), message);
        task.finishWithError(TaskErrors.internal("WorkerCrashed", message, logs));
    }

    private void release(WorkerHandle handle) {
        WorkerProcess process = handle.process();
        try {
            process.stdout().close();
        } catch (IOException e) {
            LOG.debug("Closing worker stdout failed: {}", e.getMessage());
        }
        if (process.isAlive()) {
            process.destroyForcibly();
        }
        activeWorkers.decrementAndGet();
    }

    /**
     * Forces the task's worker to stop. Only the first call per task has an effect; calls against a task
     * without a running worker return false.
     */
    public boolean terminate(Task task, TerminationReason reason) {
        WorkerHandle handle = task.handle();
        if (handle == null || !handle.markForced(reason)) {
            return false;
        }
        if (reason == TerminationReason.KILL) {
            killTotal.incrementAndGet();
        } else {
            timeoutTotal.incrementAndGet();
        }
        WorkerProcess process = handle.process();
        LOG.info("Sending signal {} to worker pid {} of task {} ({})", reason.signum(), handle.pid(), task.taskId(), reason);
        try {
            process.signal(reason.signum());
        } catch (IOException e) {
            LOG.warn("Signal {} to pid {} failed, destroying the worker: {}", reason.signum(), handle.pid(), e.getMessage());
            process.destroyForcibly();
            return true;
        }
        escalations.schedule(() -> {
            if (process.isAlive()) {
                LOG.warn("Worker pid {} of task {} ignored signal {} for {}, destroying it",
                        handle.pid(), task.taskId(), reason.signum(), killGrace);
                process.destroyForcibly();
            }
        }, killGrace.toMillis(), TimeUnit.MILLISECONDS);
        return true;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public long killTotal() {
        return killTotal.get();
    }

    public long timeoutTotal() {
        return timeoutTotal.get();
    }

    private static LogRecord stray(String line) {
        return new LogRecord(Timestamps.format(Instant.now()), "INFO", 20, "worker.stdout", line);
    }

    @Override
    public void close() {
        monitors.shutdownNow();
        escalations.shutdownNow();
    }
}
