package io.sqlrpc.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.executor.WorkerHandle;
import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.TaskError;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.model.TaskSummary;
import io.sqlrpc.project.CompiledProject;
import io.sqlrpc.util.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One RPC-initiated unit of work.
 *
 * <p>State moves {@code pending -> running -> finished|error|killed} and never leaves a terminal state.
 * Transitions are serialized on the task's own monitor; every field read by {@code ps}, {@code poll} and
 * {@code status} is volatile or concurrent, so readers never wait on a running task.
 */
public final class Task {
    private final String taskId;
    private final JsonNode requestId;
    private final String method;
    private final Duration timeout;
    private final CompiledProject project;
    private final long sequence;
    private final Instant createdAt;
    private final List<LogRecord> logs = new CopyOnWriteArrayList<>();
    private final CountDownLatch terminalLatch = new CountDownLatch(1);
    private final Consumer<Task> onTerminal;

    private volatile TaskState state = TaskState.PENDING;
    private volatile Instant startedAt;
    private volatile Instant endedAt;
    private volatile WorkerHandle handle;
    private volatile ObjectNode result;
    private volatile TaskError error;
    private volatile boolean killRequested;

    Task(
            String taskId,
            JsonNode requestId,
            String method,
            Duration timeout,
            CompiledProject project,
            long sequence,
            Consumer<Task> onTerminal
    ) {
        this.taskId = taskId;
        this.requestId = requestId;
        this.method = method;
        this.timeout = timeout;
        this.project = project;
        this.sequence = sequence;
        this.createdAt = Instant.now();
        this.onTerminal = onTerminal;
    }

    public synchronized boolean markRunning(WorkerHandle workerHandle) {
        if (state != TaskState.PENDING || killRequested) {
            return false;
        }
        this.handle = workerHandle;
        this.startedAt = Instant.now();
        this.state = TaskState.RUNNING;
        return true;
    }

    public synchronized boolean requestKillWhilePending() {
        if (state != TaskState.PENDING) {
            return false;
        }
        killRequested = true;
        return true;
    }

    public boolean finishWithResult(ObjectNode value) {
        return complete(TaskState.FINISHED, value, null);
    }

    public boolean finishWithError(TaskError value) {
        return complete(TaskState.ERROR, null, value);
    }

    public boolean finishKilled(TaskError value) {
        return complete(TaskState.KILLED, null, value);
    }

    private boolean complete(TaskState terminalState, ObjectNode resultValue, TaskError errorValue) {
        synchronized (this) {
            if (state.terminal()) {
                return false;
            }
            Instant now = Instant.now();
            if (startedAt == null) {
                startedAt = now;
            }
            endedAt = now.isBefore(startedAt) ? startedAt : now;
            result = resultValue;
            error = errorValue;
            handle = null;
            state = terminalState;
        }
        terminalLatch.countDown();
        if (onTerminal != null) {
            onTerminal.accept(this);
        }
        return true;
    }

    public void appendLog(LogRecord record) {
        logs.add(record);
    }

    public List<LogRecord> logs() {
        return List.copyOf(logs);
    }

    public List<LogRecord> logsFrom(int start) {
        List<LogRecord> snapshot = logs();
        if (start <= 0) {
            return snapshot;
        }
        if (start >= snapshot.size()) {
            return List.of();
        }
        return snapshot.subList(start, snapshot.size());
    }

    public boolean awaitTerminal(Duration wait) throws InterruptedException {
        return terminalLatch.await(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void awaitTerminal() throws InterruptedException {
        terminalLatch.await();
    }

    public boolean isTerminal() {
        return state.terminal();
    }

    public TaskSummary summary() {
        Instant start = startedAt;
        Instant end = endedAt;
        return new TaskSummary(
                taskId,
                requestId,
                method,
                state,
                Timestamps.format(start),
                Timestamps.format(end),
                start == null ? 0.0d : Timestamps.elapsedSeconds(start, end == null ? Instant.now() : end),
                Timestamps.seconds(timeout)
        );
    }

    public String taskId() {
        return taskId;
    }

    public JsonNode requestId() {
        return requestId;
    }

    public String method() {
        return method;
    }

    public Duration timeout() {
        return timeout;
    }

    public CompiledProject project() {
        return project;
    }

    long sequence() {
        return sequence;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public TaskState state() {
        return state;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public WorkerHandle handle() {
        return handle;
    }

    public ObjectNode result() {
        return result;
    }

    public TaskError error() {
        return error;
    }

    public boolean killRequested() {
        return killRequested;
    }

    @Override
    public String toString() {
        return "Task[" + taskId + ", " + method + ", " + state.wireName() + "]";
    }
}
