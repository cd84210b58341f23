package io.sqlrpc.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.executor.TaskExecutor;
import io.sqlrpc.executor.TerminationReason;
import io.sqlrpc.executor.TimeoutWatchdog;
import io.sqlrpc.executor.WorkerLauncher;
import io.sqlrpc.model.ServerState;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.observability.AuditLogger;
import io.sqlrpc.observability.MetricsSnapshot;
import io.sqlrpc.project.CompiledProject;
import io.sqlrpc.rpc.RpcErrorCode;
import io.sqlrpc.rpc.RpcException;
import io.sqlrpc.task.DuplicateRequestException;
import io.sqlrpc.task.Task;
import io.sqlrpc.task.TaskRegistry;
import io.sqlrpc.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Owns the registry, executor, watchdog and reload controller. The dispatcher reaches tasks only
 * through this class.
 */
public final class TaskManager implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(TaskManager.class);
    // Time left after the kill grace period for the forced destroy to be observed.
    private static final Duration KILL_WAIT_MARGIN = Duration.ofSeconds(5);

    private final TaskRegistry registry;
    private final TaskExecutor executor;
    private final TimeoutWatchdog watchdog;
    private final ReloadController reloads;
    private final ConnectionProfile profile;
    private final AuditLogger audit;
    private final AtomicLong rejectedTotal = new AtomicLong();

    public TaskManager(
            WorkerLauncher launcher,
            ReloadController reloads,
            ConnectionProfile profile,
            AuditLogger audit,
            Duration killGrace,
            Duration watchdogInterval
    ) {
        this.registry = new TaskRegistry();
        this.executor = new TaskExecutor(launcher, killGrace, this::onFinished);
        this.watchdog = new TimeoutWatchdog(registry, executor, watchdogInterval);
        this.reloads = reloads;
        this.profile = profile;
        this.audit = audit;
    }

    public void start() {
        watchdog.start();
    }

    public Task submitSql(String method, JsonNode requestId, Duration timeout, String name, String rawSql, String macros) {
        return submit(method, requestId, timeout,
                (task) -> TaskRequest.sql(task.taskId(), method, name, rawSql, macros, task.project(), profile));
    }

    public Task submitProject(String method, JsonNode requestId, Duration timeout, List<String> models, boolean show) {
        return submit(method, requestId, timeout,
                (task) -> TaskRequest.project(task.taskId(), method, models, show, task.project(), profile));
    }

    private Task submit(String method, JsonNode requestId, Duration timeout, Function<Task, TaskRequest> requestFactory) {
        CompiledProject project = usableProject();
        Task task;
        try {
            task = registry.create(method, requestId, timeout, project);
        } catch (DuplicateRequestException e) {
            rejectedTotal.incrementAndGet();
            ObjectNode data = Jsons.mapper().createObjectNode();
            data.put("message", e.getMessage());
            data.put("task_id", e.activeTaskId());
            throw new RpcException(RpcErrorCode.DUPLICATE_REQUEST, e.getMessage(), data);
        }
        audit("task.create", task, "accepted", Map.of("method", method));
        executor.submit(task, requestFactory.apply(task));
        return task;
    }

    CompiledProject usableProject() {
        ProjectState state = reloads.current();
        if (state.state() == ServerState.ERROR) {
            rejectedTotal.incrementAndGet();
            ObjectNode data = Jsons.mapper().createObjectNode();
            data.put("message", state.error());
            throw new RpcException(RpcErrorCode.SERVER_ERROR, state.error(), data);
        }
        if (!state.hasProject()) {
            rejectedTotal.incrementAndGet();
            throw new RpcException(RpcErrorCode.SERVER_COMPILING, null);
        }
        return state.project();
    }

    /**
     * Kills a task and waits until it is terminal. A task that already ended is left alone and its state
     * is returned.
     */
    public TaskState kill(String taskId) throws InterruptedException {
        Task task = registry.get(taskId)
                .orElseThrow(() -> new RpcException(RpcErrorCode.INVALID_PARAMS, "No task with id " + taskId));
        if (task.isTerminal()) {
            return task.state();
        }
        if (task.requestKillWhilePending()) {
            LOG.info("Kill requested for pending task {}", taskId);
        } else {
            executor.terminate(task, TerminationReason.KILL);
        }
        if (!task.awaitTerminal(executor.killGrace().plus(KILL_WAIT_MARGIN))) {
            LOG.warn("Task {} did not stop within the kill grace period", taskId);
        }
        audit("task.kill", task, task.state().wireName(), Map.of());
        return task.state();
    }

    private void onFinished(Task task) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", task.method());
        if (task.error() != null) {
            details.put("code", task.error().code());
        }
        audit("task.finish", task, task.state().wireName(), details);
    }

    private void audit(String action, Task task, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, "task", result, task.taskId(), details));
        } catch (RuntimeException e) {
            LOG.warn("Audit write for {} failed: {}", action, e.getMessage());
        }
    }

    public TaskRegistry registry() {
        return registry;
    }

    public TaskExecutor executor() {
        return executor;
    }

    public ReloadController reloads() {
        return reloads;
    }

    public ProjectState projectState() {
        return reloads.current();
    }

    public MetricsSnapshot metrics() {
        Map<String, Integer> byState = new LinkedHashMap<>();
        for (Map.Entry<TaskState, Integer> e : registry.countByState().entrySet()) {
            byState.put(e.getKey().wireName(), e.getValue());
        }
        Map<String, Integer> byMethod = new LinkedHashMap<>();
        for (Task task : registry.list(true, true)) {
            byMethod.merge(task.method(), 1, Integer::sum);
        }
        return new MetricsSnapshot(
                byState,
                byMethod,
                reloads.current().state().wireName(),
                executor.activeWorkers(),
                reloads.successTotal(),
                reloads.failureTotal(),
                executor.killTotal(),
                executor.timeoutTotal(),
                rejectedTotal.get()
        );
    }

    @Override
    public void close() {
        watchdog.close();
        executor.close();
    }
}
