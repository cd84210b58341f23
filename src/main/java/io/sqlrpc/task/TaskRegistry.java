package io.sqlrpc.task;

import com.fasterxml.jackson.databind.JsonNode;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.project.CompiledProject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Every task created during this server's lifetime. Tasks are never removed.
 *
 * <p>Creation and the release of a finished task's request id are serialized on one lock; lookups and
 * listings read the concurrent maps directly.
 */
public final class TaskRegistry {
    private static final Logger LOG = LogManager.getLogger(TaskRegistry.class);
    private static final Comparator<SortKey> START_ORDER = Comparator
            .comparing(SortKey::at)
            .thenComparingLong(SortKey::sequence);

    private final Object mutationLock = new Object();
    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Task> latestByRequestId = new ConcurrentHashMap<>();
    // guarded by mutationLock
    private final Map<String, Task> activeByRequestId = new HashMap<>();
    private long nextSequence;

    public Task create(String method, JsonNode requestId, Duration timeout, CompiledProject project) {
        String key = requestKey(requestId);
        synchronized (mutationLock) {
            if (key != null) {
                Task active = activeByRequestId.get(key);
                if (active != null && !active.isTerminal()) {
                    throw new DuplicateRequestException(requestId, active.taskId());
                }
            }
            Task task = new Task(
                    UUID.randomUUID().toString(),
                    requestId,
                    method,
                    timeout,
                    project,
                    nextSequence++,
                    this::release
            );
            tasks.put(task.taskId(), task);
            if (key != null) {
                activeByRequestId.put(key, task);
                latestByRequestId.put(key, task);
            }
            LOG.debug("Created task {} for {} (request id {})", task.taskId(), method, requestId);
            return task;
        }
    }

    public Optional<Task> get(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Optional<Task> findByRequestId(JsonNode requestId) {
        String key = requestKey(requestId);
        return key == null ? Optional.empty() : Optional.ofNullable(latestByRequestId.get(key));
    }

    public List<Task> list(boolean includeRunning, boolean includeCompleted) {
        List<SortKey> keys = new ArrayList<>();
        for (Task task : tasks.values()) {
            boolean terminal = task.isTerminal();
            if ((terminal && includeCompleted) || (!terminal && includeRunning)) {
                keys.add(SortKey.of(task));
            }
        }
        return sorted(keys);
    }

    public List<Task> running() {
        List<SortKey> keys = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (task.state() == TaskState.RUNNING) {
                keys.add(SortKey.of(task));
            }
        }
        return sorted(keys);
    }

    // Start times move while tasks start, so each key is read once before sorting.
    private static List<Task> sorted(List<SortKey> keys) {
        keys.sort(START_ORDER);
        List<Task> out = new ArrayList<>(keys.size());
        for (SortKey key : keys) {
            out.add(key.task());
        }
        return out;
    }

    public Map<TaskState, Integer> countByState() {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, 0);
        }
        for (Task task : tasks.values()) {
            counts.merge(task.state(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return tasks.size();
    }

    private void release(Task task) {
        String key = requestKey(task.requestId());
        if (key == null) {
            return;
        }
        synchronized (mutationLock) {
            activeByRequestId.remove(key, task);
        }
    }

    private record SortKey(Task task, Instant at, long sequence) {
        static SortKey of(Task task) {
            Instant started = task.startedAt();
            return new SortKey(task, started == null ? task.createdAt() : started, task.sequence());
        }
    }

    private static String requestKey(JsonNode requestId) {
        if (requestId == null || requestId.isNull() || requestId.isMissingNode()) {
            return null;
        }
        return requestId.toString();
    }
}
