package io.sqlrpc.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.runtime.ProjectState;
import io.sqlrpc.runtime.TaskManager;
import io.sqlrpc.task.Task;
import io.sqlrpc.util.Jsons;
import io.sqlrpc.util.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses JSON-RPC 2.0 envelopes and routes them.
 *
 * <p>Administrative methods ({@code status}, {@code ps}, {@code kill}, {@code poll}) answer from the
 * registry and the reload controller without waiting on any task. Task methods create a task and, unless
 * {@code async} is set, block the calling thread until the task is terminal.
 */
public final class RpcDispatcher {
    private static final Logger LOG = LogManager.getLogger(RpcDispatcher.class);
    public static final String DEFAULT_NODE_NAME = "request";
    private static final Set<String> SQL_METHODS = Set.of("compile", "run");
    private static final Set<String> PROJECT_METHODS = Set.of("compile_project", "run_project", "test_project", "seed_project");

    private final TaskManager tasks;
    private final Map<String, Handler> handlers = new LinkedHashMap<>();

    public RpcDispatcher(TaskManager tasks) {
        this.tasks = tasks;
        handlers.put("status", (id, params) -> status());
        handlers.put("ps", (id, params) -> ps(params));
        handlers.put("kill", (id, params) -> kill(params));
        handlers.put("poll", (id, params) -> poll(params));
        for (String method : SQL_METHODS) {
            handlers.put(method, (id, params) -> submitSql(method, id, params));
        }
        for (String method : PROJECT_METHODS) {
            handlers.put(method, (id, params) -> submitProject(method, id, params));
        }
    }

    public String handle(String body) {
        JsonNode parsed;
        try {
            parsed = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            return Jsons.toCompactJson(errorResponse(NullNode.getInstance(), new RpcException(RpcErrorCode.PARSE_ERROR, e.getOriginalMessage())));
        }
        if (parsed == null || parsed.isMissingNode()) {
            return Jsons.toCompactJson(errorResponse(NullNode.getInstance(), new RpcException(RpcErrorCode.PARSE_ERROR, "empty body")));
        }
        if (parsed.isArray()) {
            if (parsed.isEmpty()) {
                return Jsons.toCompactJson(errorResponse(NullNode.getInstance(), new RpcException(RpcErrorCode.INVALID_REQUEST, "empty batch")));
            }
            ArrayNode responses = Jsons.mapper().createArrayNode();
            for (JsonNode element : parsed) {
                responses.add(handleOne(element));
            }
            return Jsons.toCompactJson(responses);
        }
        return Jsons.toCompactJson(handleOne(parsed));
    }

    ObjectNode handleOne(JsonNode request) {
        if (!request.isObject()) {
            return errorResponse(NullNode.getInstance(), new RpcException(RpcErrorCode.INVALID_REQUEST, "request must be an object"));
        }
        JsonNode id = request.has("id") ? request.get("id") : NullNode.getInstance();
        if (!id.isNull() && !id.isTextual() && !id.isNumber()) {
            return errorResponse(NullNode.getInstance(), new RpcException(RpcErrorCode.INVALID_REQUEST, "id must be a string or a number"));
        }
        try {
            validateVersion(request.get("jsonrpc"));
            JsonNode methodNode = request.get("method");
            if (methodNode == null || !methodNode.isTextual() || methodNode.asText().isBlank()) {
                throw new RpcException(RpcErrorCode.INVALID_REQUEST, "method must be a non-empty string");
            }
            JsonNode paramsNode = request.get("params");
            ObjectNode params;
            if (paramsNode == null || paramsNode.isNull()) {
                params = Jsons.mapper().createObjectNode();
            } else if (paramsNode.isObject()) {
                params = (ObjectNode) paramsNode;
            } else {
                throw new RpcException(RpcErrorCode.INVALID_REQUEST, "params must be an object");
            }
            String method = methodNode.asText();
            Handler handler = handlers.get(method);
            if (handler == null) {
                throw new RpcException(RpcErrorCode.METHOD_NOT_FOUND, method);
            }
            LOG.debug("Dispatching {} (id {})", method, id);
            return resultResponse(id, handler.handle(id, params));
        } catch (RpcException e) {
            return errorResponse(id, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResponse(id, new RpcException(RpcErrorCode.INTERNAL_ERROR, "interrupted while waiting for the task"));
        } catch (RuntimeException e) {
            LOG.error("Unhandled error while dispatching request {}", id, e);
            return errorResponse(id, new RpcException(RpcErrorCode.INTERNAL_ERROR, String.valueOf(e.getMessage())));
        }
    }

    private static void validateVersion(JsonNode version) {
        if (version == null) {
            throw new RpcException(RpcErrorCode.INVALID_REQUEST, "jsonrpc must be \"2.0\"");
        }
        boolean ok = (version.isTextual() && "2.0".equals(version.asText()))
                || (version.isNumber() && version.asDouble() == 2.0d);
        if (!ok) {
            throw new RpcException(RpcErrorCode.INVALID_REQUEST, "jsonrpc must be \"2.0\"");
        }
    }

    private JsonNode status() {
        ProjectState state = tasks.projectState();
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("status", state.state().wireName());
        out.put("timestamp", Timestamps.format(state.timestamp()));
        out.put("pid", ProcessHandle.current().pid());
        out.set("logs", logsNode(state.logs()));
        if (state.error() != null) {
            out.putObject("error").put("message", state.error());
        }
        return out;
    }

    private JsonNode ps(ObjectNode params) {
        boolean completed = Params.bool(params, "completed", false);
        boolean active = Params.bool(params, "active", true);
        ObjectNode out = Jsons.mapper().createObjectNode();
        ArrayNode rows = out.putArray("rows");
        for (Task task : tasks.registry().list(active, completed)) {
            rows.add(Jsons.mapper().valueToTree(task.summary()));
        }
        return out;
    }

    private JsonNode kill(ObjectNode params) throws InterruptedException {
        String taskId = Params.requiredString(params, "task_id");
        TaskState state = tasks.kill(taskId);
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("state", state.wireName());
        return out;
    }

    private JsonNode poll(ObjectNode params) {
        String token = Params.requiredString(params, "request_token");
        boolean includeLogs = Params.bool(params, "logs", true);
        int logsStart = Params.integer(params, "logs_start", 0);
        if (logsStart < 0) {
            throw new RpcException(RpcErrorCode.INVALID_PARAMS, "logs_start cannot be negative");
        }
        Task task = tasks.registry().get(token)
                .orElseThrow(() -> new RpcException(RpcErrorCode.INVALID_PARAMS, "No task with request_token " + token));
        TaskState state = task.state();
        if (state == TaskState.ERROR || state == TaskState.KILLED) {
            throw RpcException.fromTaskError(task.error());
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        if (state == TaskState.FINISHED) {
            out.setAll(task.result());
        }
        out.put("request_token", task.taskId());
        out.put("state", state.wireName());
        out.set("logs", includeLogs ? logsNode(task.logsFrom(logsStart)) : Jsons.mapper().createArrayNode());
        out.put("start", Timestamps.format(task.startedAt()));
        out.put("end", Timestamps.format(task.endedAt()));
        out.put("elapsed", task.summary().elapsed());
        return out;
    }

    private JsonNode submitSql(String method, JsonNode id, ObjectNode params) throws InterruptedException {
        String rawSql = decodeBase64(Params.requiredString(params, "sql"), "sql");
        String macros = params.hasNonNull("macros") ? decodeBase64(Params.string(params, "macros", ""), "macros") : null;
        String name = Params.string(params, "name", DEFAULT_NODE_NAME);
        if (name.isBlank()) {
            throw new RpcException(RpcErrorCode.INVALID_PARAMS, "name cannot be blank");
        }
        Duration timeout = Params.timeout(params);
        Task task = tasks.submitSql(method, id, timeout, name, rawSql, macros);
        return await(task, Params.bool(params, "async", false));
    }

    private JsonNode submitProject(String method, JsonNode id, ObjectNode params) throws InterruptedException {
        List<String> models = Params.stringList(params, "models");
        boolean show = Params.bool(params, "show", false);
        Duration timeout = Params.timeout(params);
        Task task = tasks.submitProject(method, id, timeout, models, show);
        return await(task, Params.bool(params, "async", false));
    }

    private static JsonNode await(Task task, boolean async) throws InterruptedException {
        if (async) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("request_token", task.taskId());
            out.put("state", task.state().wireName());
            return out;
        }
        task.awaitTerminal();
        if (task.state() == TaskState.FINISHED) {
            return task.result();
        }
        throw RpcException.fromTaskError(task.error());
    }

    private static String decodeBase64(String value, String field) {
        try {
            return new String(Base64.getDecoder().decode(value.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new RpcException(RpcErrorCode.INVALID_PARAMS, field + " must be base64 encoded: " + e.getMessage());
        }
    }

    private static ArrayNode logsNode(List<LogRecord> logs) {
        ArrayNode array = Jsons.mapper().createArrayNode();
        for (LogRecord record : logs) {
            array.add(Jsons.mapper().valueToTree(record));
        }
        return array;
    }

    static ObjectNode resultResponse(JsonNode id, JsonNode result) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("jsonrpc", "2.0");
        out.set("result", result);
        out.set("id", id);
        return out;
    }

    static ObjectNode errorResponse(JsonNode id, RpcException e) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("jsonrpc", "2.0");
        ObjectNode error = out.putObject("error");
        error.put("code", e.code());
        error.put("message", e.rpcMessage());
        if (e.data() != null) {
            error.set("data", e.data());
        } else if (e.getMessage() != null && !e.getMessage().equals(e.rpcMessage())) {
            error.putObject("data").put("message", e.getMessage());
        }
        out.set("id", id);
        return out;
    }

    public List<String> methods() {
        return new ArrayList<>(handlers.keySet());
    }

    @FunctionalInterface
    private interface Handler {
        JsonNode handle(JsonNode id, ObjectNode params) throws InterruptedException;
    }
}
