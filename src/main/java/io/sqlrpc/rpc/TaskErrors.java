package io.sqlrpc.rpc;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.TaskError;
import io.sqlrpc.util.Jsons;
import io.sqlrpc.util.Timestamps;

import java.time.Duration;
import java.util.List;

public final class TaskErrors {
    private TaskErrors() {
    }

    public static TaskError killed(int signum, List<LogRecord> logs) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("signum", signum);
        data.put("message", "RPC process killed by signal " + signum);
        return withLogs(of(RpcErrorCode.RPC_KILLED, data), logs);
    }

    public static TaskError timeout(Duration timeout, List<LogRecord> logs) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        Number seconds = Timestamps.seconds(timeout);
        if (seconds instanceof Long) {
            data.put("timeout", seconds.longValue());
        } else {
            data.put("timeout", seconds.doubleValue());
        }
        data.put("message", "RPC timed out after " + seconds + "s");
        return withLogs(of(RpcErrorCode.RPC_TIMEOUT, data), logs);
    }

    public static TaskError internal(String type, String message, List<LogRecord> logs) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("type", type);
        data.put("message", message);
        return withLogs(of(RpcErrorCode.RPC_INTERNAL_ERROR, data), logs);
    }

    public static TaskError sqlFailure(RpcErrorCode code, String type, String message, String rawSql, String compiledSql) {
        ObjectNode data = Jsons.mapper().createObjectNode();
        data.put("type", type);
        data.put("message", message);
        data.put("raw_sql", rawSql);
        data.put("compiled_sql", compiledSql);
        return of(code, data);
    }

    public static TaskError of(RpcErrorCode code, ObjectNode data) {
        return new TaskError(code.code(), code.message(), data);
    }

    public static TaskError withLogs(TaskError error, List<LogRecord> logs) {
        ObjectNode data = error.data() == null ? Jsons.mapper().createObjectNode() : error.data().deepCopy();
        ArrayNode array = data.putArray("logs");
        for (LogRecord record : logs) {
            array.add(Jsons.mapper().valueToTree(record));
        }
        return new TaskError(error.code(), error.message(), data);
    }
}
