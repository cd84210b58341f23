package io.sqlrpc.executor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.TaskError;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(
        @JsonProperty("type") Type type,
        @JsonProperty("log") LogRecord log,
        @JsonProperty("result") ObjectNode result,
        @JsonProperty("error") TaskError error
) {
    public static WorkerMessage log(LogRecord record) {
        return new WorkerMessage(Type.LOG, record, null, null);
    }

    public static WorkerMessage result(ObjectNode result) {
        return new WorkerMessage(Type.RESULT, null, result, null);
    }

    public static WorkerMessage error(TaskError error) {
        return new WorkerMessage(Type.ERROR, null, null, error);
    }

    public enum Type {
        LOG("log"),
        RESULT("result"),
        ERROR("error");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static Type fromString(String raw) {
            for (Type value : values()) {
                if (value.wireName.equalsIgnoreCase(raw)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown worker message type: " + raw);
        }
    }
}
