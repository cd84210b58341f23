package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskState {
    PENDING("pending", false),
    RUNNING("running", false),
    FINISHED("finished", true),
    ERROR("error", true),
    KILLED("killed", true);

    private final String wireName;
    private final boolean terminal;

    TaskState(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return terminal;
    }

    @JsonCreator
    public static TaskState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task state cannot be empty");
        }
        for (TaskState value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task state: " + raw);
    }
}
