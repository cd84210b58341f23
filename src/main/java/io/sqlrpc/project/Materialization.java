package io.sqlrpc.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Materialization {
    VIEW("view"),
    TABLE("table"),
    EPHEMERAL("ephemeral");

    private final String wireName;

    Materialization(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Materialization fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return VIEW;
        }
        for (Materialization value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown materialization: " + raw);
    }
}
