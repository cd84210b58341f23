package io.sqlrpc.project;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResourceType {
    MODEL("model"),
    SEED("seed"),
    TEST("test"),
    SOURCE("source"),
    RPC("rpc");

    private final String wireName;

    ResourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
