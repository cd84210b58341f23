package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServerState {
    COMPILING("compiling"),
    READY("ready"),
    ERROR("error");

    private final String wireName;

    ServerState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
