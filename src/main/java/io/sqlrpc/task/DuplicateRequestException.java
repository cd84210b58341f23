package io.sqlrpc.task;

import com.fasterxml.jackson.databind.JsonNode;

public class DuplicateRequestException extends RuntimeException {
    private final transient JsonNode requestId;
    private final String activeTaskId;

    public DuplicateRequestException(JsonNode requestId, String activeTaskId) {
        super("Request id " + requestId + " is already in use by task " + activeTaskId);
        this.requestId = requestId;
        this.activeTaskId = activeTaskId;
    }

    public JsonNode requestId() {
        return requestId;
    }

    public String activeTaskId() {
        return activeTaskId;
    }
}
