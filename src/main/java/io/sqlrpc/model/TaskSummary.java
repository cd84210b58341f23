package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record TaskSummary(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("request_id") JsonNode requestId,
        @JsonProperty("method") String method,
        @JsonProperty("state") TaskState state,
        @JsonProperty("start") String start,
        @JsonProperty("end") String end,
        @JsonProperty("elapsed") double elapsed,
        @JsonProperty("timeout") Number timeout
) {
}
