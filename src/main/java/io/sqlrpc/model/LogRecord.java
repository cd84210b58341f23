package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LogRecord(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("levelname") String levelName,
        @JsonProperty("level") int level,
        @JsonProperty("logger") String logger,
        @JsonProperty("message") String message
) {
}
