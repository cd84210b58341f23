package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskError(
        @JsonProperty("code") int code,
        @JsonProperty("message") String message,
        @JsonProperty("data") ObjectNode data
) {
}
