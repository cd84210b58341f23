package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sqlrpc.util.Timestamps;

import java.time.Instant;

public record TimingInfo(
        @JsonProperty("name") String name,
        @JsonProperty("started_at") String startedAt,
        @JsonProperty("completed_at") String completedAt
) {
    public static TimingInfo of(String name, Instant startedAt, Instant completedAt) {
        return new TimingInfo(name, Timestamps.format(startedAt), Timestamps.format(completedAt));
    }
}
