package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.project.CompiledProject;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskRequest(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("method") String method,
        @JsonProperty("name") String name,
        @JsonProperty("raw_sql") String rawSql,
        @JsonProperty("macros") String macros,
        @JsonProperty("models") List<String> models,
        @JsonProperty("show") boolean show,
        @JsonProperty("project") CompiledProject project,
        @JsonProperty("profile") ConnectionProfile profile
) {
    public TaskRequest {
        models = models == null ? List.of() : List.copyOf(models);
    }

    public static TaskRequest sql(String taskId, String method, String name, String rawSql, String macros,
                                  CompiledProject project, ConnectionProfile profile) {
        return new TaskRequest(taskId, method, name, rawSql, macros, List.of(), false, project, profile);
    }

    public static TaskRequest project(String taskId, String method, List<String> models, boolean show,
                                      CompiledProject project, ConnectionProfile profile) {
        return new TaskRequest(taskId, method, null, null, null, models, show, project, profile);
    }
}
