package io.sqlrpc.project;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectNode(
        @JsonProperty("unique_id") String uniqueId,
        @JsonProperty("name") String name,
        @JsonProperty("resource_type") ResourceType resourceType,
        @JsonProperty("path") String path,
        @JsonProperty("original_file_path") String originalFilePath,
        @JsonProperty("raw_sql") String rawSql,
        @JsonProperty("compiled_sql") String compiledSql,
        @JsonProperty("relation") String relation,
        @JsonProperty("materialized") Materialization materialized,
        @JsonProperty("depends_on") List<String> dependsOn
) {
    public ProjectNode {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public boolean ephemeral() {
        return materialized == Materialization.EPHEMERAL;
    }

    public String description() {
        return resourceType.wireName() + " " + uniqueId + (path == null ? "" : " (" + path + ")");
    }
}
