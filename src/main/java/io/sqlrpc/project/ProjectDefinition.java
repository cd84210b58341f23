package io.sqlrpc.project;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ProjectDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("model-paths") List<String> modelPaths,
        @JsonProperty("seed-paths") List<String> seedPaths,
        @JsonProperty("test-paths") List<String> testPaths,
        @JsonProperty("macro-paths") List<String> macroPaths,
        @JsonProperty("materialized") Materialization materialized,
        @JsonProperty("models") Map<String, ModelConfig> models,
        @JsonProperty("sources") Map<String, SourceDefinition> sources,
        @JsonProperty("vars") Map<String, Object> vars
) {
    public static final String FILE_NAME = "project.json";

    public ProjectDefinition {
        if (name == null || name.isBlank()) {
            throw new ProjectCompilationException(FILE_NAME + " must declare a non-empty 'name'");
        }
        name = name.trim();
        modelPaths = orDefault(modelPaths, "models");
        seedPaths = orDefault(seedPaths, "data");
        testPaths = orDefault(testPaths, "tests");
        macroPaths = orDefault(macroPaths, "macros");
        materialized = materialized == null ? Materialization.VIEW : materialized;
        models = models == null ? Map.of() : Map.copyOf(models);
        sources = sources == null ? Map.of() : Map.copyOf(sources);
        vars = vars == null ? Map.of() : vars;
    }

    public Materialization materializationOf(String modelName) {
        ModelConfig config = models.get(modelName);
        if (config == null || config.materialized() == null) {
            return materialized;
        }
        return config.materialized();
    }

    private static List<String> orDefault(List<String> paths, String fallback) {
        return paths == null || paths.isEmpty() ? List.of(fallback) : List.copyOf(paths);
    }

    public record ModelConfig(@JsonProperty("materialized") Materialization materialized) {
    }

    public record SourceDefinition(
            @JsonProperty("schema") String schema,
            @JsonProperty("tables") Map<String, String> tables
    ) {
        public SourceDefinition {
            tables = tables == null ? Map.of() : Map.copyOf(tables);
        }

        public String identifier(String table) {
            String physical = tables.get(table);
            return physical == null || physical.isBlank() ? table : physical;
        }
    }
}
