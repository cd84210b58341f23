package io.sqlrpc.project;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProjectSources(
        Path root,
        ProjectDefinition definition,
        List<SourceFile> models,
        List<SourceFile> seeds,
        List<SourceFile> tests,
        List<String> macros,
        Map<String, Object> vars
) {
    public ProjectSources {
        models = List.copyOf(models);
        seeds = List.copyOf(seeds);
        tests = List.copyOf(tests);
        macros = List.copyOf(macros);
        vars = Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }
}
