package io.sqlrpc.compiler;

import java.util.List;

public record CompiledSql(String rawSql, String compiledSql, List<String> dependsOn) {
    public CompiledSql {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
