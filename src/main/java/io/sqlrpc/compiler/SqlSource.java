package io.sqlrpc.compiler;

import java.util.List;

public record SqlSource(String name, String description, String rawSql, List<String> macroSources) {
    public SqlSource {
        if (rawSql == null) {
            throw new IllegalArgumentException("raw sql cannot be null for " + name);
        }
        macroSources = macroSources == null ? List.of() : List.copyOf(macroSources);
    }

    public static SqlSource rpc(String name, String rawSql, List<String> macroSources) {
        return new SqlSource(name, "rpc " + name + " (from remote system)", rawSql, macroSources);
    }
}
