package io.sqlrpc.compiler;

public interface NodeResolver {
    ResolvedRef ref(String name) throws CompilationException;

    ResolvedRef source(String sourceName, String tableName) throws CompilationException;

    Object var(String name);
}
