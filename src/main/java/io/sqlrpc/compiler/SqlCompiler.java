package io.sqlrpc.compiler;

public interface SqlCompiler {
    CompiledSql compile(SqlSource source, NodeResolver resolver) throws CompilationException;
}
