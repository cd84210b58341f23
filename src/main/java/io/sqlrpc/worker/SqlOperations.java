package io.sqlrpc.worker;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.adapter.DatabaseException;
import io.sqlrpc.adapter.SqlAdapter;
import io.sqlrpc.compiler.CompilationException;
import io.sqlrpc.compiler.CompiledSql;
import io.sqlrpc.compiler.SqlCompiler;
import io.sqlrpc.compiler.SqlSource;
import io.sqlrpc.model.ResultTable;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.model.TimingInfo;
import io.sqlrpc.project.CompiledProject;
import io.sqlrpc.project.ProjectNode;
import io.sqlrpc.project.ResourceType;
import io.sqlrpc.rpc.RpcErrorCode;
import io.sqlrpc.rpc.RpcException;
import io.sqlrpc.rpc.TaskErrors;
import io.sqlrpc.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

final class SqlOperations {
    private static final Logger LOG = LogManager.getLogger(SqlOperations.class);

    private final SqlCompiler compiler;
    private final Function<ConnectionProfile, SqlAdapter> adapters;

    SqlOperations(SqlCompiler compiler, Function<ConnectionProfile, SqlAdapter> adapters) {
        this.compiler = compiler;
        this.adapters = adapters;
    }

    ObjectNode compile(TaskRequest request) {
        return execute(request, false);
    }

    ObjectNode run(TaskRequest request) {
        return execute(request, true);
    }

    private ObjectNode execute(TaskRequest request, boolean fetch) {
        CompiledProject project = request.project();
        String name = request.name();
        SqlSource source = SqlSource.rpc(name, request.rawSql(), macroSources(project, request.macros()));

        Instant compileStarted = Instant.now();
        LOG.debug("Compiling rpc {}", name);
        CompiledSql compiled;
        try {
            compiled = compiler.compile(source, project.resolver());
        } catch (CompilationException e) {
            LOG.debug("Compilation of rpc {} failed: {}", name, e.detail());
            throw new RpcException(RpcErrorCode.COMPILATION_ERROR, e.detail(), TaskErrors.sqlFailure(
                    RpcErrorCode.COMPILATION_ERROR, "CompilationException", e.getMessage(), request.rawSql(), null
            ).data());
        }
        Instant compileCompleted = Instant.now();

        ResultTable table = null;
        Instant executeStarted = compileCompleted;
        Instant executeCompleted = compileCompleted;
        if (fetch) {
            executeStarted = Instant.now();
            try (SqlAdapter adapter = adapters.apply(request.profile())) {
                table = adapter.execute(compiled.compiledSql(), "rpc." + name, true);
            } catch (DatabaseException e) {
                String message = "Database Error in " + source.description() + "\n  " + e.getMessage();
                throw new RpcException(RpcErrorCode.DATABASE_ERROR, e.getMessage(), TaskErrors.sqlFailure(
                        RpcErrorCode.DATABASE_ERROR, "DatabaseException", message, request.rawSql(), compiled.compiledSql()
                ).data());
            }
            executeCompleted = Instant.now();
            LOG.debug("rpc {} returned {} rows", name, table.rows().size());
        }

        ProjectNode node = new ProjectNode(
                "rpc." + project.name() + "." + name,
                name,
                ResourceType.RPC,
                "from remote system",
                null,
                request.rawSql(),
                compiled.compiledSql(),
                null,
                null,
                compiled.dependsOn()
        );
        ObjectNode result = Jsons.mapper().createObjectNode();
        result.put("raw_sql", request.rawSql());
        result.put("compiled_sql", compiled.compiledSql());
        result.set("node", Jsons.mapper().valueToTree(node));
        ArrayNode timing = result.putArray("timing");
        timing.add(Jsons.mapper().valueToTree(TimingInfo.of("compile", compileStarted, compileCompleted)));
        timing.add(Jsons.mapper().valueToTree(TimingInfo.of("execute", executeStarted, executeCompleted)));
        if (table != null) {
            result.set("table", Jsons.mapper().valueToTree(table));
        }
        return result;
    }

    static List<String> macroSources(CompiledProject project, String requestMacros) {
        List<String> sources = new ArrayList<>(project.macros());
        if (requestMacros != null && !requestMacros.isBlank()) {
            sources.add(requestMacros);
        }
        return sources;
    }
}
