package io.sqlrpc.runtime;

import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.compiler.FreemarkerSqlCompiler;
import io.sqlrpc.config.ServerConfig;
import io.sqlrpc.executor.ForkedWorkerLauncher;
import io.sqlrpc.executor.WorkerLauncher;
import io.sqlrpc.model.ServerState;
import io.sqlrpc.observability.AuditLogger;
import io.sqlrpc.project.ProjectCompiler;
import io.sqlrpc.project.ProjectLoader;
import io.sqlrpc.rpc.JsonRpcServer;
import io.sqlrpc.rpc.RpcDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SqlRpcServer implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(SqlRpcServer.class);
    public static final String PID_FILE = "sqlrpc.pid";

    private final ServerConfig config;
    private final ReloadController reloads;
    private final TaskManager tasks;
    private final RpcDispatcher dispatcher;
    private final JsonRpcServer http;

    public SqlRpcServer(ServerConfig config) throws IOException {
        this(config, new ForkedWorkerLauncher(config.workerJvmArgs()));
    }

    public SqlRpcServer(ServerConfig config, WorkerLauncher launcher) throws IOException {
        this.config = config;
        ConnectionProfile profile = ConnectionProfile.load(config.profileFile(), config.projectDir());
        AuditLogger audit = new AuditLogger(config.auditFile());
        ProjectLoader loader = new ProjectLoader(config.projectDir());
        ProjectCompiler compiler = new ProjectCompiler(new FreemarkerSqlCompiler());
        this.reloads = new ReloadController(
                () -> compiler.compile(loader.load(config.vars()), profile.schema()),
                state -> auditReload(audit, state)
        );
        this.tasks = new TaskManager(launcher, reloads, profile, audit, config.killGrace(), config.watchdogInterval());
        this.dispatcher = new RpcDispatcher(tasks);
        this.http = new JsonRpcServer(config.host(), config.port(), config.path(), dispatcher, tasks);
    }

    public void start() throws IOException {
        tasks.start();
        SignalReloadTrigger.install(reloads);
        reloads.requestReload("startup");
        http.start();
        writePidFile();
    }

    private void writePidFile() throws IOException {
        Path pidFile = config.stateDir().resolve(PID_FILE);
        Files.createDirectories(pidFile.getParent());
        Files.writeString(pidFile, Long.toString(ProcessHandle.current().pid()), StandardCharsets.UTF_8);
        LOG.debug("Wrote pid file {}", pidFile);
    }

    private static void auditReload(AuditLogger audit, ProjectState state) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("generation", state.generation());
        if (state.error() != null) {
            details.put("error", state.error());
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(
                    "project.reload",
                    state.hasProject() ? state.project().name() : "project",
                    state.state() == ServerState.READY ? "success" : "failure",
                    null,
                    details
            ));
        } catch (RuntimeException e) {
            LOG.warn("Audit write for project.reload failed: {}", e.getMessage());
        }
    }

    public int port() {
        return http.port();
    }

    public TaskManager tasks() {
        return tasks;
    }

    public ReloadController reloads() {
        return reloads;
    }

    public RpcDispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public void close() {
        http.close();
        tasks.close();
        reloads.close();
    }
}
