package io.sqlrpc.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import io.sqlrpc.config.ServerConfig;
import io.sqlrpc.runtime.SqlRpcServer;
import io.sqlrpc.util.Jsons;
import io.sqlrpc.worker.WorkerRunner;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "sqlrpc",
        mixinStandardHelpOptions = true,
        description = "JSON-RPC server that compiles and runs SQL templates as killable tasks",
        subcommands = {
                SqlRpcCommand.ServeCommand.class,
                SqlRpcCommand.ReloadCommand.class,
                SqlRpcCommand.WorkerCommand.class
        }
)
public final class SqlRpcCommand implements Runnable {
    @Option(names = {"--project-dir"}, description = "Project directory containing project.json", defaultValue = ".")
    String projectDir;

    @Option(names = {"--state-dir"}, description = "Directory for the audit log and pid file (default: <project>/.sqlrpc)")
    String stateDir;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    Path projectPath() {
        return Paths.get(projectDir).toAbsolutePath().normalize();
    }

    @Command(name = "serve", description = "Compile the project and serve JSON-RPC over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        SqlRpcCommand parent;

        @Option(names = {"--host"}, description = "Bind host (default: 127.0.0.1)")
        String host;

        @Option(names = {"--port"}, description = "Bind port (default: 8580)")
        Integer port;

        @Option(names = {"--path"}, description = "JSON-RPC endpoint path (default: /jsonrpc)")
        String path;

        @Option(names = {"--profile"}, description = "Connection profile JSON (default: <project>/profile.json)")
        String profile;

        @Option(names = {"--vars"}, description = "Template vars as a JSON object, overriding project.json")
        String vars;

        @Option(names = {"--kill-grace-ms"}, description = "Wait before a signalled worker is destroyed (default: 5000)")
        Long killGraceMs;

        @Option(names = {"--watchdog-interval-ms"}, description = "Timeout watchdog polling interval (default: 200)")
        Long watchdogIntervalMs;

        @Override
        public Integer call() throws Exception {
            ServerConfig.Settings overrides = new ServerConfig.Settings(
                    host,
                    port,
                    path,
                    parent.stateDir,
                    profile,
                    watchdogIntervalMs,
                    killGraceMs,
                    null,
                    parseVars(vars)
            );
            ServerConfig config = ServerConfig.load(parent.projectPath(), overrides);
            SqlRpcServer server = new SqlRpcServer(config);
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "sqlrpc-shutdown"));
            server.start();
            System.out.println("Serving " + config.projectDir() + " on http://" + config.host() + ":" + server.port() + config.path());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "reload", description = "Send SIGHUP to a running server so it recompiles the project")
    static final class ReloadCommand implements Callable<Integer> {
        @ParentCommand
        SqlRpcCommand parent;

        @Spec
        CommandLine.Model.CommandSpec spec;

        @Option(names = {"--pid"}, description = "Server pid (default: read from the state dir)")
        Long pid;

        @Override
        public Integer call() throws Exception {
            long target = pid != null ? pid : readPid();
            Process kill = new ProcessBuilder("kill", "-HUP", Long.toString(target))
                    .redirectErrorStream(true)
                    .start();
            if (!kill.waitFor(10, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                System.err.println("kill -HUP " + target + " did not return");
                return 1;
            }
            if (kill.exitValue() != 0) {
                System.err.println(new String(kill.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim());
                return kill.exitValue();
            }
            System.out.println("Sent SIGHUP to " + target);
            return 0;
        }

        private long readPid() throws IOException {
            ServerConfig config = ServerConfig.load(parent.projectPath(),
                    new ServerConfig.Settings(null, null, null, parent.stateDir, null, null, null, null, null));
            Path pidFile = config.stateDir().resolve(SqlRpcServer.PID_FILE);
            if (!Files.isRegularFile(pidFile)) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "No pid file at " + pidFile + "; pass --pid");
            }
            return Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim());
        }
    }

    @Command(name = "worker", hidden = true, description = "Run one task read from stdin (started by the server)")
    static final class WorkerCommand implements Callable<Integer> {
        @Option(names = {"--task-id"}, description = "Task id, for process listings only")
        String taskId;

        @Override
        public Integer call() {
            // stdout is the message channel; anything else printed there would corrupt it.
            PrintStream channel = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
            System.setOut(System.err);
            return new WorkerRunner(channel).run(System.in);
        }
    }

    static Map<String, Object> parseVars(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Jsons.mapper().readValue(raw, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new IllegalArgumentException("--vars must be a JSON object: " + e.getMessage(), e);
        }
    }
}
