package io.sqlrpc.worker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.adapter.JdbcSqlAdapter;
import io.sqlrpc.adapter.SqlAdapter;
import io.sqlrpc.compiler.FreemarkerSqlCompiler;
import io.sqlrpc.compiler.SqlCompiler;
import io.sqlrpc.executor.WorkerMessage;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.observability.LogCaptureAppender;
import io.sqlrpc.rpc.RpcException;
import io.sqlrpc.rpc.TaskErrors;
import io.sqlrpc.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.function.Function;

/**
 * Child side of the worker protocol: reads one {@link TaskRequest} from stdin, streams every log event
 * as a {@code log} message and ends with exactly one {@code result} or {@code error} message.
 */
public final class WorkerRunner {
    private static final Logger LOG = LogManager.getLogger(WorkerRunner.class);

    private final PrintStream channel;
    private final SqlOperations sqlOperations;
    private final ProjectOperations projectOperations;

    public WorkerRunner(PrintStream channel) {
        this(channel, new FreemarkerSqlCompiler(), JdbcSqlAdapter::new);
    }

    public WorkerRunner(PrintStream channel, SqlCompiler compiler, Function<ConnectionProfile, SqlAdapter> adapters) {
        this.channel = channel;
        this.sqlOperations = new SqlOperations(compiler, adapters);
        this.projectOperations = new ProjectOperations(adapters);
    }

    public int run(InputStream input) {
        LogCaptureAppender capture = LogCaptureAppender.install();
        try (LogCaptureAppender.Registration ignored = capture.captureAll(record -> send(WorkerMessage.log(record)))) {
            TaskRequest request;
            try {
                request = Jsons.compact().readValue(input, TaskRequest.class);
            } catch (IOException e) {
                send(WorkerMessage.error(TaskErrors.internal("InvalidWorkerRequest",
                        "Could not read the task request: " + e.getMessage(), List.of())));
                return 2;
            }
            send(handle(request));
            return 0;
        }
    }

    public WorkerMessage handle(TaskRequest request) {
        LOG.info("Running {} for task {}", request.method(), request.taskId());
        try {
            return WorkerMessage.result(dispatch(request));
        } catch (RpcException e) {
            return WorkerMessage.error(e.toTaskError());
        } catch (RuntimeException e) {
            LOG.error("Unhandled error in {}", request.method(), e);
            return WorkerMessage.error(TaskErrors.internal(e.getClass().getSimpleName(), String.valueOf(e.getMessage()), List.of()));
        }
    }

    private ObjectNode dispatch(TaskRequest request) {
        String method = request.method() == null ? "" : request.method();
        return switch (method) {
            case "compile" -> sqlOperations.compile(request);
            case "run" -> sqlOperations.run(request);
            case "compile_project" -> projectOperations.compileProject(request);
            case "run_project" -> projectOperations.runProject(request);
            case "test_project" -> projectOperations.testProject(request);
            case "seed_project" -> projectOperations.seedProject(request);
            default -> throw new IllegalArgumentException("Worker cannot run method '" + method + "'");
        };
    }

    private synchronized void send(WorkerMessage message) {
        channel.println(Jsons.toCompactJson(message));
        channel.flush();
    }
}
