package io.sqlrpc.runtime;

import io.sqlrpc.model.LogRecord;
import io.sqlrpc.observability.LogCaptureAppender;
import io.sqlrpc.project.CompiledProject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Recompiles the project on request and publishes the result with a single reference swap.
 *
 * <p>Reloads run one at a time on a dedicated thread. Requests made while one is already queued share
 * its outcome. A failed reload keeps the previous graph but moves the server to {@code error}.
 */
public final class ReloadController implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ReloadController.class);

    private final Supplier<CompiledProject> compileAction;
    private final Consumer<ProjectState> onPublished;
    private final AtomicReference<ProjectState> current = new AtomicReference<>(ProjectState.initial());
    private final ExecutorService control;
    private final AtomicLong successTotal = new AtomicLong();
    private final AtomicLong failureTotal = new AtomicLong();
    private final AtomicLong reloadIds = new AtomicLong();
    private CompletableFuture<ProjectState> queued;

    public ReloadController(Supplier<CompiledProject> compileAction, Consumer<ProjectState> onPublished) {
        this.compileAction = compileAction;
        this.onPublished = onPublished;
        this.control = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sqlrpc-reload");
            t.setDaemon(true);
            return t;
        });
    }

    public ProjectState current() {
        return current.get();
    }

    public CompletableFuture<ProjectState> requestReload(String reason) {
        synchronized (this) {
            if (queued != null) {
                LOG.debug("Reload ({}) coalesced with the queued one", reason);
                return queued;
            }
            CompletableFuture<ProjectState> future = new CompletableFuture<>();
            queued = future;
            control.execute(() -> {
                synchronized (this) {
                    queued = null;
                }
                try {
                    future.complete(reload(reason));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
            return future;
        }
    }

    public ProjectState reloadAndWait(String reason) throws InterruptedException {
        try {
            return requestReload(reason).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Reload failed unexpectedly", e.getCause());
        }
    }

    private ProjectState reload(String reason) {
        ProjectState previous = current.get();
        current.set(previous.compiling());
        LOG.info("Reloading project ({})", reason);
        String scope = "reload-" + reloadIds.incrementAndGet();
        List<LogRecord> logs = new CopyOnWriteArrayList<>();
        LogCaptureAppender capture = LogCaptureAppender.install();
        ProjectState next;
        ThreadContext.put(LogCaptureAppender.SCOPE_KEY, scope);
        try (LogCaptureAppender.Registration ignored = capture.capture(scope, logs::add)) {
            try {
                CompiledProject project = compileAction.get();
                LOG.info("Project {} is ready", project.name());
                next = previous.ready(project, logs);
                successTotal.incrementAndGet();
            } catch (RuntimeException e) {
                LOG.error("Project reload failed: {}", e.getMessage());
                next = previous.failed(e.getMessage(), logs);
                failureTotal.incrementAndGet();
            }
        } finally {
            ThreadContext.remove(LogCaptureAppender.SCOPE_KEY);
        }
        current.set(next);
        if (onPublished != null) {
            try {
                onPublished.accept(next);
            } catch (RuntimeException e) {
                LOG.warn("Reload listener failed: {}", e.getMessage());
            }
        }
        return next;
    }

    public long successTotal() {
        return successTotal.get();
    }

    public long failureTotal() {
        return failureTotal.get();
    }

    @Override
    public void close() {
        control.shutdownNow();
    }
}
