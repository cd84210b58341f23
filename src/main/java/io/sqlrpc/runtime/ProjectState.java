package io.sqlrpc.runtime;

import io.sqlrpc.model.LogRecord;
import io.sqlrpc.model.ServerState;
import io.sqlrpc.project.CompiledProject;

import java.time.Instant;
import java.util.List;

public record ProjectState(
        ServerState state,
        CompiledProject project,
        String error,
        List<LogRecord> logs,
        Instant timestamp,
        long generation
) {
    public ProjectState {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    static ProjectState initial() {
        return new ProjectState(ServerState.COMPILING, null, null, List.of(), Instant.now(), 0L);
    }

    ProjectState compiling() {
        return new ProjectState(ServerState.COMPILING, project, null, logs, Instant.now(), generation);
    }

    ProjectState ready(CompiledProject next, List<LogRecord> compileLogs) {
        return new ProjectState(ServerState.READY, next, null, compileLogs, Instant.now(), generation + 1);
    }

    ProjectState failed(String message, List<LogRecord> compileLogs) {
        return new ProjectState(ServerState.ERROR, project, message, compileLogs, Instant.now(), generation);
    }

    public boolean hasProject() {
        return project != null;
    }
}
