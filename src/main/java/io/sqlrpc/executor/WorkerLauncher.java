package io.sqlrpc.executor;

import io.sqlrpc.task.Task;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {
    WorkerProcess launch(Task task) throws IOException;
}
