package io.sqlrpc.executor;

import java.util.concurrent.atomic.AtomicReference;

public final class WorkerHandle {
    private final WorkerProcess process;
    private final AtomicReference<TerminationReason> forcedBy = new AtomicReference<>();

    public WorkerHandle(WorkerProcess process) {
        this.process = process;
    }

    public long pid() {
        return process.pid();
    }

    public WorkerProcess process() {
        return process;
    }

    public TerminationReason forcedBy() {
        return forcedBy.get();
    }

    boolean markForced(TerminationReason reason) {
        return forcedBy.compareAndSet(null, reason);
    }
}
