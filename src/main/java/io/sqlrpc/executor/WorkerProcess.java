package io.sqlrpc.executor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

public interface WorkerProcess {
    long pid();

    OutputStream stdin();

    InputStream stdout();

    boolean isAlive();

    int waitFor() throws InterruptedException;

    boolean waitFor(Duration timeout) throws InterruptedException;

    void signal(int signum) throws IOException;

    void destroyForcibly();
}
