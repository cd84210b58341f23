package io.sqlrpc.executor;

import io.sqlrpc.task.Task;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public final class ForkedWorkerLauncher implements WorkerLauncher {
    private static final Logger LOG = LogManager.getLogger(ForkedWorkerLauncher.class);
    private static final String MAIN_CLASS = "io.sqlrpc.Main";
    private static final String WORKER_LOG_CONFIG = "log4j2-worker.xml";
    private static final boolean POSIX = !System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");

    private final String javaBinary;
    private final String classpath;
    private final List<String> jvmArgs;

    public ForkedWorkerLauncher(List<String> jvmArgs) {
        this(
                Path.of(System.getProperty("java.home"), "bin", "java").toString(),
                System.getProperty("java.class.path"),
                jvmArgs
        );
    }

    public ForkedWorkerLauncher(String javaBinary, String classpath, List<String> jvmArgs) {
        this.javaBinary = javaBinary;
        this.classpath = classpath;
        this.jvmArgs = jvmArgs == null ? List.of() : List.copyOf(jvmArgs);
    }

    @Override
    public WorkerProcess launch(Task task) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(javaBinary);
        command.addAll(jvmArgs);
        command.add("-Dlog4j2.configurationFile=" + WORKER_LOG_CONFIG);
        command.add("-cp");
        command.add(classpath);
        command.add(MAIN_CLASS);
        command.add("worker");
        command.add("--task-id");
        command.add(task.taskId());
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process = builder.start();
        LOG.debug("Started worker pid {} for task {}", process.pid(), task.taskId());
        return new Forked(process);
    }

    static final class Forked implements WorkerProcess {
        private final Process process;

        Forked(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public int waitFor() throws InterruptedException {
            return process.waitFor();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void signal(int signum) throws IOException {
            if (!process.isAlive()) {
                return;
            }
            if (!POSIX) {
                process.destroy();
                return;
            }
            Process kill = new ProcessBuilder("kill", "-" + signum, Long.toString(process.pid()))
                    .redirectErrorStream(true)
                    .start();
            try {
                if (!kill.waitFor(5, TimeUnit.SECONDS)) {
                    kill.destroyForcibly();
                    throw new IOException("kill -" + signum + " " + process.pid() + " did not return");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while signalling " + process.pid(), e);
            }
        }

        @Override
        public void destroyForcibly() {
            process.destroyForcibly();
        }
    }
}
