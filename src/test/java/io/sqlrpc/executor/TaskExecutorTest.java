package io.sqlrpc.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.rpc.RpcErrorCode;
import io.sqlrpc.rpc.TaskErrors;
import io.sqlrpc.task.Task;
import io.sqlrpc.task.TaskRegistry;
import io.sqlrpc.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class TaskExecutorTest {

    @Test
    void workerResultFinishesTaskWithStreamedLogs() throws Exception {
        ObjectNode answer = Jsons.mapper().createObjectNode();
        answer.put("raw_sql", "select 1 as id");
        answer.put("compiled_sql", "select 1 as id");
        TaskRegistry registry = new TaskRegistry();
        List<Task> finished = new CopyOnWriteArrayList<>();
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher(ScriptedWorkerLauncher.answering(answer));
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(1), finished::add)) {
            Task task = registry.create("compile", TextNode.valueOf("req-1"), null, null);
            executor.execute(task, request(task, "compile"));

            Assertions.assertEquals(TaskState.FINISHED, task.state());
            Assertions.assertNull(task.error());
            Assertions.assertEquals("select 1 as id", task.result().get("compiled_sql").asText());
            JsonNode logs = task.result().get("logs");
            Assertions.assertEquals(1, logs.size());
            Assertions.assertEquals("running compile", logs.get(0).get("message").asText());
            Assertions.assertEquals(1, task.logs().size());
            Assertions.assertNotNull(task.startedAt());
            Assertions.assertFalse(task.endedAt().isBefore(task.startedAt()));
            Assertions.assertNull(task.handle());
            Assertions.assertEquals(List.of(task), finished);
            Assertions.assertEquals(0, executor.activeWorkers());
            Assertions.assertEquals(1, launcher.launched().size());
        }
    }

    @Test
    void workerErrorIsPassedThroughWithLogs() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher((request, process) -> {
            process.log("DEBUG", "Compiling rpc request");
            process.error(TaskErrors.sqlFailure(RpcErrorCode.COMPILATION_ERROR, "CompilationException",
                    "Compilation Error in rpc request (from remote system)\n  'nope' is undefined", request.rawSql(), null));
        });
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(1), null)) {
            Task task = registry.create("compile", IntNode.valueOf(7), null, null);
            executor.execute(task, request(task, "compile"));

            Assertions.assertEquals(TaskState.ERROR, task.state());
            Assertions.assertNull(task.result());
            Assertions.assertEquals(10004, task.error().code());
            Assertions.assertEquals("select 1 as id", task.error().data().get("raw_sql").asText());
            Assertions.assertTrue(task.error().data().get("compiled_sql").isNull());
            Assertions.assertEquals("Compilation Error in rpc request (from remote system)\n  'nope' is undefined",
                    task.error().data().get("message").asText());
            Assertions.assertEquals(1, task.error().data().get("logs").size());
        }
    }

    @Test
    void killSignalsWorkerAndEndsKilledWithLogs() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher(ScriptedWorkerLauncher.hanging());
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(5), null)) {
            Task task = registry.create("run", TextNode.valueOf("kill-me"), null, null);
            Future<?> done = executor.submit(task, request(task, "run"));
            awaitRunningWithLogs(task);
            Assertions.assertEquals(1, executor.activeWorkers());

            Assertions.assertTrue(executor.terminate(task, TerminationReason.KILL));
            Assertions.assertFalse(executor.terminate(task, TerminationReason.TIMEOUT));
            done.get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(TaskState.KILLED, task.state());
            Assertions.assertEquals(10009, task.error().code());
            Assertions.assertEquals(2, task.error().data().get("signum").asInt());
            Assertions.assertTrue(task.error().data().get("logs").size() > 0);
            Assertions.assertEquals(List.of(2), launcher.launched().get(0).signals());
            Assertions.assertEquals(1L, executor.killTotal());
            Assertions.assertEquals(0L, executor.timeoutTotal());
            Assertions.assertEquals(0, executor.activeWorkers());
        }
    }

    @Test
    void watchdogTimesOutLongRunningTask() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher(ScriptedWorkerLauncher.hanging());
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(5), null);
             TimeoutWatchdog watchdog = new TimeoutWatchdog(registry, executor, Duration.ofMillis(20))) {
            watchdog.start();
            Task task = registry.create("run", TextNode.valueOf("slow"), Duration.ofMillis(100), null);
            executor.submit(task, request(task, "run"));

            Assertions.assertTrue(task.awaitTerminal(Duration.ofSeconds(5)));
            Assertions.assertEquals(TaskState.ERROR, task.state());
            Assertions.assertEquals(10008, task.error().code());
            Assertions.assertEquals(0.1d, task.error().data().get("timeout").asDouble(), 1e-9);
            Assertions.assertTrue(task.error().data().get("logs").size() > 0);
            Assertions.assertEquals(List.of(15), launcher.launched().get(0).signals());
            Assertions.assertEquals(1L, executor.timeoutTotal());
        }
    }

    @Test
    void workerExitingWithoutOutcomeIsInternalError() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher((request, process) -> {
            process.raw("Exception in thread \"main\" java.lang.OutOfMemoryError");
            throw new IllegalStateException("worker died");
        });
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(1), null)) {
            Task task = registry.create("run", null, null, null);
            executor.execute(task, request(task, "run"));

            Assertions.assertEquals(TaskState.ERROR, task.state());
            Assertions.assertEquals(10001, task.error().code());
            Assertions.assertEquals("WorkerCrashed", task.error().data().get("type").asText());
            Assertions.assertTrue(task.error().data().get("message").asText().contains("code 1"));
            JsonNode stray = task.error().data().get("logs").get(0);
            Assertions.assertEquals("worker.stdout", stray.get("logger").asText());
        }
    }

    @Test
    void killBeforeStartNeverLaunchesWorker() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher(ScriptedWorkerLauncher.hanging());
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofSeconds(1), null)) {
            Task task = registry.create("run", TextNode.valueOf("early"), null, null);
            Assertions.assertTrue(task.requestKillWhilePending());
            executor.execute(task, request(task, "run"));

            Assertions.assertEquals(TaskState.KILLED, task.state());
            Assertions.assertEquals(10009, task.error().code());
            Assertions.assertTrue(launcher.launched().isEmpty());
            Assertions.assertNotNull(task.startedAt());
            Assertions.assertNotNull(task.endedAt());
        }
    }

    @Test
    void workerIgnoringSignalIsDestroyedAfterGracePeriod() throws Exception {
        ScriptedWorkerLauncher launcher = new ScriptedWorkerLauncher(ScriptedWorkerLauncher.hanging(), true);
        TaskRegistry registry = new TaskRegistry();
        try (TaskExecutor executor = new TaskExecutor(launcher, Duration.ofMillis(100), null)) {
            Task task = registry.create("run", TextNode.valueOf("stubborn"), null, null);
            executor.submit(task, request(task, "run"));
            awaitRunningWithLogs(task);

            Assertions.assertTrue(executor.terminate(task, TerminationReason.KILL));
            Assertions.assertTrue(task.awaitTerminal(Duration.ofSeconds(5)));

            Assertions.assertEquals(TaskState.KILLED, task.state());
            Assertions.assertTrue(launcher.launched().get(0).destroyed());
        }
    }

    static TaskRequest request(Task task, String method) {
        return TaskRequest.sql(task.taskId(), method, "request", "select 1 as id", null, null, null);
    }

    static void awaitRunningWithLogs(Task task) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (task.state() == TaskState.RUNNING && !task.logs().isEmpty()) {
                return;
            }
            Thread.sleep(10L);
        }
        Assertions.fail("task " + task.taskId() + " never reported running with logs, state " + task.state());
    }
}
