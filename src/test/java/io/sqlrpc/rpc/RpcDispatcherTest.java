package io.sqlrpc.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.TestProjects;
import io.sqlrpc.executor.ScriptedWorkerLauncher;
import io.sqlrpc.model.TaskState;
import io.sqlrpc.runtime.ReloadController;
import io.sqlrpc.runtime.TaskManager;
import io.sqlrpc.task.Task;
import io.sqlrpc.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class RpcDispatcherTest {

    @Test
    void malformedEnvelopesGetProtocolErrors() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-dispatch-envelope-");
        ReloadController reloads = new ReloadController(() -> TestProjects.compile(root), null);
        try (TaskManager tasks = manager(root, reloads, ScriptedWorkerLauncher.hanging())) {
            RpcDispatcher dispatcher = new RpcDispatcher(tasks);

            JsonNode parse = call(dispatcher, "{not json");
            Assertions.assertEquals(-32700, parse.get("error").get("code").asInt());
            Assertions.assertTrue(parse.get("id").isNull());

            Assertions.assertEquals(-32600, call(dispatcher, "[]").get("error").get("code").asInt());

            JsonNode noVersion = call(dispatcher, "{\"id\": 7, \"method\": \"status\"}");
            Assertions.assertEquals(-32600, noVersion.get("error").get("code").asInt());
            Assertions.assertEquals(7, noVersion.get("id").asInt());

            JsonNode arrayParams = call(dispatcher, "{\"jsonrpc\": \"2.0\", \"id\": 1, \"method\": \"ps\", \"params\": [true]}");
            Assertions.assertEquals(-32600, arrayParams.get("error").get("code").asInt());

            JsonNode unknown = call(dispatcher, "{\"jsonrpc\": \"2.0\", \"id\": \"x\", \"method\": \"cli_args\"}");
            Assertions.assertEquals(-32601, unknown.get("error").get("code").asInt());
            Assertions.assertEquals("Method not found", unknown.get("error").get("message").asText());
            Assertions.assertEquals("x", unknown.get("id").asText());

            JsonNode batch = call(dispatcher, "[{\"jsonrpc\": \"2.0\", \"id\": 1, \"method\": \"status\"}, 5]");
            Assertions.assertTrue(batch.isArray());
            Assertions.assertEquals(2, batch.size());
            Assertions.assertEquals("compiling", batch.get(0).get("result").get("status").asText());
            Assertions.assertEquals(-32600, batch.get(1).get("error").get("code").asInt());
        } finally {
            reloads.close();
            deleteRecursively(root);
        }
    }

    @Test
    void statusAndTaskMethodsFollowTheCompileState() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-dispatch-status-");
        ReloadController reloads = new ReloadController(() -> TestProjects.compile(root), null);
        try (TaskManager tasks = manager(root, reloads, ScriptedWorkerLauncher.hanging())) {
            RpcDispatcher dispatcher = new RpcDispatcher(tasks);

            JsonNode compiling = call(dispatcher, request(1, "run_project", "{}"));
            Assertions.assertEquals(10010, compiling.get("error").get("code").asInt());

            reloads.reloadAndWait("startup");
            JsonNode failedStatus = call(dispatcher, request(2, "status", "{}")).get("result");
            Assertions.assertEquals("error", failedStatus.get("status").asText());
            Assertions.assertTrue(failedStatus.get("error").get("message").asText().startsWith("No project.json found"));

            JsonNode failed = call(dispatcher, request(3, "compile", "{\"sql\": \"" + base64("select 1") + "\"}"));
            Assertions.assertEquals(10011, failed.get("error").get("code").asInt());
            Assertions.assertTrue(failed.get("error").get("data").get("message").asText().startsWith("No project.json found"));

            TestProjects.writeDemo(root);
            reloads.reloadAndWait("sighup");
            JsonNode status = call(dispatcher, request(4, "status", "{}")).get("result");
            Assertions.assertEquals("ready", status.get("status").asText());
            Assertions.assertEquals(ProcessHandle.current().pid(), status.get("pid").asLong());
            Assertions.assertTrue(status.get("timestamp").asText().endsWith("Z"));
            Assertions.assertTrue(status.get("logs").size() > 0);
            Assertions.assertFalse(status.has("error"));
        } finally {
            reloads.close();
            deleteRecursively(root);
        }
    }

    @Test
    void synchronousCallReturnsTheWorkerResult() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-dispatch-sync-");
        ObjectNode answer = Jsons.mapper().createObjectNode().put("compiled_sql", "select 1");
        ReloadController reloads = new ReloadController(() -> TestProjects.compile(root), null);
        try (TaskManager tasks = manager(root, reloads, ScriptedWorkerLauncher.answering(answer))) {
            TestProjects.writeDemo(root);
            reloads.reloadAndWait("startup");
            RpcDispatcher dispatcher = new RpcDispatcher(tasks);

            JsonNode ok = call(dispatcher, request(1, "compile", "{\"sql\": \"" + base64("select 1") + "\", \"name\": \"q\"}"));
            Assertions.assertEquals("select 1", ok.get("result").get("compiled_sql").asText());
            Assertions.assertEquals(1, ok.get("id").asInt());

            JsonNode badBase64 = call(dispatcher, request(2, "run", "{\"sql\": \"%%%\"}"));
            Assertions.assertEquals(-32602, badBase64.get("error").get("code").asInt());
            Assertions.assertTrue(badBase64.get("error").get("data").get("message").asText().contains("sql must be base64"));

            JsonNode missingSql = call(dispatcher, request(3, "run", "{}"));
            Assertions.assertEquals(-32602, missingSql.get("error").get("code").asInt());

            JsonNode badTimeout = call(dispatcher, request(4, "run_project", "{\"timeout\": -1}"));
            Assertions.assertEquals(-32602, badTimeout.get("error").get("code").asInt());
            JsonNode tinyTimeout = call(dispatcher, request(4, "run_project", "{\"timeout\": 0.0001}"));
            Assertions.assertEquals(-32602, tinyTimeout.get("error").get("code").asInt());
            Assertions.assertTrue(tinyTimeout.get("error").get("data").get("message").asText().contains("at least 0.001 seconds"));

            JsonNode project = call(dispatcher, request(5, "test_project", "{\"models\": \"order_totals stg_orders\"}"));
            Assertions.assertEquals("select 1", project.get("result").get("compiled_sql").asText());

            JsonNode done = call(dispatcher, request(6, "ps", "{\"completed\": true, \"active\": false}")).get("result");
            Assertions.assertEquals(2, done.get("rows").size());
            Assertions.assertEquals("finished", done.get("rows").get(0).get("state").asText());
        } finally {
            reloads.close();
            deleteRecursively(root);
        }
    }

    @Test
    void asyncTaskCanBePolledListedAndKilled() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-dispatch-async-");
        ReloadController reloads = new ReloadController(() -> TestProjects.compile(root), null);
        try (TaskManager tasks = manager(root, reloads, ScriptedWorkerLauncher.hanging())) {
            TestProjects.writeDemo(root);
            reloads.reloadAndWait("startup");
            RpcDispatcher dispatcher = new RpcDispatcher(tasks);

            JsonNode accepted = call(dispatcher, request(1, "run",
                    "{\"sql\": \"" + base64("select 1") + "\", \"name\": \"slow\", \"async\": true}")).get("result");
            String token = accepted.get("request_token").asText();
            Task task = tasks.registry().get(token).orElseThrow();
            awaitRunningWithLogs(task);

            JsonNode duplicate = call(dispatcher, request(1, "run", "{\"sql\": \"" + base64("select 2") + "\"}"));
            Assertions.assertEquals(10002, duplicate.get("error").get("code").asInt());
            Assertions.assertEquals(token, duplicate.get("error").get("data").get("task_id").asText());

            JsonNode polled = call(dispatcher, request(2, "poll", "{\"request_token\": \"" + token + "\"}")).get("result");
            Assertions.assertEquals("running", polled.get("state").asText());
            Assertions.assertEquals("On rpc.slow: select 1", polled.get("logs").get(0).get("message").asText());
            JsonNode tail = call(dispatcher, request(3, "poll",
                    "{\"request_token\": \"" + token + "\", \"logs_start\": 100}")).get("result");
            Assertions.assertEquals(0, tail.get("logs").size());

            JsonNode active = call(dispatcher, request(4, "ps", "{}")).get("result");
            Assertions.assertEquals(1, active.get("rows").size());
            Assertions.assertEquals(token, active.get("rows").get(0).get("task_id").asText());
            Assertions.assertEquals(1, active.get("rows").get(0).get("request_id").asInt());

            JsonNode killed = call(dispatcher, request(5, "kill", "{\"task_id\": \"" + token + "\"}")).get("result");
            Assertions.assertEquals("killed", killed.get("state").asText());
            Assertions.assertEquals(TaskState.KILLED, task.state());

            JsonNode afterKill = call(dispatcher, request(6, "poll", "{\"request_token\": \"" + token + "\"}"));
            Assertions.assertEquals(10009, afterKill.get("error").get("code").asInt());
            Assertions.assertTrue(afterKill.get("error").get("data").get("logs").size() > 0);

            JsonNode unknownKill = call(dispatcher, request(7, "kill", "{\"task_id\": \"missing\"}"));
            Assertions.assertEquals(-32602, unknownKill.get("error").get("code").asInt());
            JsonNode unknownPoll = call(dispatcher, request(8, "poll", "{\"request_token\": \"missing\"}"));
            Assertions.assertEquals(-32602, unknownPoll.get("error").get("code").asInt());

            Assertions.assertEquals(0, call(dispatcher, request(9, "ps", "{}")).get("result").get("rows").size());
        } finally {
            reloads.close();
            deleteRecursively(root);
        }
    }

    private static TaskManager manager(Path root, ReloadController reloads, ScriptedWorkerLauncher.Script script) {
        TaskManager tasks = new TaskManager(new ScriptedWorkerLauncher(script), reloads, TestProjects.sqlite(root), null,
                Duration.ofSeconds(2), Duration.ofMillis(50));
        tasks.start();
        return tasks;
    }

    private static JsonNode call(RpcDispatcher dispatcher, String body) throws IOException {
        return Jsons.mapper().readTree(dispatcher.handle(body));
    }

    private static String request(int id, String method, String params) {
        return "{\"jsonrpc\": \"2.0\", \"id\": " + id + ", \"method\": \"" + method + "\", \"params\": " + params + "}";
    }

    private static String base64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    private static void awaitRunningWithLogs(Task task) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline && (task.state() != TaskState.RUNNING || task.logs().isEmpty())) {
            Thread.sleep(10L);
        }
        Assertions.assertEquals(TaskState.RUNNING, task.state());
        Assertions.assertFalse(task.logs().isEmpty());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
