package io.sqlrpc.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.sqlrpc.TestProjects;
import io.sqlrpc.config.ServerConfig;
import io.sqlrpc.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Drives a real server over HTTP with forked worker JVMs.
 */
final class SqlRpcServerEndToEndTest {
    private static final String ENDLESS_QUERY =
            "with recursive r(i) as (select 1 union all select i + 1 from r) select count(*) from r";

    private final HttpClient client = HttpClient.newHttpClient();

    @Test
    void servesQueriesKillsAndTimeoutsOverHttp() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-e2e-");
        TestProjects.writeDemo(root);
        ServerConfig config = new ServerConfig("127.0.0.1", 0, "/jsonrpc", root, root.resolve(".sqlrpc"),
                root.resolve("profile.json"), Map.of(), Duration.ofMillis(50), Duration.ofSeconds(2), List.of());
        try (SqlRpcServer server = new SqlRpcServer(config)) {
            server.start();
            URI rpc = URI.create("http://127.0.0.1:" + server.port() + "/jsonrpc");
            awaitReady(rpc);
            Assertions.assertEquals(Long.toString(ProcessHandle.current().pid()),
                    Files.readString(root.resolve(".sqlrpc/sqlrpc.pid")).trim());

            JsonNode compiled = call(rpc, 1, "compile", "{\"sql\": \"" + base64("select * from ${ref(\"order_totals\")}") + "\"}");
            Assertions.assertEquals("select * from \"main\".\"order_totals\"", compiled.get("result").get("compiled_sql").asText(),
                    compiled.toString());

            JsonNode seeded = call(rpc, 2, "seed_project", "{}");
            Assertions.assertTrue(seeded.get("result").get("success").asBoolean(), seeded.toString());
            JsonNode counted = call(rpc, 3, "run", "{\"sql\": \"" + base64("select count(*) as n from ${ref(\"orders\")}") + "\"}");
            Assertions.assertEquals("[[4]]", counted.get("result").get("table").get("rows").toString(), counted.toString());

            JsonNode accepted = call(rpc, 4, "run", "{\"sql\": \"" + base64(ENDLESS_QUERY) + "\", \"async\": true}");
            String token = accepted.get("result").get("request_token").asText();
            awaitRunningWithLogs(rpc, token);
            JsonNode killed = call(rpc, 5, "kill", "{\"task_id\": \"" + token + "\"}");
            Assertions.assertEquals("killed", killed.get("result").get("state").asText());
            JsonNode afterKill = call(rpc, 6, "poll", "{\"request_token\": \"" + token + "\"}");
            Assertions.assertEquals(10009, afterKill.get("error").get("code").asInt());
            Assertions.assertTrue(afterKill.get("error").get("data").get("logs").size() > 0);

            JsonNode timedOut = call(rpc, 7, "run", "{\"sql\": \"" + base64(ENDLESS_QUERY) + "\", \"timeout\": 1}");
            Assertions.assertEquals(10008, timedOut.get("error").get("code").asInt());
            Assertions.assertEquals(1, timedOut.get("error").get("data").get("timeout").asInt());

            HttpResponse<String> metrics = client.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/metrics")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(200, metrics.statusCode());
            Assertions.assertTrue(metrics.body().contains("sqlrpc_server_state{state=\"ready\"} 1"));
            Assertions.assertTrue(metrics.body().contains("sqlrpc_task_kill_total 1"));
            Assertions.assertTrue(metrics.body().contains("sqlrpc_task_timeout_total 1"));

            HttpResponse<String> wrongVerb = client.send(HttpRequest.newBuilder(rpc).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(405, wrongVerb.statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private void awaitReady(URI rpc) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        String status = "";
        while (System.nanoTime() < deadline) {
            status = call(rpc, 0, "status", "{}").get("result").get("status").asText();
            if (!"compiling".equals(status)) {
                break;
            }
            Thread.sleep(50L);
        }
        Assertions.assertEquals("ready", status);
    }

    private void awaitRunningWithLogs(URI rpc, String token) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        JsonNode polled = null;
        while (System.nanoTime() < deadline) {
            polled = call(rpc, 0, "poll", "{\"request_token\": \"" + token + "\"}").get("result");
            if ("running".equals(polled.get("state").asText()) && polled.get("logs").size() > 0) {
                return;
            }
            Thread.sleep(50L);
        }
        Assertions.fail("task never reported running with logs: " + polled);
    }

    private JsonNode call(URI rpc, int id, String method, String params) throws IOException, InterruptedException {
        String body = "{\"jsonrpc\": \"2.0\", \"id\": " + id + ", \"method\": \"" + method + "\", \"params\": " + params + "}";
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(rpc)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        Assertions.assertEquals(200, response.statusCode());
        return Jsons.mapper().readTree(response.body());
    }

    private static String base64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
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
