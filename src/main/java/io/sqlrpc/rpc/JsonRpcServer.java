package io.sqlrpc.rpc;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sqlrpc.observability.PrometheusFormatter;
import io.sqlrpc.runtime.TaskManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public final class JsonRpcServer implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(JsonRpcServer.class);
    public static final String METRICS_PATH = "/metrics";

    private final HttpServer server;
    private final ExecutorService exchanges;

    public JsonRpcServer(String host, int port, String path, RpcDispatcher dispatcher, TaskManager tasks) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        AtomicInteger ids = new AtomicInteger();
        this.exchanges = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sqlrpc-http-" + ids.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.createContext(path, exchange -> {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "POST");
                    send(exchange, 405, "text/plain; charset=utf-8", "Method Not Allowed");
                    return;
                }
                String body;
                try (InputStream in = exchange.getRequestBody()) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                send(exchange, 200, "application/json", dispatcher.handle(body));
            } catch (IOException | RuntimeException e) {
                LOG.error("Failed to answer {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                throw e;
            } finally {
                exchange.close();
            }
        });
        server.createContext(METRICS_PATH, exchange -> {
            try {
                send(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", PrometheusFormatter.format(tasks.metrics()));
            } finally {
                exchange.close();
            }
        });
        server.setExecutor(exchanges);
    }

    public void start() {
        server.start();
        LOG.info("JSON-RPC server listening on http://{}:{}", server.getAddress().getHostString(), server.getAddress().getPort());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        exchanges.shutdownNow();
    }
}
