package io.sqlrpc.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.sqlrpc.util.Hashing;
import io.sqlrpc.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of task and reload events. Each row carries the hash of the previous row so a
 * truncated or edited file is detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger LOG = LogManager.getLogger(AuditLogger.class);

    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    public synchronized int verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int count = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            count++;
            Map<String, Object> row;
            try {
                row = Jsons.compact().readValue(line, Jsons.compact().getTypeFactory()
                        .constructMapType(LinkedHashMap.class, String.class, Object.class));
            } catch (IOException e) {
                throw new IllegalStateException("Audit row " + count + " is not valid JSON", e);
            }
            Object hash = row.remove("hash");
            if (!expectedPrev.equals(row.get("prev_hash"))) {
                throw new IllegalStateException("Audit row " + count + " breaks the hash chain");
            }
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!recomputed.equals(hash)) {
                throw new IllegalStateException("Audit row " + count + " hash mismatch");
            }
            expectedPrev = recomputed;
        }
        return count;
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Could not read the last audit hash from {}, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String resource,
            String result,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, String taskId, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, taskId, details == null ? Map.of() : details);
        }
    }
}
