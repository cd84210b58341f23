package io.sqlrpc.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sqlrpc.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ServerConfig {
    public static final String SETTINGS_FILE = "sqlrpc-settings.json";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8580;
    public static final String DEFAULT_PATH = "/jsonrpc";
    public static final String DEFAULT_STATE_DIR = ".sqlrpc";
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 200L;
    public static final long DEFAULT_KILL_GRACE_MS = 5_000L;

    private final String host;
    private final int port;
    private final String path;
    private final Path projectDir;
    private final Path stateDir;
    private final Path profileFile;
    private final Map<String, Object> vars;
    private final Duration watchdogInterval;
    private final Duration killGrace;
    private final List<String> workerJvmArgs;

    public ServerConfig(
            String host,
            int port,
            String path,
            Path projectDir,
            Path stateDir,
            Path profileFile,
            Map<String, Object> vars,
            Duration watchdogInterval,
            Duration killGrace,
            List<String> workerJvmArgs
    ) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        if (watchdogInterval.isNegative() || watchdogInterval.isZero()) {
            throw new IllegalArgumentException("watchdog interval must be positive");
        }
        if (killGrace.isNegative()) {
            throw new IllegalArgumentException("kill grace period cannot be negative");
        }
        this.host = host;
        this.port = port;
        this.path = path;
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.stateDir = stateDir.toAbsolutePath().normalize();
        this.profileFile = profileFile;
        this.vars = vars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        this.watchdogInterval = watchdogInterval;
        this.killGrace = killGrace;
        this.workerJvmArgs = workerJvmArgs == null ? List.of() : List.copyOf(workerJvmArgs);
    }

    public static ServerConfig defaults(Path projectDir) {
        return load(projectDir, Settings.empty());
    }

    public static ServerConfig load(Path projectDir, Settings overrides) {
        Path root = projectDir.toAbsolutePath().normalize();
        Settings file = readSettings(root.resolve(SETTINGS_FILE));
        Settings merged = overrides.over(file);
        Path stateDir = merged.stateDir() == null ? root.resolve(DEFAULT_STATE_DIR) : root.resolve(merged.stateDir());
        Path profile = merged.profile() == null ? root.resolve("profile.json") : root.resolve(merged.profile());
        return new ServerConfig(
                merged.host() == null ? DEFAULT_HOST : merged.host(),
                merged.port() == null ? DEFAULT_PORT : merged.port(),
                merged.path() == null ? DEFAULT_PATH : merged.path(),
                root,
                stateDir,
                profile,
                merged.vars(),
                Duration.ofMillis(merged.watchdogIntervalMs() == null ? DEFAULT_WATCHDOG_INTERVAL_MS : merged.watchdogIntervalMs()),
                Duration.ofMillis(merged.killGraceMs() == null ? DEFAULT_KILL_GRACE_MS : merged.killGraceMs()),
                merged.workerJvmArgs()
        );
    }

    static Settings readSettings(Path file) {
        if (!Files.isRegularFile(file)) {
            return Settings.empty();
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), Settings.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String path() {
        return path;
    }

    public Path projectDir() {
        return projectDir;
    }

    public Path stateDir() {
        return stateDir;
    }

    public Path auditFile() {
        return stateDir.resolve("audit").resolve("audit.log");
    }

    public Path profileFile() {
        return profileFile;
    }

    public Map<String, Object> vars() {
        return vars;
    }

    public Duration watchdogInterval() {
        return watchdogInterval;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public List<String> workerJvmArgs() {
        return workerJvmArgs;
    }

    public record Settings(
            @JsonProperty("host") String host,
            @JsonProperty("port") Integer port,
            @JsonProperty("path") String path,
            @JsonProperty("state_dir") String stateDir,
            @JsonProperty("profile") String profile,
            @JsonProperty("watchdog_interval_ms") Long watchdogIntervalMs,
            @JsonProperty("kill_grace_ms") Long killGraceMs,
            @JsonProperty("worker_jvm_args") List<String> workerJvmArgs,
            @JsonProperty("vars") Map<String, Object> vars
    ) {
        public static Settings empty() {
            return new Settings(null, null, null, null, null, null, null, null, null);
        }

        Settings over(Settings lower) {
            Map<String, Object> mergedVars = new LinkedHashMap<>();
            if (lower.vars() != null) {
                mergedVars.putAll(lower.vars());
            }
            if (vars != null) {
                mergedVars.putAll(vars);
            }
            return new Settings(
                    host != null ? host : lower.host(),
                    port != null ? port : lower.port(),
                    path != null ? path : lower.path(),
                    stateDir != null ? stateDir : lower.stateDir(),
                    profile != null ? profile : lower.profile(),
                    watchdogIntervalMs != null ? watchdogIntervalMs : lower.watchdogIntervalMs(),
                    killGraceMs != null ? killGraceMs : lower.killGraceMs(),
                    workerJvmArgs != null ? workerJvmArgs : lower.workerJvmArgs(),
                    mergedVars
            );
        }
    }
}
