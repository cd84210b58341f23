package io.sqlrpc.adapter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sqlrpc.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionProfile(
        @JsonProperty("url") String url,
        @JsonProperty("schema") String schema,
        @JsonProperty("user") String user,
        @JsonProperty("password") String password
) {
    public static final String FILE_NAME = "profile.json";
    public static final String DEFAULT_SCHEMA = "main";
    public static final String DEFAULT_DATABASE_FILE = "sqlrpc.db";

    public ConnectionProfile {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Connection profile must declare a JDBC 'url'");
        }
        url = url.trim();
        schema = schema == null || schema.isBlank() ? DEFAULT_SCHEMA : schema.trim();
    }

    public static ConnectionProfile sqlite(Path databaseFile) {
        return new ConnectionProfile("jdbc:sqlite:" + databaseFile.toAbsolutePath().normalize(), DEFAULT_SCHEMA, null, null);
    }

    public static ConnectionProfile load(Path file, Path projectDir) {
        if (file == null || !Files.isRegularFile(file)) {
            return sqlite(projectDir.resolve(DEFAULT_DATABASE_FILE));
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), ConnectionProfile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid connection profile " + file + ": " + e.getMessage(), e);
        }
    }

    public String adapterType() {
        if (!url.startsWith("jdbc:")) {
            return "jdbc";
        }
        int end = url.indexOf(':', 5);
        return end < 0 ? url.substring(5) : url.substring(5, end);
    }

    @Override
    public String toString() {
        return "ConnectionProfile[url=" + url + ", schema=" + schema + ", user=" + user + "]";
    }
}
