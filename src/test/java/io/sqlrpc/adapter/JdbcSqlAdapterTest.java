package io.sqlrpc.adapter;

import io.sqlrpc.model.ResultTable;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JdbcSqlAdapterTest {

    @Test
    void loadsTablesAndDropsViewsOrTables() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-adapter-");
        try (JdbcSqlAdapter adapter = new JdbcSqlAdapter(ConnectionProfile.sqlite(root.resolve("adapter.db")))) {
            adapter.loadTable("\"main\".\"people\"", List.of("id", "name"), List.of("integer", "text"),
                    List.of(List.<Object>of(1L, "ada"), List.<Object>of(2L, "grace")));
            ResultTable people = adapter.execute("select name from \"main\".\"people\" order by id", "test", true);
            Assertions.assertEquals(List.of("name"), people.columnNames());
            Assertions.assertEquals(List.of(List.of("ada"), List.of("grace")), people.rows());

            // Reloading replaces the table rather than appending to it.
            adapter.loadTable("\"main\".\"people\"", List.of("id", "name"), List.of("integer", "text"),
                    List.of(List.<Object>of(3L, "linus")));
            Assertions.assertEquals(1, adapter.execute("select * from \"main\".\"people\"", "test", true).rows().size());

            adapter.execute("create view \"main\".\"people_v\" as select * from \"main\".\"people\"", "test", false);
            adapter.dropRelation("\"main\".\"people_v\"");
            adapter.dropRelation("\"main\".\"people\"");
            adapter.dropRelation("\"main\".\"never_existed\"");
            ResultTable remaining = adapter.execute("select count(*) as n from sqlite_master where name like 'people%'", "test", true);
            Assertions.assertEquals(0, ((Number) remaining.rows().get(0).get(0)).intValue());

            ResultTable unfetched = adapter.execute("select 1", "test", false);
            Assertions.assertTrue(unfetched.rows().isEmpty());

            DatabaseException error = Assertions.assertThrows(DatabaseException.class,
                    () -> adapter.execute("select * from nowhere", "test", true));
            Assertions.assertTrue(error.getMessage().contains("no such table"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void profileFallsBackToProjectDatabase() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-profile-");
        try {
            ConnectionProfile fallback = ConnectionProfile.load(root.resolve("profile.json"), root);
            Assertions.assertEquals("sqlite", fallback.adapterType());
            Assertions.assertEquals("main", fallback.schema());
            Assertions.assertTrue(fallback.url().endsWith("sqlrpc.db"));

            Files.writeString(root.resolve("profile.json"),
                    "{\"url\": \"jdbc:postgresql://db/warehouse\", \"schema\": \"analytics\", \"user\": \"u\", \"password\": \"secret\"}");
            ConnectionProfile loaded = ConnectionProfile.load(root.resolve("profile.json"), root);
            Assertions.assertEquals("postgresql", loaded.adapterType());
            Assertions.assertEquals("analytics", loaded.schema());
            Assertions.assertFalse(loaded.toString().contains("secret"));
        } finally {
            deleteRecursively(root);
        }
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
