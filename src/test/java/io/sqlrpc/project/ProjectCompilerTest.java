package io.sqlrpc.project;

import io.sqlrpc.TestProjects;
import io.sqlrpc.compiler.FreemarkerSqlCompiler;
import io.sqlrpc.compiler.ResolvedRef;
import io.sqlrpc.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class ProjectCompilerTest {

    @Test
    void nodesComeAfterEverythingTheyDependOn() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-order-");
        try {
            CompiledProject project = TestProjects.compile(TestProjects.writeDemo(root));

            List<String> ids = new ArrayList<>();
            for (ProjectNode node : project.nodes()) {
                for (String dependency : node.dependsOn()) {
                    Assertions.assertTrue(ids.contains(dependency), node.uniqueId() + " listed before " + dependency);
                }
                ids.add(node.uniqueId());
            }
            Assertions.assertEquals(List.of(
                    "model.demo.customer_totals",
                    "model.demo.order_totals",
                    "model.demo.stg_orders",
                    "seed.demo.customers",
                    "seed.demo.orders",
                    "source.demo.crm.customers",
                    "test.demo.order_totals_positive"
            ), ids.stream().sorted().toList());
            Assertions.assertTrue(ids.indexOf("model.demo.stg_orders") < ids.indexOf("model.demo.order_totals"));
            Assertions.assertTrue(ids.indexOf("model.demo.order_totals") < ids.indexOf("model.demo.customer_totals"));
            Assertions.assertEquals("test.demo.order_totals_positive", ids.get(ids.size() - 1));

            ProjectNode customerTotals = project.find(ResourceType.MODEL, "customer_totals").orElseThrow();
            Assertions.assertEquals(List.of("source.demo.crm.customers", "model.demo.order_totals"), customerTotals.dependsOn());
            Assertions.assertEquals(Materialization.VIEW, customerTotals.materialized());
            Assertions.assertEquals("\"main\".\"customer_totals\"", customerTotals.relation());
            Assertions.assertTrue(customerTotals.compiledSql().contains("cast(t.total * 100 as integer) as total_cents"));
            Assertions.assertTrue(customerTotals.compiledSql().contains("from \"main\".\"customers\" c"));
            Assertions.assertEquals("models/customer_totals.sql", customerTotals.path());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void ephemeralModelsAreInlinedAsCtes() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-ephemeral-");
        try {
            CompiledProject project = TestProjects.compile(TestProjects.writeDemo(root));

            ProjectNode staging = project.find(ResourceType.MODEL, "stg_orders").orElseThrow();
            Assertions.assertTrue(staging.ephemeral());
            Assertions.assertNull(staging.relation());
            Assertions.assertEquals(List.of("seed.demo.orders"), staging.dependsOn());

            ProjectNode totals = project.find(ResourceType.MODEL, "order_totals").orElseThrow();
            Assertions.assertEquals(Materialization.TABLE, totals.materialized());
            Assertions.assertTrue(totals.compiledSql().startsWith(
                    "with __sqlrpc__cte__stg_orders as (\nselect id, customer_id, amount from \"main\".\"orders\" where amount >= 0\n) select"));
            Assertions.assertTrue(totals.compiledSql().contains("from __sqlrpc__cte__stg_orders"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void overrideVarsReplaceProjectVars() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-vars-");
        try {
            TestProjects.writeDemo(root);
            ProjectSources sources = new ProjectLoader(root).load(Map.of("min_amount", 20));
            CompiledProject project = new ProjectCompiler(new FreemarkerSqlCompiler()).compile(sources, "main");

            Assertions.assertEquals(20, project.vars().get("min_amount"));
            Assertions.assertTrue(project.find(ResourceType.MODEL, "stg_orders").orElseThrow()
                    .compiledSql().contains("amount >= 20"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void referenceCycleFailsTheCompile() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-cycle-");
        try {
            TestProjects.write(root, "project.json", "{\"name\": \"loop\"}");
            TestProjects.write(root, "models/a.sql", "select * from ${ref(\"b\")}");
            TestProjects.write(root, "models/b.sql", "select * from ${ref(\"a\")}");

            ProjectCompilationException error = Assertions.assertThrows(ProjectCompilationException.class,
                    () -> TestProjects.compile(root));
            Assertions.assertTrue(error.getMessage().contains("Found a cycle: a -> b -> a"), error.getMessage());
            Assertions.assertTrue(error.getMessage().startsWith("Compilation Error in model model.loop.b (models/b.sql)"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingReferenceNamesTheFailingNode() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-missing-");
        try {
            TestProjects.writeDemo(root);
            TestProjects.write(root, "models/broken.sql", "select * from ${ref(\"ghost\")}");

            ProjectCompilationException error = Assertions.assertThrows(ProjectCompilationException.class,
                    () -> TestProjects.compile(root));
            Assertions.assertEquals(
                    "Compilation Error in model model.demo.broken (models/broken.sql)\n  Model 'ghost' was not found",
                    error.getMessage()
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void loaderRejectsBrokenLayouts() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-layout-");
        try {
            ProjectCompilationException noDefinition = Assertions.assertThrows(ProjectCompilationException.class,
                    () -> new ProjectLoader(root).load(Map.of()));
            Assertions.assertTrue(noDefinition.getMessage().startsWith("No project.json found"));

            TestProjects.write(root, "project.json", "{\"models\": {}}");
            ProjectCompilationException noName = Assertions.assertThrows(ProjectCompilationException.class,
                    () -> new ProjectLoader(root).load(Map.of()));
            Assertions.assertTrue(noName.getMessage().contains("'name'"));

            TestProjects.writeDemo(root);
            TestProjects.write(root, "models/orders.sql", "select 1");
            ProjectCompilationException duplicate = Assertions.assertThrows(ProjectCompilationException.class,
                    () -> new ProjectLoader(root).load(Map.of()));
            Assertions.assertTrue(duplicate.getMessage().contains("'orders'"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void compiledGraphSurvivesTheWorkerHandoff() throws Exception {
        Path root = Files.createTempDirectory("sqlrpc-test-project-handoff-");
        try {
            CompiledProject original = TestProjects.compile(TestProjects.writeDemo(root));
            String json = Jsons.toCompactJson(original);
            CompiledProject copy = Jsons.compact().readValue(json, CompiledProject.class);

            Assertions.assertEquals(original.nodes(), copy.nodes());
            Assertions.assertEquals(original.macros(), copy.macros());
            ResolvedRef totals = copy.resolver().ref("order_totals");
            Assertions.assertEquals("\"main\".\"order_totals\"", totals.rendered());
            ResolvedRef staging = copy.resolver().ref("stg_orders");
            Assertions.assertTrue(staging.ephemeral());
            Assertions.assertEquals("__sqlrpc__cte__stg_orders", staging.rendered());
            Assertions.assertEquals(1, copy.select(ResourceType.MODEL, List.of("order_totals", "unknown")).size());
            Assertions.assertEquals(3, copy.select(ResourceType.MODEL, List.of()).size());
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
