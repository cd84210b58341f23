package io.sqlrpc.worker;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.adapter.ConnectionProfile;
import io.sqlrpc.adapter.DatabaseException;
import io.sqlrpc.adapter.SqlAdapter;
import io.sqlrpc.model.ResultTable;
import io.sqlrpc.model.TaskRequest;
import io.sqlrpc.model.TimingInfo;
import io.sqlrpc.project.CompiledProject;
import io.sqlrpc.project.Materialization;
import io.sqlrpc.project.ProjectNode;
import io.sqlrpc.project.ResourceType;
import io.sqlrpc.util.Jsons;
import io.sqlrpc.util.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

final class ProjectOperations {
    private static final Logger LOG = LogManager.getLogger(ProjectOperations.class);
    static final int SEED_PREVIEW_ROWS = 20;

    private final Function<ConnectionProfile, SqlAdapter> adapters;

    ProjectOperations(Function<ConnectionProfile, SqlAdapter> adapters) {
        this.adapters = adapters;
    }

    ObjectNode compileProject(TaskRequest request) {
        CompiledProject project = request.project();
        List<ProjectNode> nodes = new ArrayList<>();
        for (ProjectNode model : project.select(ResourceType.MODEL, request.models())) {
            if (!model.ephemeral()) {
                nodes.add(model);
            }
        }
        nodes.addAll(project.select(ResourceType.TEST, request.models()));
        Instant started = Instant.now();
        List<ObjectNode> results = new ArrayList<>();
        int index = 0;
        for (ProjectNode node : nodes) {
            index++;
            Instant at = Instant.now();
            LOG.info("{} of {} OK compiled {} {}", index, nodes.size(), node.resourceType().wireName(), node.uniqueId());
            results.add(nodeResult(node, "success", null, at, at, at, at));
        }
        return summary(results, started);
    }

    ObjectNode runProject(TaskRequest request) {
        CompiledProject project = request.project();
        List<ProjectNode> nodes = new ArrayList<>();
        for (ProjectNode model : project.select(ResourceType.MODEL, request.models())) {
            if (!model.ephemeral()) {
                nodes.add(model);
            }
        }
        Instant started = Instant.now();
        List<ObjectNode> results = new ArrayList<>();
        Set<String> failed = new HashSet<>();
        try (SqlAdapter adapter = adapters.apply(request.profile())) {
            int index = 0;
            for (ProjectNode node : nodes) {
                index++;
                String kind = node.materialized().wireName();
                Instant at = Instant.now();
                String upstream = failedUpstream(project, node, failed);
                if (upstream != null) {
                    failed.add(node.uniqueId());
                    LOG.info("{} of {} SKIP relation {} because {} failed", index, nodes.size(), node.relation(), upstream);
                    results.add(nodeResult(node, "skipped", "Skipped because upstream " + upstream + " failed", at, at, at, at));
                    continue;
                }
                LOG.info("{} of {} START {} model {}", index, nodes.size(), kind, node.uniqueId());
                Instant executeStarted = Instant.now();
                try {
                    adapter.dropRelation(node.relation());
                    adapter.execute(createStatement(node), node.uniqueId(), false);
                    Instant executeCompleted = Instant.now();
                    String status = node.materialized() == Materialization.TABLE ? "CREATE TABLE" : "CREATE VIEW";
                    LOG.info("{} of {} OK created {} model {}", index, nodes.size(), kind, node.uniqueId());
                    results.add(nodeResult(node, status, null, at, at, executeStarted, executeCompleted));
                } catch (DatabaseException e) {
                    failed.add(node.uniqueId());
                    LOG.error("{} of {} ERROR creating {} model {}: {}", index, nodes.size(), kind, node.uniqueId(), e.getMessage());
                    results.add(nodeResult(node, "error", databaseError(node, e), at, at, executeStarted, Instant.now()));
                }
            }
        }
        return summary(results, started);
    }

    ObjectNode testProject(TaskRequest request) {
        CompiledProject project = request.project();
        List<ProjectNode> tests = project.select(ResourceType.TEST, request.models());
        Instant started = Instant.now();
        List<ObjectNode> results = new ArrayList<>();
        try (SqlAdapter adapter = adapters.apply(request.profile())) {
            int index = 0;
            for (ProjectNode test : tests) {
                index++;
                Instant executeStarted = Instant.now();
                try {
                    ResultTable table = adapter.execute(
                            "select count(*) as failures from (\n" + test.compiledSql() + "\n) as sqlrpc_test",
                            test.uniqueId(),
                            true
                    );
                    long failures = firstNumber(table);
                    Instant executeCompleted = Instant.now();
                    LOG.info("{} of {} {} {}", index, tests.size(), failures == 0 ? "PASS" : "FAIL " + failures, test.uniqueId());
                    ObjectNode result = nodeResult(test, null, null, executeStarted, executeStarted, executeStarted, executeCompleted);
                    result.put("status", failures);
                    result.put("fail", failures > 0);
                    results.add(result);
                } catch (DatabaseException e) {
                    LOG.error("{} of {} ERROR {}: {}", index, tests.size(), test.uniqueId(), e.getMessage());
                    results.add(nodeResult(test, "error", databaseError(test, e),
                            executeStarted, executeStarted, executeStarted, Instant.now()));
                }
            }
        }
        return summary(results, started);
    }

    ObjectNode seedProject(TaskRequest request) {
        CompiledProject project = request.project();
        List<ProjectNode> seeds = project.select(ResourceType.SEED, request.models());
        Instant started = Instant.now();
        List<ObjectNode> results = new ArrayList<>();
        try (SqlAdapter adapter = adapters.apply(request.profile())) {
            int index = 0;
            for (ProjectNode seed : seeds) {
                index++;
                Instant executeStarted = Instant.now();
                try {
                    SeedLoader.SeedData data = SeedLoader.read(Path.of(seed.originalFilePath()));
                    adapter.loadTable(seed.relation(), data.columns(), data.types(), data.rows());
                    Instant executeCompleted = Instant.now();
                    LOG.info("{} of {} OK loaded seed file {} ({} rows)", index, seeds.size(), seed.uniqueId(), data.rows().size());
                    ObjectNode result = nodeResult(seed, "INSERT " + data.rows().size(), null,
                            executeStarted, executeStarted, executeStarted, executeCompleted);
                    if (request.show()) {
                        result.set("table", Jsons.mapper().valueToTree(
                                new ResultTable(data.columns(), data.rows()).limit(SEED_PREVIEW_ROWS)));
                    }
                    results.add(result);
                } catch (IOException e) {
                    LOG.error("{} of {} ERROR reading seed {}: {}", index, seeds.size(), seed.uniqueId(), e.getMessage());
                    results.add(nodeResult(seed, "error", "Could not read " + seed.path() + ": " + e.getMessage(),
                            executeStarted, executeStarted, executeStarted, Instant.now()));
                } catch (DatabaseException e) {
                    LOG.error("{} of {} ERROR loading seed {}: {}", index, seeds.size(), seed.uniqueId(), e.getMessage());
                    results.add(nodeResult(seed, "error", databaseError(seed, e),
                            executeStarted, executeStarted, executeStarted, Instant.now()));
                }
            }
        }
        return summary(results, started);
    }

    static String createStatement(ProjectNode node) {
        String kind = node.materialized() == Materialization.TABLE ? "table" : "view";
        return "create " + kind + " " + node.relation() + " as\n" + node.compiledSql().strip();
    }

    private static String failedUpstream(CompiledProject project, ProjectNode node, Set<String> failed) {
        for (String dependency : node.dependsOn()) {
            if (failed.contains(dependency)) {
                return dependency;
            }
            ProjectNode upstream = project.node(dependency).orElse(null);
            if (upstream != null && upstream.ephemeral()) {
                String nested = failedUpstream(project, upstream, failed);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static String databaseError(ProjectNode node, DatabaseException e) {
        return "Database Error in " + node.description() + "\n  " + e.getMessage();
    }

    private static long firstNumber(ResultTable table) {
        if (table.rows().isEmpty() || table.rows().get(0).isEmpty()) {
            return 0L;
        }
        Object value = table.rows().get(0).get(0);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return value == null ? 0L : Long.parseLong(value.toString());
    }

    private static ObjectNode nodeResult(
            ProjectNode node,
            String status,
            String error,
            Instant compileStarted,
            Instant compileCompleted,
            Instant executeStarted,
            Instant executeCompleted
    ) {
        ObjectNode result = Jsons.mapper().createObjectNode();
        result.set("node", Jsons.mapper().valueToTree(node));
        result.put("status", status);
        result.put("error", error);
        result.put("execution_time", Timestamps.elapsedSeconds(executeStarted, executeCompleted));
        ArrayNode timing = result.putArray("timing");
        timing.add(Jsons.mapper().valueToTree(TimingInfo.of("compile", compileStarted, compileCompleted)));
        timing.add(Jsons.mapper().valueToTree(TimingInfo.of("execute", executeStarted, executeCompleted)));
        return result;
    }

    private static ObjectNode summary(List<ObjectNode> results, Instant started) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        ArrayNode array = out.putArray("results");
        boolean success = true;
        for (ObjectNode result : results) {
            array.add(result);
            String status = result.path("status").asText();
            if ("error".equals(status) || "skipped".equals(status) || result.path("fail").asBoolean(false)) {
                success = false;
            }
        }
        Instant now = Instant.now();
        out.put("elapsed_time", Timestamps.elapsedSeconds(started, now));
        out.put("generated_at", Timestamps.format(now));
        out.put("success", success);
        return out;
    }
}
