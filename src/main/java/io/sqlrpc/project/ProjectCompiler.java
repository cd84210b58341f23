package io.sqlrpc.project;

import io.sqlrpc.compiler.CompilationException;
import io.sqlrpc.compiler.CompiledSql;
import io.sqlrpc.compiler.NodeResolver;
import io.sqlrpc.compiler.ResolvedRef;
import io.sqlrpc.compiler.SqlCompiler;
import io.sqlrpc.compiler.SqlSource;
import io.sqlrpc.util.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ProjectCompiler {
    private static final Logger LOG = LogManager.getLogger(ProjectCompiler.class);

    private final SqlCompiler compiler;

    public ProjectCompiler(SqlCompiler compiler) {
        this.compiler = compiler;
    }

    public CompiledProject compile(ProjectSources sources, String defaultSchema) {
        Run run = new Run(sources, defaultSchema);
        try {
            run.compileAll();
        } catch (CompilationException e) {
            CompilationException reported = run.firstFailure == null ? e : run.firstFailure;
            throw new ProjectCompilationException(reported.getMessage(), reported);
        }
        CompiledProject project = new CompiledProject(
                sources.definition().name(),
                defaultSchema,
                run.ordered,
                sources.macros(),
                sources.vars(),
                Timestamps.format(Instant.now())
        );
        LOG.info("Compiled project {}: {} models, {} tests, {} seeds, {} sources",
                project.name(),
                project.ofType(ResourceType.MODEL).size(),
                project.ofType(ResourceType.TEST).size(),
                project.ofType(ResourceType.SEED).size(),
                project.ofType(ResourceType.SOURCE).size());
        return project;
    }

    private final class Run {
        private final ProjectSources sources;
        private final String schema;
        private final String projectName;
        private final Map<String, SourceFile> modelFiles = new LinkedHashMap<>();
        private final Map<String, ProjectNode> seeds = new LinkedHashMap<>();
        private final Map<String, ProjectNode> sourceNodes = new LinkedHashMap<>();
        private final Map<String, ProjectNode> models = new LinkedHashMap<>();
        private final Set<String> visiting = new LinkedHashSet<>();
        private final List<ProjectNode> ordered = new ArrayList<>();
        private CompilationException firstFailure;

        private Run(ProjectSources sources, String schema) {
            this.sources = sources;
            this.schema = schema;
            this.projectName = sources.definition().name();
        }

        void compileAll() throws CompilationException {
            for (Map.Entry<String, ProjectDefinition.SourceDefinition> source : sources.definition().sources().entrySet()) {
                String sourceSchema = source.getValue().schema() == null || source.getValue().schema().isBlank()
                        ? schema
                        : source.getValue().schema();
                for (String table : source.getValue().tables().keySet()) {
                    String uniqueId = ResourceType.SOURCE.wireName() + "." + projectName + "." + source.getKey() + "." + table;
                    ProjectNode node = new ProjectNode(
                            uniqueId, table, ResourceType.SOURCE, null, null, null, null,
                            Relations.quote(sourceSchema, source.getValue().identifier(table)), null, List.of()
                    );
                    sourceNodes.put(source.getKey() + "." + table, node);
                    ordered.add(node);
                }
            }
            for (SourceFile seed : sources.seeds()) {
                ProjectNode node = new ProjectNode(
                        uniqueId(ResourceType.SEED, seed.name()), seed.name(), ResourceType.SEED,
                        seed.relativePath(), seed.absolutePath().toString(), null, null,
                        Relations.quote(schema, seed.name()), null, List.of()
                );
                seeds.put(seed.name(), node);
                ordered.add(node);
            }
            for (SourceFile model : sources.models()) {
                modelFiles.put(model.name(), model);
            }
            for (String modelName : modelFiles.keySet()) {
                compileModel(modelName);
            }
            for (SourceFile test : sources.tests()) {
                String uniqueId = uniqueId(ResourceType.TEST, test.name());
                CompiledSql compiled = compileFile(test, "test " + uniqueId + " (" + test.relativePath() + ")");
                ordered.add(new ProjectNode(
                        uniqueId, test.name(), ResourceType.TEST, test.relativePath(), test.absolutePath().toString(),
                        test.contents(), compiled.compiledSql(), null, null, compiled.dependsOn()
                ));
            }
        }

        private ProjectNode compileModel(String modelName) throws CompilationException {
            ProjectNode done = models.get(modelName);
            if (done != null) {
                return done;
            }
            SourceFile file = modelFiles.get(modelName);
            String uniqueId = uniqueId(ResourceType.MODEL, modelName);
            visiting.add(modelName);
            CompiledSql compiled = compileFile(file, "model " + uniqueId + " (" + file.relativePath() + ")");
            visiting.remove(modelName);
            Materialization materialization = sources.definition().materializationOf(modelName);
            ProjectNode node = new ProjectNode(
                    uniqueId, modelName, ResourceType.MODEL, file.relativePath(), file.absolutePath().toString(),
                    file.contents(), compiled.compiledSql(),
                    materialization == Materialization.EPHEMERAL ? null : Relations.quote(schema, modelName),
                    materialization, compiled.dependsOn()
            );
            models.put(modelName, node);
            ordered.add(node);
            return node;
        }

        private CompiledSql compileFile(SourceFile file, String description) throws CompilationException {
            try {
                return compiler.compile(
                        new SqlSource(file.name(), description, file.contents(), sources.macros()),
                        resolver()
                );
            } catch (CompilationException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
                throw e;
            }
        }

        private NodeResolver resolver() {
            return new NodeResolver() {
                @Override
                public ResolvedRef ref(String target) throws CompilationException {
                    if (visiting.contains(target)) {
                        List<String> cycle = new ArrayList<>(visiting);
                        cycle = cycle.subList(cycle.indexOf(target), cycle.size());
                        throw new CompilationException("ref", "Found a cycle: " + String.join(" -> ", cycle) + " -> " + target);
                    }
                    if (modelFiles.containsKey(target)) {
                        return CompiledProject.toRef(compileModel(target));
                    }
                    ProjectNode seed = seeds.get(target);
                    if (seed != null) {
                        return CompiledProject.toRef(seed);
                    }
                    throw new CompilationException("ref", "Model '" + target + "' was not found");
                }

                @Override
                public ResolvedRef source(String sourceName, String tableName) throws CompilationException {
                    ProjectNode node = sourceNodes.get(sourceName + "." + tableName);
                    if (node == null) {
                        throw new CompilationException("source", "Source '" + sourceName + "." + tableName + "' was not found");
                    }
                    return CompiledProject.toRef(node);
                }

                @Override
                public Object var(String varName) {
                    return sources.vars().get(varName);
                }
            };
        }

        private String uniqueId(ResourceType type, String nodeName) {
            return type.wireName() + "." + projectName + "." + nodeName;
        }
    }
}
