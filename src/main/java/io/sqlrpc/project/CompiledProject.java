package io.sqlrpc.project;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sqlrpc.compiler.CompilationException;
import io.sqlrpc.compiler.NodeResolver;
import io.sqlrpc.compiler.ResolvedRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class CompiledProject {
    private final String name;
    private final String defaultSchema;
    private final List<ProjectNode> nodes;
    private final List<String> macros;
    private final Map<String, Object> vars;
    private final String compiledAt;
    private final Map<String, ProjectNode> byUniqueId;

    @JsonCreator
    public CompiledProject(
            @JsonProperty("name") String name,
            @JsonProperty("default_schema") String defaultSchema,
            @JsonProperty("nodes") List<ProjectNode> nodes,
            @JsonProperty("macros") List<String> macros,
            @JsonProperty("vars") Map<String, Object> vars,
            @JsonProperty("compiled_at") String compiledAt
    ) {
        this.name = name;
        this.defaultSchema = defaultSchema;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.macros = macros == null ? List.of() : List.copyOf(macros);
        this.vars = vars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(vars));
        this.compiledAt = compiledAt;
        Map<String, ProjectNode> index = new LinkedHashMap<>();
        for (ProjectNode node : this.nodes) {
            index.put(node.uniqueId(), node);
        }
        this.byUniqueId = Collections.unmodifiableMap(index);
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("default_schema")
    public String defaultSchema() {
        return defaultSchema;
    }

    @JsonProperty("nodes")
    public List<ProjectNode> nodes() {
        return nodes;
    }

    @JsonProperty("macros")
    public List<String> macros() {
        return macros;
    }

    @JsonProperty("vars")
    public Map<String, Object> vars() {
        return vars;
    }

    @JsonProperty("compiled_at")
    public String compiledAt() {
        return compiledAt;
    }

    public Optional<ProjectNode> node(String uniqueId) {
        return Optional.ofNullable(byUniqueId.get(uniqueId));
    }

    public Optional<ProjectNode> find(ResourceType type, String nodeName) {
        return node(uniqueId(type, nodeName));
    }

    public List<ProjectNode> ofType(ResourceType type) {
        List<ProjectNode> out = new ArrayList<>();
        for (ProjectNode node : nodes) {
            if (node.resourceType() == type) {
                out.add(node);
            }
        }
        return out;
    }

    public List<ProjectNode> select(ResourceType type, Collection<String> selection) {
        if (selection == null || selection.isEmpty()) {
            return ofType(type);
        }
        Set<String> wanted = new LinkedHashSet<>(selection);
        List<ProjectNode> out = new ArrayList<>();
        for (ProjectNode node : ofType(type)) {
            if (wanted.contains(node.name()) || wanted.contains(node.uniqueId())) {
                out.add(node);
            }
        }
        return out;
    }

    public String uniqueId(ResourceType type, String nodeName) {
        return type.wireName() + "." + name + "." + nodeName;
    }

    public String sourceId(String sourceName, String tableName) {
        return ResourceType.SOURCE.wireName() + "." + name + "." + sourceName + "." + tableName;
    }

    public NodeResolver resolver() {
        return new NodeResolver() {
            @Override
            public ResolvedRef ref(String target) throws CompilationException {
                ProjectNode model = byUniqueId.get(uniqueId(ResourceType.MODEL, target));
                if (model != null) {
                    return toRef(model);
                }
                ProjectNode seed = byUniqueId.get(uniqueId(ResourceType.SEED, target));
                if (seed != null) {
                    return toRef(seed);
                }
                throw new CompilationException("ref", "Model '" + target + "' was not found");
            }

            @Override
            public ResolvedRef source(String sourceName, String tableName) throws CompilationException {
                ProjectNode source = byUniqueId.get(sourceId(sourceName, tableName));
                if (source == null) {
                    throw new CompilationException("source", "Source '" + sourceName + "." + tableName + "' was not found");
                }
                return toRef(source);
            }

            @Override
            public Object var(String varName) {
                return vars.get(varName);
            }
        };
    }

    static ResolvedRef toRef(ProjectNode node) {
        if (node.ephemeral()) {
            return ResolvedRef.ephemeral(node.uniqueId(), Relations.cteName(node.name()), node.compiledSql());
        }
        return ResolvedRef.relation(node.uniqueId(), node.relation());
    }
}
