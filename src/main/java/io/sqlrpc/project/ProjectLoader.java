package io.sqlrpc.project;

import io.sqlrpc.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public final class ProjectLoader {
    private static final Logger LOG = LogManager.getLogger(ProjectLoader.class);

    private final Path root;

    public ProjectLoader(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public ProjectSources load(Map<String, Object> overrideVars) {
        Path definitionFile = root.resolve(ProjectDefinition.FILE_NAME);
        if (!Files.isRegularFile(definitionFile)) {
            throw new ProjectCompilationException("No " + ProjectDefinition.FILE_NAME + " found at path " + definitionFile);
        }
        ProjectDefinition definition;
        try {
            definition = Jsons.mapper().readValue(definitionFile.toFile(), ProjectDefinition.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ProjectCompilationException("Invalid " + ProjectDefinition.FILE_NAME + ": " + rootMessage(e), e);
        }

        List<SourceFile> models = collect(definition.modelPaths(), ".sql", true);
        List<SourceFile> seeds = collect(definition.seedPaths(), ".csv", false);
        List<SourceFile> tests = collect(definition.testPaths(), ".sql", true);
        List<String> macros = new ArrayList<>();
        for (SourceFile macro : collect(definition.macroPaths(), ".ftl", true)) {
            macros.add(macro.contents());
        }

        Map<String, String> seen = new HashMap<>();
        checkUnique(seen, models, "model");
        checkUnique(seen, seeds, "seed");
        Map<String, String> seenTests = new HashMap<>();
        checkUnique(seenTests, tests, "test");

        Map<String, Object> vars = new LinkedHashMap<>(definition.vars());
        if (overrideVars != null) {
            vars.putAll(overrideVars);
        }
        LOG.info("Found {} models, {} seeds, {} tests, {} macro files in {}",
                models.size(), seeds.size(), tests.size(), macros.size(), root);
        return new ProjectSources(root, definition, models, seeds, tests, macros, vars);
    }

    private List<SourceFile> collect(List<String> relativeDirs, String extension, boolean readContents) {
        List<SourceFile> out = new ArrayList<>();
        for (String relativeDir : relativeDirs) {
            Path dir = root.resolve(relativeDir).normalize();
            if (!dir.startsWith(root)) {
                throw new ProjectCompilationException("Path '" + relativeDir + "' escapes the project root");
            }
            if (!Files.isDirectory(dir)) {
                continue;
            }
            List<Path> files;
            try (Stream<Path> walk = Files.walk(dir)) {
                files = walk
                        .filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new ProjectCompilationException("Failed to list " + dir + ": " + e.getMessage(), e);
            }
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String name = fileName.substring(0, fileName.length() - extension.length());
                String relative = root.relativize(file).toString().replace('\\', '/');
                String contents = "";
                if (readContents) {
                    try {
                        contents = Files.readString(file, StandardCharsets.UTF_8);
                    } catch (IOException e) {
                        throw new ProjectCompilationException("Failed to read " + relative + ": " + e.getMessage(), e);
                    }
                }
                out.add(new SourceFile(name, relative, file, contents));
            }
        }
        return out;
    }

    private static void checkUnique(Map<String, String> seen, List<SourceFile> files, String kind) {
        for (SourceFile file : files) {
            String previous = seen.putIfAbsent(file.name(), file.relativePath());
            if (previous != null) {
                throw new ProjectCompilationException(
                        "Two resources share the name '" + file.name() + "' (" + kind + "): "
                                + previous + " and " + file.relativePath()
                );
            }
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message.lines().findFirst().orElse(message);
    }
}
