package io.sqlrpc.project;

import java.nio.file.Path;

public record SourceFile(String name, String relativePath, Path absolutePath, String contents) {
}
