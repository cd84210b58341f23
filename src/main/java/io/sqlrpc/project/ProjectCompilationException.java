package io.sqlrpc.project;

public class ProjectCompilationException extends RuntimeException {
    public ProjectCompilationException(String message) {
        super(message);
    }

    public ProjectCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
