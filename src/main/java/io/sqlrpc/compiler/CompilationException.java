package io.sqlrpc.compiler;

public class CompilationException extends Exception {
    private final String nodeDescription;
    private final String detail;

    public CompilationException(String nodeDescription, String detail) {
        this(nodeDescription, detail, null);
    }

    public CompilationException(String nodeDescription, String detail, Throwable cause) {
        super("Compilation Error in " + nodeDescription + "\n  " + detail, cause);
        this.nodeDescription = nodeDescription;
        this.detail = detail;
    }

    public String nodeDescription() {
        return nodeDescription;
    }

    public String detail() {
        return detail;
    }
}
