package io.sqlrpc.project;

public final class Relations {
    public static final String CTE_PREFIX = "__sqlrpc__cte__";

    private Relations() {
    }

    public static String quote(String schema, String identifier) {
        if (schema == null || schema.isBlank()) {
            return quoteIdentifier(identifier);
        }
        return quoteIdentifier(schema) + "." + quoteIdentifier(identifier);
    }

    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String cteName(String nodeName) {
        return CTE_PREFIX + nodeName;
    }
}
