package io.sqlrpc.compiler;

public record ResolvedRef(String uniqueId, String rendered, String cteSql) {
    public static ResolvedRef relation(String uniqueId, String relation) {
        return new ResolvedRef(uniqueId, relation, null);
    }

    public static ResolvedRef ephemeral(String uniqueId, String cteName, String cteSql) {
        return new ResolvedRef(uniqueId, cteName, cteSql);
    }

    public boolean ephemeral() {
        return cteSql != null;
    }
}
