package io.sqlrpc.rpc;

public enum RpcErrorCode {
    PARSE_ERROR(-32700, "Parse error"),
    INVALID_REQUEST(-32600, "Invalid Request"),
    METHOD_NOT_FOUND(-32601, "Method not found"),
    INVALID_PARAMS(-32602, "Invalid params"),
    INTERNAL_ERROR(-32603, "Internal error"),
    RPC_INTERNAL_ERROR(10001, "RPC internal error"),
    DUPLICATE_REQUEST(10002, "Duplicate request id"),
    DATABASE_ERROR(10003, "Database Error"),
    COMPILATION_ERROR(10004, "Compilation Error"),
    RPC_TIMEOUT(10008, "RPC timeout error"),
    RPC_KILLED(10009, "RPC process killed"),
    SERVER_COMPILING(10010, "RPC server is compiling the project, call the \"status\" method for compile status"),
    SERVER_ERROR(10011, "RPC server failed to compile project, call the \"status\" method for compile status");

    private final int code;
    private final String message;

    RpcErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }
}
