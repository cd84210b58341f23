package io.sqlrpc.rpc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sqlrpc.model.TaskError;

public class RpcException extends RuntimeException {
    private final int code;
    private final String rpcMessage;
    private final transient ObjectNode data;

    public RpcException(RpcErrorCode code, String detail) {
        this(code, detail, null);
    }

    public RpcException(RpcErrorCode code, String detail, ObjectNode data) {
        this(code.code(), code.message(), detail, data);
    }

    private RpcException(int code, String rpcMessage, String detail, ObjectNode data) {
        super(detail == null ? rpcMessage : rpcMessage + ": " + detail);
        this.code = code;
        this.rpcMessage = rpcMessage;
        this.data = data;
    }

    public static RpcException fromTaskError(TaskError error) {
        return new RpcException(error.code(), error.message(), null, error.data());
    }

    public int code() {
        return code;
    }

    public String rpcMessage() {
        return rpcMessage;
    }

    public ObjectNode data() {
        return data;
    }

    public TaskError toTaskError() {
        return new TaskError(code, rpcMessage, data);
    }
}
