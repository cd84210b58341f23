package io.sqlrpc;

import io.sqlrpc.cli.SqlRpcCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SqlRpcCommand()).execute(args);
        System.exit(code);
    }
}
