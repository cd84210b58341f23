package io.sqlrpc.executor;

public enum TerminationReason {
    KILL(2),
    TIMEOUT(15);

    private final int signum;

    TerminationReason(int signum) {
        this.signum = signum;
    }

    public int signum() {
        return signum;
    }
}
