package io.sqlrpc.observability;

import java.util.Map;

public record MetricsSnapshot(
        Map<String, Integer> tasksByState,
        Map<String, Integer> tasksByMethod,
        String serverState,
        long activeWorkers,
        long reloadSuccessTotal,
        long reloadFailureTotal,
        long killTotal,
        long timeoutTotal,
        long rejectedTotal
) {
}
