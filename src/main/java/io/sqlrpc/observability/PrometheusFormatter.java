package io.sqlrpc.observability;

import java.util.Map;

public final class PrometheusFormatter {
    private static final String[] SERVER_STATES = {"compiling", "ready", "error"};

    private PrometheusFormatter() {
    }

    public static String format(MetricsSnapshot stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "sqlrpc_tasks_total", "Tasks grouped by state", "state", stats.tasksByState());
        appendMapGauge(sb, "sqlrpc_tasks_by_method_total", "Tasks grouped by RPC method", "method", stats.tasksByMethod());
        for (String state : SERVER_STATES) {
            appendGauge(sb, "sqlrpc_server_state", "Server readiness (1 for the current state)", "state", state,
                    state.equals(stats.serverState()) ? 1L : 0L);
        }
        appendGauge(sb, "sqlrpc_active_workers", "Worker processes currently running", null, null, stats.activeWorkers());
        appendGauge(sb, "sqlrpc_reload_total", "Project reloads by outcome", "result", "success", stats.reloadSuccessTotal());
        appendGauge(sb, "sqlrpc_reload_total", "Project reloads by outcome", "result", "failure", stats.reloadFailureTotal());
        appendGauge(sb, "sqlrpc_task_kill_total", "Tasks killed by request", null, null, stats.killTotal());
        appendGauge(sb, "sqlrpc_task_timeout_total", "Tasks terminated by the timeout watchdog", null, null, stats.timeoutTotal());
        appendGauge(sb, "sqlrpc_task_rejected_total", "Task requests rejected before a task was created", null, null, stats.rejectedTotal());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
