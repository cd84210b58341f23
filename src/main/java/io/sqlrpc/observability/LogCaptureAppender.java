package io.sqlrpc.observability;

import io.sqlrpc.model.LogRecord;
import io.sqlrpc.util.Timestamps;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Property;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public final class LogCaptureAppender extends AbstractAppender {
    public static final String NAME = "SqlRpcCapture";
    public static final String SCOPE_KEY = "sqlrpc.scope";

    private static LogCaptureAppender instance;

    private final Map<String, Consumer<LogRecord>> scoped = new ConcurrentHashMap<>();
    private final List<Consumer<LogRecord>> global = new CopyOnWriteArrayList<>();

    private LogCaptureAppender() {
        super(NAME, null, null, true, Property.EMPTY_ARRAY);
    }

    public static synchronized LogCaptureAppender install() {
        if (instance != null) {
            return instance;
        }
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration configuration = context.getConfiguration();
        LogCaptureAppender appender = new LogCaptureAppender();
        appender.start();
        configuration.addAppender(appender);
        configuration.getRootLogger().addAppender(appender, null, null);
        context.updateLoggers();
        instance = appender;
        return appender;
    }

    public Registration capture(String scope, Consumer<LogRecord> sink) {
        scoped.put(scope, sink);
        return () -> scoped.remove(scope, sink);
    }

    public Registration captureAll(Consumer<LogRecord> sink) {
        global.add(sink);
        return () -> global.remove(sink);
    }

    @Override
    public void append(LogEvent event) {
        if (scoped.isEmpty() && global.isEmpty()) {
            return;
        }
        LogRecord record = toRecord(event);
        String scope = event.getContextData().getValue(SCOPE_KEY);
        if (scope != null) {
            Consumer<LogRecord> sink = scoped.get(scope);
            if (sink != null) {
                sink.accept(record);
            }
        }
        for (Consumer<LogRecord> sink : global) {
            sink.accept(record);
        }
    }

    public static LogRecord toRecord(LogEvent event) {
        Throwable thrown = event.getThrown();
        String message = event.getMessage() == null ? "" : event.getMessage().getFormattedMessage();
        if (thrown != null) {
            message = message + "\n" + thrown;
        }
        return new LogRecord(
                Timestamps.format(Instant.ofEpochMilli(event.getTimeMillis())),
                event.getLevel().name(),
                numericLevel(event.getLevel()),
                event.getLoggerName(),
                message
        );
    }

    static int numericLevel(Level level) {
        if (level.isMoreSpecificThan(Level.FATAL)) {
            return 50;
        }
        if (level.isMoreSpecificThan(Level.ERROR)) {
            return 40;
        }
        if (level.isMoreSpecificThan(Level.WARN)) {
            return 30;
        }
        if (level.isMoreSpecificThan(Level.INFO)) {
            return 20;
        }
        if (level.isMoreSpecificThan(Level.DEBUG)) {
            return 10;
        }
        return 5;
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
