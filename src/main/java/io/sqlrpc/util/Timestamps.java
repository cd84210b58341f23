package io.sqlrpc.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class Timestamps {
    private static final DateTimeFormatter WIRE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : WIRE_FORMAT.format(instant);
    }

    public static Number seconds(Duration duration) {
        if (duration == null) {
            return null;
        }
        long nanos = duration.toNanos();
        if (nanos % NANOS_PER_SECOND == 0L) {
            return nanos / NANOS_PER_SECOND;
        }
        return nanos / (double) NANOS_PER_SECOND;
    }

    public static Duration fromSeconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }

    public static double elapsedSeconds(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0.0d;
        }
        return Duration.between(from, to).toNanos() / 1_000_000_000.0d;
    }
}
