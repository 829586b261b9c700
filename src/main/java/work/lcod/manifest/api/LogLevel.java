package work.lcod.manifest.api;

import java.util.Locale;
import org.tinylog.Level;

/**
 * Log thresholds accepted on the command line, mapped onto tinylog levels. {@code FATAL} silences logging.
 */
public enum LogLevel {
    TRACE(Level.TRACE),
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARN(Level.WARN),
    ERROR(Level.ERROR),
    FATAL(Level.OFF);

    private final Level tinylogLevel;

    LogLevel(Level tinylogLevel) {
        this.tinylogLevel = tinylogLevel;
    }

    public Level tinylogLevel() {
        return tinylogLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
