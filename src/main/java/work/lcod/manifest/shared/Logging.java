package work.lcod.manifest.shared;

import java.util.Locale;
import org.tinylog.configuration.Configuration;
import work.lcod.manifest.api.LogLevel;

/**
 * Applies the requested log threshold to tinylog. Must run before the first log statement; once tinylog has
 * started its configuration is frozen and later calls are ignored.
 */
public final class Logging {
    private Logging() {}

    public static boolean configure(LogLevel level) {
        if (Configuration.isFrozen()) {
            return false;
        }
        Configuration.set("writer.level", level.tinylogLevel().name().toLowerCase(Locale.ROOT));
        return true;
    }
}
