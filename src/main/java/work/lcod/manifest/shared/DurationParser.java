package work.lcod.manifest.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses operator-friendly durations: {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h}, compounds such as
 * {@code 1m30s}, or a bare number of milliseconds.
 */
public final class DurationParser {
    private static final Pattern PART = Pattern.compile("(\\d+)(ms|h|m|s)");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim().toLowerCase(Locale.ROOT);
        if (text.chars().allMatch(Character::isDigit)) {
            return Optional.of(Duration.ofMillis(Long.parseLong(text)));
        }
        Matcher matcher = PART.matcher(text);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                break;
            }
            long amount = Long.parseLong(matcher.group(1));
            total = total.plus(switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            });
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != text.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(total);
    }
}
