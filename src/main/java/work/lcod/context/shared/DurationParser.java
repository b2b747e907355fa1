package work.lcod.context.shared;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses timeouts written as {@code 250ms}, {@code 30s}, {@code 2m}, {@code 1h}, plain milliseconds,
 * or ISO-8601 ({@code PT30S}).
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("p")) {
            try {
                return Optional.of(requireNonNegative(Duration.parse(trimmed.toUpperCase(Locale.ROOT)), raw));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid duration: " + raw, ex);
            }
        }

        long multiplier;
        String digits;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else {
            digits = trimmed;
            multiplier = 1L;
        }

        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        long millis;
        try {
            millis = Math.multiplyExact(value, multiplier);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        return Optional.of(requireNonNegative(Duration.ofMillis(millis), raw));
    }

    private static Duration requireNonNegative(Duration duration, String raw) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return duration;
    }
}
