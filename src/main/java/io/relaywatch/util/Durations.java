package io.relaywatch.util;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-readable intervals such as {@code 30s}, {@code 1h30m} or {@code 2d}.
 * A bare integer is read as seconds.
 */
public final class Durations {
    private static final Pattern PART = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d|w)");
    private static final Pattern WHOLE = Pattern.compile("(\\s*\\d+\\s*(ms|s|m|h|d|w)\\s*)+");

    private Durations() {
    }

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration must not be blank");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(value));
        }
        if (!WHOLE.matcher(value).matches()) {
            throw new IllegalArgumentException("Unrecognized duration: " + raw);
        }
        Duration total = Duration.ZERO;
        Matcher m = PART.matcher(value);
        while (m.find()) {
            long amount = Long.parseLong(m.group(1));
            total = total.plus(switch (m.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                case "w" -> Duration.ofDays(amount * 7L);
                default -> throw new IllegalArgumentException("Unrecognized duration unit: " + m.group(2));
            });
        }
        return total;
    }

    public static Duration parseOrDefault(String raw, Duration fallback, Duration min) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        Duration parsed = parse(raw);
        return parsed.compareTo(min) < 0 ? min : parsed;
    }

    public static String format(Duration duration) {
        long ms = duration.toMillis();
        if (ms % 86_400_000L == 0L && ms > 0L) {
            return (ms / 86_400_000L) + "d";
        }
        if (ms % 3_600_000L == 0L && ms > 0L) {
            return (ms / 3_600_000L) + "h";
        }
        if (ms % 60_000L == 0L && ms > 0L) {
            return (ms / 60_000L) + "m";
        }
        if (ms % 1_000L == 0L) {
            return (ms / 1_000L) + "s";
        }
        return ms + "ms";
    }
}
