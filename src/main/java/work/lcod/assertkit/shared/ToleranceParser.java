package work.lcod.assertkit.shared;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import work.lcod.assertkit.comparers.Tolerance;

/**
 * Parses tolerances written in configuration files (e.g. {@code 0.001}, {@code 5%}, {@code 4ulps},
 * {@code 250ms}, {@code 2s}, {@code 1m}, {@code 1h}, {@code exact}).
 */
public final class ToleranceParser {
    private ToleranceParser() {}

    public static Optional<Tolerance> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("exact".equals(trimmed) || "none".equals(trimmed)) {
            return Optional.of(Tolerance.EXACT);
        }
        if ("default".equals(trimmed)) {
            return Optional.of(Tolerance.DEFAULT);
        }
        if (trimmed.endsWith("%")) {
            return Optional.of(Tolerance.of(number(trimmed.substring(0, trimmed.length() - 1))).percent());
        }
        if (trimmed.endsWith("ulps")) {
            return Optional.of(Tolerance.of(Long.parseLong(trimmed.substring(0, trimmed.length() - 4).trim())).ulps());
        }
        long multiplier;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else {
            return Optional.of(Tolerance.of(number(trimmed)));
        }
        long value = Long.parseLong(trimmed.trim());
        return Optional.of(Tolerance.of(Duration.ofMillis(value * multiplier)));
    }

    private static Number number(String text) {
        var decimal = new BigDecimal(text.trim());
        return decimal.scale() <= 0 ? (Number) decimal.longValueExact() : (Number) decimal.doubleValue();
    }
}
