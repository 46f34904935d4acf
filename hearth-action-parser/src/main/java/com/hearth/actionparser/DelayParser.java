package com.hearth.actionparser;

import com.hearth.actionmodel.error.InvalidActionException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Delay values: {@code "HH:MM:SS"}, {@code "MM:SS"} or {@code "SS"} (fractional seconds allowed),
 * a mapping of {@code hours}, {@code minutes}, {@code seconds}, {@code milliseconds}, or a plain number of seconds.
 * Millisecond precision.
 */
final class DelayParser {

    private static final Pattern CLOCK = Pattern.compile("\\d+(:\\d+){0,2}(\\.\\d+)?");
    private static final Set<String> UNITS = Set.of("days", "hours", "minutes", "seconds", "milliseconds");

    private DelayParser() {
    }

    static Duration parse(Object raw, String fragment) {
        if (raw == null || raw instanceof Boolean) {
            throw new InvalidActionException(fragment, "Invalid delay: " + raw);
        }
        Duration duration;
        if (raw instanceof Number) {
            duration = ofSeconds(number(raw, "seconds", fragment), fragment);
        } else if (raw instanceof String s) {
            duration = parseClock(s.trim(), fragment);
        } else if (raw instanceof Map<?, ?> m) {
            duration = parseMapping(m, fragment);
        } else {
            throw new InvalidActionException(fragment, "Invalid delay: " + raw);
        }
        if (duration.isNegative()) {
            throw new InvalidActionException(fragment, "Delay must not be negative: " + raw);
        }
        return duration;
    }

    private static Duration parseClock(String text, String fragment) {
        if (!CLOCK.matcher(text).matches()) {
            throw new InvalidActionException(fragment, "Invalid delay format: '" + text + "'");
        }
        String[] parts = text.split(":");
        BigDecimal seconds = new BigDecimal(parts[parts.length - 1]);
        if (parts.length >= 2) {
            seconds = seconds.add(new BigDecimal(parts[parts.length - 2]).multiply(BigDecimal.valueOf(60)));
        }
        if (parts.length == 3) {
            seconds = seconds.add(new BigDecimal(parts[0]).multiply(BigDecimal.valueOf(3600)));
        }
        return ofSeconds(seconds, fragment);
    }

    private static Duration parseMapping(Map<?, ?> m, String fragment) {
        if (m.isEmpty()) {
            throw new InvalidActionException(fragment, "Delay mapping is empty");
        }
        BigDecimal seconds = BigDecimal.ZERO;
        for (Map.Entry<?, ?> e : m.entrySet()) {
            String unit = String.valueOf(e.getKey());
            if (!UNITS.contains(unit)) {
                throw new InvalidActionException(fragment, "Unknown delay unit: " + unit);
            }
            BigDecimal amount = number(e.getValue(), unit, fragment);
            switch (unit) {
                case "days":
                    seconds = seconds.add(amount.multiply(BigDecimal.valueOf(86400)));
                    break;
                case "hours":
                    seconds = seconds.add(amount.multiply(BigDecimal.valueOf(3600)));
                    break;
                case "minutes":
                    seconds = seconds.add(amount.multiply(BigDecimal.valueOf(60)));
                    break;
                case "seconds":
                    seconds = seconds.add(amount);
                    break;
                default:
                    seconds = seconds.add(amount.movePointLeft(3));
                    break;
            }
        }
        return ofSeconds(seconds, fragment);
    }

    private static BigDecimal number(Object value, String unit, String fragment) {
        if (value instanceof Number || value instanceof String) {
            String text = value.toString().trim();
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new InvalidActionException(fragment, "Delay " + unit + " is not a number: '" + text + "'", e);
            }
        }
        throw new InvalidActionException(fragment, "Delay " + unit + " is not a number: " + value);
    }

    private static Duration ofSeconds(BigDecimal seconds, String fragment) {
        if (seconds.signum() < 0) {
            throw new InvalidActionException(fragment, "Delay must not be negative: " + seconds.toPlainString() + "s");
        }
        try {
            long millis = seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
            return Duration.ofMillis(millis);
        } catch (ArithmeticException e) {
            throw new InvalidActionException(fragment, "Delay is too large: " + seconds.toPlainString() + "s", e);
        }
    }
}
