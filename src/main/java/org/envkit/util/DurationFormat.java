package org.envkit.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;

/**
 * Parses and formats durations written as a sequence of decimal numbers with unit
 * suffixes, such as {@code 300ms}, {@code 1.5h} or {@code 2h45m0.5s}.
 * <p>
 * Valid units are {@code ns}, {@code us} (or {@code µs}), {@code ms}, {@code s}, {@code m}
 * and {@code h}. A leading sign is allowed; the bare literal {@code 0} needs no unit.
 * Precision is one nanosecond and the range is that of a signed 64-bit nanosecond count.
 */
public final class DurationFormat {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

    private static final Map<String, Long> UNITS = Map.of(
            "ns", 1L,
            "us", NANOS_PER_MICRO,
            "µs", NANOS_PER_MICRO,
            "μs", NANOS_PER_MICRO,
            "ms", NANOS_PER_MILLI,
            "s", NANOS_PER_SECOND,
            "m", NANOS_PER_MINUTE,
            "h", NANOS_PER_HOUR);

    private static final BigDecimal MAX_NANOS = BigDecimal.valueOf(Long.MAX_VALUE);

    private DurationFormat() {}

    /**
     * Parses a duration string.
     *
     * @param text The text to parse, e.g. {@code 1h30m}.
     * @return The parsed duration.
     * @throws IllegalArgumentException if the text is not a valid duration.
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Invalid duration: empty string");
        }
        int pos = 0;
        boolean negative = false;
        char first = text.charAt(0);
        if (first == '-' || first == '+') {
            negative = first == '-';
            pos++;
        }
        if (text.substring(pos).equals("0")) {
            return Duration.ZERO;
        }
        if (pos == text.length()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }

        BigDecimal total = BigDecimal.ZERO;
        while (pos < text.length()) {
            int numberStart = pos;
            while (pos < text.length() && isNumberChar(text.charAt(pos))) pos++;
            String number = text.substring(numberStart, pos);
            if (number.isEmpty() || number.equals(".") || number.indexOf('.') != number.lastIndexOf('.')) {
                throw new IllegalArgumentException("Invalid duration: " + text);
            }

            int unitStart = pos;
            while (pos < text.length() && !isNumberChar(text.charAt(pos))) pos++;
            String unit = text.substring(unitStart, pos);
            if (unit.isEmpty()) {
                throw new IllegalArgumentException("Missing unit in duration: " + text);
            }
            Long scale = UNITS.get(unit);
            if (scale == null) {
                throw new IllegalArgumentException("Unknown unit '" + unit + "' in duration: " + text);
            }

            total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(scale)));
            if (total.compareTo(MAX_NANOS) > 0) {
                throw new IllegalArgumentException("Duration out of range: " + text);
            }
        }

        long nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    /**
     * Formats a duration using the largest fitting units, e.g. {@code 1h30m0s},
     * {@code 1.5s} or {@code 250ms}. The output is accepted by {@link #parse(String)}.
     *
     * @param duration The duration to format.
     * @return The formatted text; {@code 0s} for zero.
     * @throws ArithmeticException if the duration does not fit in a 64-bit nanosecond count.
     */
    public static String format(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        if (nanos == Long.MIN_VALUE) {
            return "-2562047h47m16.854775808s";
        }
        String sign = nanos < 0 ? "-" : "";
        long u = Math.abs(nanos);

        if (u < NANOS_PER_SECOND) {
            if (u < NANOS_PER_MICRO) return sign + u + "ns";
            if (u < NANOS_PER_MILLI) return sign + decimal(u, NANOS_PER_MICRO) + "µs";
            return sign + decimal(u, NANOS_PER_MILLI) + "ms";
        }

        StringBuilder out = new StringBuilder(sign);
        long hours = u / NANOS_PER_HOUR;
        u %= NANOS_PER_HOUR;
        long minutes = u / NANOS_PER_MINUTE;
        u %= NANOS_PER_MINUTE;
        if (hours > 0) out.append(hours).append('h');
        if (hours > 0 || minutes > 0) out.append(minutes).append('m');
        out.append(decimal(u, NANOS_PER_SECOND)).append('s');
        return out.toString();
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static String decimal(long value, long unit) {
        long whole = value / unit;
        long fraction = value % unit;
        if (fraction == 0) {
            return Long.toString(whole);
        }
        int width = Long.toString(unit).length() - 1;
        String digits = String.format("%0" + width + "d", fraction);
        int end = digits.length();
        while (digits.charAt(end - 1) == '0') end--;
        return whole + "." + digits.substring(0, end);
    }
}
