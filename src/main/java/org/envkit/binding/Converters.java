package org.envkit.binding;

import org.envkit.util.DurationFormat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * The built-in {@link Converter}s. The converter of a field is picked when the field
 * is registered, from its declared type; nothing is discovered at runtime.
 */
public final class Converters {

    private static final Set<String> TRUE_LITERALS = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_LITERALS = Set.of("false", "0", "no", "off");

    private static final Converter<String> STRING = of("string", raw -> raw, Function.identity());
    private static final Converter<Byte> INT8 = ranged("int8", Byte.MIN_VALUE, Byte.MAX_VALUE, Long::byteValue);
    private static final Converter<Short> INT16 = ranged("int16", Short.MIN_VALUE, Short.MAX_VALUE, Long::shortValue);
    private static final Converter<Integer> INT32 = ranged("int32", Integer.MIN_VALUE, Integer.MAX_VALUE, Long::intValue);
    private static final Converter<Long> INT64 = of("int64", Converters::parseSigned, String::valueOf);
    private static final Converter<Integer> UINT8 = unsignedRanged("uint8", 0xFFL);
    private static final Converter<Integer> UINT16 = unsignedRanged("uint16", 0xFFFFL);
    private static final Converter<Long> UINT32 = of("uint32",
            raw -> Integer.toUnsignedLong(Integer.parseUnsignedInt(requireUnsigned(raw))), String::valueOf);
    private static final Converter<Long> UINT64 = of("uint64",
            raw -> Long.parseUnsignedLong(requireUnsigned(raw)), Long::toUnsignedString);
    private static final Converter<Float> FLOAT32 = of("float32", Converters::parseFloat32, String::valueOf);
    private static final Converter<Double> FLOAT64 = of("float64", Converters::parseFloat64, String::valueOf);
    private static final Converter<Boolean> BOOL = of("bool", Converters::parseBoolean, String::valueOf);
    private static final Converter<Duration> DURATION = of("duration", DurationFormat::parse, DurationFormat::format);
    private static final Converter<List<String>> STRING_LIST = of("[]string", Converters::splitList, list -> String.join(",", list));

    private Converters() {}

    public static Converter<String> string() { return STRING; }
    public static Converter<Byte> int8() { return INT8; }
    public static Converter<Short> int16() { return INT16; }
    public static Converter<Integer> int32() { return INT32; }
    public static Converter<Long> int64() { return INT64; }

    /** Unsigned 8-bit values, held in an {@code Integer}. */
    public static Converter<Integer> uint8() { return UINT8; }

    /** Unsigned 16-bit values, held in an {@code Integer}. */
    public static Converter<Integer> uint16() { return UINT16; }

    /** Unsigned 32-bit values, held in a {@code Long}. */
    public static Converter<Long> uint32() { return UINT32; }

    /**
     * Unsigned 64-bit values. Values above {@link Long#MAX_VALUE} are held as the
     * negative {@code long} with the same bits; use {@link Long#toUnsignedString(long)} to print them.
     */
    public static Converter<Long> uint64() { return UINT64; }

    public static Converter<Float> float32() { return FLOAT32; }
    public static Converter<Double> float64() { return FLOAT64; }

    /**
     * Booleans from the literals {@code true/false}, {@code 1/0}, {@code yes/no} and {@code on/off},
     * case-insensitive.
     */
    public static Converter<Boolean> bool() { return BOOL; }

    /** Durations in the compound form accepted by {@link DurationFormat}. */
    public static Converter<Duration> duration() { return DURATION; }

    /** Comma-separated lists; each element is trimmed. */
    public static Converter<List<String>> stringList() { return STRING_LIST; }

    @FunctionalInterface
    private interface Parser<V> {
        V parse(String raw) throws Exception;
    }

    private static <V> Converter<V> of(String typeName, Parser<V> parser, Function<V, String> formatter) {
        return new Converter<>() {
            @Override
            public V convert(String raw) throws ConversionException {
                try {
                    return parser.parse(raw);
                } catch (IllegalArgumentException | ArithmeticException e) {
                    throw new ConversionException("Cannot convert '" + raw + "' to " + typeName + ": " + e.getMessage(), e);
                } catch (Exception e) {
                    throw new ConversionException("Cannot convert '" + raw + "' to " + typeName, e);
                }
            }

            @Override
            public String format(V value) {
                return formatter.apply(value);
            }

            @Override
            public String typeName() {
                return typeName;
            }
        };
    }

    private static <V extends Number> Converter<V> ranged(String typeName, long min, long max, Function<Long, V> narrow) {
        return of(typeName, raw -> {
            long value = parseSigned(raw);
            if (value < min || value > max) {
                throw new NumberFormatException("value out of range");
            }
            return narrow.apply(value);
        }, String::valueOf);
    }

    private static Converter<Integer> unsignedRanged(String typeName, long max) {
        return of(typeName, raw -> {
            long value = Long.parseLong(requireUnsigned(raw));
            if (value > max) {
                throw new NumberFormatException("value out of range");
            }
            return (int) value;
        }, String::valueOf);
    }

    private static long parseSigned(String raw) {
        return Long.parseLong(raw);
    }

    private static String requireUnsigned(String raw) {
        if (raw.isEmpty() || raw.charAt(0) == '+' || raw.charAt(0) == '-') {
            throw new NumberFormatException("not an unsigned integer");
        }
        return raw;
    }

    private static float parseFloat32(String raw) {
        double value = parseFloat64(raw);
        float narrowed = (float) value;
        if (Float.isInfinite(narrowed) && !Double.isInfinite(value)) {
            throw new NumberFormatException("value out of range");
        }
        return narrowed;
    }

    private static double parseFloat64(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "inf", "+inf", "infinity", "+infinity": return Double.POSITIVE_INFINITY;
            case "-inf", "-infinity": return Double.NEGATIVE_INFINITY;
            case "nan": return Double.NaN;
            default: break;
        }
        // Double.parseDouble trims whitespace and accepts type suffixes; reject both.
        if (raw.isEmpty() || raw.trim().length() != raw.length() || Character.isLetter(raw.charAt(raw.length() - 1))) {
            throw new NumberFormatException("not a number");
        }
        double value = Double.parseDouble(raw);
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("value out of range");
        }
        return value;
    }

    private static boolean parseBoolean(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(lower)) return true;
        if (FALSE_LITERALS.contains(lower)) return false;
        throw new IllegalArgumentException("expected one of true, false, 1, 0, yes, no, on, off");
    }

    private static List<String> splitList(String raw) {
        List<String> parts = new ArrayList<>();
        for (String part : raw.split(",", -1)) {
            parts.add(part.trim());
        }
        return List.copyOf(parts);
    }
}
