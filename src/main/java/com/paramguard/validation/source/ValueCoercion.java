package com.paramguard.validation.source;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.paramguard.validation.ResolvedType;

/**
 * Best-effort conversions shared by the source bindings. Nothing here throws: a value that
 * cannot be converted comes back unchanged and fails the later conformance check.
 */
public final class ValueCoercion {
    private static final long MAX_EXACT_DOUBLE = 1L << 53;
    private static final long MAX_EXACT_FLOAT = 1L << 24;

    private ValueCoercion() {}

    /**
     * Convert text-valued input (route, query, form). List-shaped types accept a repeated
     * field as a list or a single value as a one-element list.
     */
    public static Object coerceText(final Object raw, final ResolvedType type) {
        if (type.list()) {
            if (raw instanceof List<?> values) {
                return mapElements(values, type, ValueCoercion::coerceTextScalar);
            }
            if (raw instanceof String) {
                return List.of(coerceTextScalar(raw, type));
            }
            return raw;
        }
        return coerceTextScalar(raw, type);
    }

    /**
     * Convert decoded JSON input. Only numbers are converted, and only without loss.
     */
    public static Object coerceJson(final Object raw, final ResolvedType type) {
        if (type.list()) {
            return raw instanceof List<?> values ? mapElements(values, type, ValueCoercion::coerceNumberScalar) : raw;
        }
        return coerceNumberScalar(raw, type);
    }

    private static Object coerceTextScalar(final Object raw, final ResolvedType type) {
        if (type.accepts(raw) || !(raw instanceof String text)) return raw;
        for (final Class<?> candidate : type.candidates()) {
            final Optional<Object> converted = fromText(text, candidate);
            if (converted.isPresent()) return converted.get();
        }
        return raw;
    }

    private static Object coerceNumberScalar(final Object raw, final ResolvedType type) {
        if (type.accepts(raw) || !(raw instanceof Number number)) return raw;
        for (final Class<?> candidate : type.candidates()) {
            final Optional<Object> converted = widenNumber(number, candidate);
            if (converted.isPresent()) return converted.get();
        }
        return raw;
    }

    private static Object mapElements(final List<?> values, final ResolvedType type,
                                      final ElementConverter converter) {
        final List<Object> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            result.add(converter.convert(value, type));
        }
        return result;
    }

    /**
     * Parse text into the target type.
     *
     * @return the converted value, or empty when the text does not represent a {@code target}
     */
    public static Optional<Object> fromText(final String raw, final Class<?> target) {
        if (target == String.class) return Optional.of(raw);
        try {
            if (target == Boolean.class) {
                return parseBoolean(raw);
            }
            if (target == Integer.class) {
                final long value = parseLong(raw);
                return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE
                    ? Optional.of((int) value) : Optional.empty();
            }
            if (target == Long.class) {
                return Optional.of(parseLong(raw));
            }
            if (target == Double.class) {
                final double value = Double.parseDouble(raw);
                return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
            }
            if (target == Float.class) {
                final float value = Float.parseFloat(raw);
                return Float.isFinite(value) ? Optional.of(value) : Optional.empty();
            }
            if (target == BigDecimal.class) {
                return Optional.of(new BigDecimal(raw));
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * Convert a number to another numeric type when no precision is lost.
     */
    public static Optional<Object> widenNumber(final Number value, final Class<?> target) {
        if (target.isInstance(value)) return Optional.of(value);
        final boolean integral = isIntegral(value);

        if (target == Integer.class && integral && fitsLong(value)) {
            final long l = value.longValue();
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? Optional.of((int) l) : Optional.empty();
        }
        if (target == Long.class && integral && fitsLong(value)) {
            return Optional.of(value.longValue());
        }
        if (target == Double.class) {
            if (integral) {
                return fitsLong(value) && Math.abs(value.longValue()) <= MAX_EXACT_DOUBLE
                    ? Optional.of(value.doubleValue()) : Optional.empty();
            }
            if (value instanceof Float f) return Optional.of(f.doubleValue());
            if (value instanceof BigDecimal bd) {
                final double d = bd.doubleValue();
                return Double.isFinite(d) && BigDecimal.valueOf(d).compareTo(bd) == 0 ? Optional.of(d) : Optional.empty();
            }
        }
        if (target == Float.class) {
            if (integral) {
                return fitsLong(value) && Math.abs(value.longValue()) <= MAX_EXACT_FLOAT
                    ? Optional.of(value.floatValue()) : Optional.empty();
            }
            if (value instanceof Double d && (double) d.floatValue() == d) return Optional.of(d.floatValue());
        }
        if (target == BigDecimal.class) {
            if (value instanceof BigInteger bi) return Optional.of(new BigDecimal(bi));
            if (integral) return Optional.of(BigDecimal.valueOf(value.longValue()));
            if (value instanceof Double || value instanceof Float) {
                final double d = value.doubleValue();
                return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> parseBoolean(final String raw) {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1" -> Optional.of(Boolean.TRUE);
            case "false", "0" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }

    private static long parseLong(final String raw) {
        final String trimmed = raw.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return Long.parseLong(trimmed.substring(2), 16);
        }
        return Long.parseLong(trimmed);
    }

    private static boolean isIntegral(final Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
            || n instanceof BigInteger;
    }

    private static boolean fitsLong(final Number n) {
        return !(n instanceof BigInteger bi) || bi.bitLength() < 64;
    }

    @FunctionalInterface
    private interface ElementConverter {
        Object convert(Object value, ResolvedType type);
    }
}
