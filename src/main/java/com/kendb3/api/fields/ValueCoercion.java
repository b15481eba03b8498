package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiDataException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Converts payload values (as produced by a JSON parser) to attribute types.
 */
final class ValueCoercion {

    private static final Map<Class<?>, Class<?>> BOXED = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            char.class, Character.class);

    private ValueCoercion() {
    }

    static Object coerce(Object value, Class<?> targetType, String fieldName) {
        if (value == null) {
            if (targetType.isPrimitive()) {
                throw new ApiDataException("Field '" + fieldName + "' cannot be null");
            }
            return null;
        }
        Class<?> boxed = targetType.isPrimitive() ? BOXED.get(targetType) : targetType;
        if (boxed.isInstance(value)) {
            return value;
        }
        if (value instanceof Number number) {
            Object converted = fromNumber(number, boxed, fieldName);
            if (converted != null) {
                return converted;
            }
        }
        if (value instanceof String text) {
            Object converted = fromString(text, boxed, fieldName);
            if (converted != null) {
                return converted;
            }
        }
        throw new ApiDataException("Field '" + fieldName + "' expects " + boxed.getSimpleName()
                + ", got " + value.getClass().getSimpleName());
    }

    /**
     * Converts an identifier from a payload. Only integral numbers are accepted.
     */
    static Long toId(Object value, String fieldName) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        throw new ApiDataException("Field '" + fieldName + "' expects an integer identifier, got " + value);
    }

    static List<Long> toIds(Object value, String fieldName) {
        if (!(value instanceof Collection<?> items)) {
            throw new ApiDataException("Field '" + fieldName + "' expects a list of identifiers, got " + value);
        }
        List<Long> ids = new ArrayList<>(items.size());
        for (Object item : items) {
            Long id = toId(item, fieldName);
            if (id == null) {
                throw new ApiDataException("Field '" + fieldName + "' contains a null identifier");
            }
            ids.add(id);
        }
        return ids;
    }

    static List<String> toNames(Object value, String fieldName) {
        if (!(value instanceof Collection<?> items)) {
            throw new ApiDataException("Field '" + fieldName + "' expects a list of names, got " + value);
        }
        List<String> names = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String name)) {
                throw new ApiDataException("Field '" + fieldName + "' expects names, got " + item);
            }
            names.add(name);
        }
        return names;
    }

    private static Object fromNumber(Number number, Class<?> target, String fieldName) {
        boolean integral = number instanceof Long || number instanceof Integer
                || number instanceof Short || number instanceof Byte || number instanceof BigInteger;
        if (integral && (target == Long.class || target == Integer.class || target == Short.class)) {
            BigInteger exact = number instanceof BigInteger big ? big : BigInteger.valueOf(number.longValue());
            try {
                if (target == Long.class) {
                    return exact.longValueExact();
                }
                if (target == Integer.class) {
                    return exact.intValueExact();
                }
                return exact.shortValueExact();
            } catch (ArithmeticException e) {
                throw new ApiDataException("Field '" + fieldName + "' value " + number + " is out of range for "
                        + target.getSimpleName(), e);
            }
        }
        if (target == Double.class) {
            return number.doubleValue();
        }
        if (target == Float.class) {
            return number.floatValue();
        }
        if (target == BigDecimal.class) {
            return new BigDecimal(number.toString());
        }
        return null;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object fromString(String text, Class<?> target, String fieldName) {
        try {
            if (target.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) target, text);
            }
            if (target == Instant.class) {
                return Instant.parse(text);
            }
            if (target == LocalDate.class) {
                return LocalDate.parse(text);
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new ApiDataException("Field '" + fieldName + "' cannot parse '" + text + "' as "
                    + target.getSimpleName(), e);
        }
        return null;
    }
}
