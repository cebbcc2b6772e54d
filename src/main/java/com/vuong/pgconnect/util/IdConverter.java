package com.vuong.pgconnect.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Coerces loosely typed primary key values (an {@code int} literal, a path segment string)
 * into the Java type of an entity's id attribute.
 */
public final class IdConverter {

    private IdConverter() {
    }

    /**
     * Converts the id to the given type when a lossless standard conversion exists.
     * Values that cannot be converted are returned unchanged and left for the mapper to reject.
     * @param id the raw id, may be null
     * @param idType the id attribute type of the entity
     * @return the converted id
     */
    public static Object convert(Object id, Class<?> idType) {
        if (id == null || idType == null || idType.isInstance(id)) {
            return id;
        }
        Class<?> target = wrap(idType);
        if (target.isInstance(id)) {
            return id;
        }
        try {
            if (id instanceof Number number) {
                Object converted = convertNumber(number, target);
                return converted != null ? converted : id;
            }
            if (id instanceof String text) {
                if (target == UUID.class) {
                    return UUID.fromString(text.trim());
                }
                Object converted = parseNumber(text.trim(), target);
                return converted != null ? converted : id;
            }
        } catch (IllegalArgumentException | ArithmeticException e) {
            // left unconverted; the mapper reports the mismatch with the entity name
            return id;
        }
        return id;
    }

    private static Object convertNumber(Number value, Class<?> type) {
        if (type == Long.class)
            return value.longValue();
        if (type == Integer.class)
            return Math.toIntExact(value.longValue());
        if (type == Short.class)
            return (short) Math.toIntExact(value.longValue());
        if (type == Byte.class)
            return (byte) Math.toIntExact(value.longValue());
        if (type == BigInteger.class)
            return BigInteger.valueOf(value.longValue());
        if (type == BigDecimal.class)
            return new BigDecimal(value.toString());
        if (type == String.class)
            return value.toString();
        return null;
    }

    /**
     * Parses a string value into a number of the specified type.
     */
    private static Object parseNumber(String value, Class<?> type) {
        if (type == Integer.class)
            return Integer.valueOf(value);
        if (type == Long.class)
            return Long.valueOf(value);
        if (type == Short.class)
            return Short.valueOf(value);
        if (type == Byte.class)
            return Byte.valueOf(value);
        if (type == BigInteger.class)
            return new BigInteger(value);
        if (type == BigDecimal.class)
            return new BigDecimal(value);
        return null;
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive())
            return type;
        if (type == long.class)
            return Long.class;
        if (type == int.class)
            return Integer.class;
        if (type == short.class)
            return Short.class;
        if (type == byte.class)
            return Byte.class;
        return type;
    }
}
