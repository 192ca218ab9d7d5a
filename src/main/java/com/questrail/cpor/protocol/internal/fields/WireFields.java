package com.questrail.cpor.protocol.internal.fields;

import com.questrail.cpor.protocol.model.Bytes;
import com.questrail.cpor.protocol.model.InvalidMessageException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, read-only view over a decoded field map.
 *
 * <p>Absent keys and explicit nulls both yield the caller's default. A value
 * of the wrong wire type fails with {@link InvalidMessageException}; range
 * and content checks are left to the message constructors.</p>
 */
final class WireFields
{
    private final Map<String, ?> fields;

    WireFields(Map<String, ?> fields) {
        this.fields = Objects.requireNonNull(fields, "fields");
    }

    boolean has(String name) {
        return fields.get(name) != null;
    }

    String string(String name, String defaultValue) {
        Object value = fields.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String s) {
            return s;
        }
        throw wrongType(name, "a string", value);
    }

    String optionalString(String name) {
        return string(name, null);
    }

    long integer(String name, long defaultValue) {
        Long value = optionalInteger(name);
        return value == null ? defaultValue : value;
    }

    Long optionalInteger(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                return big.longValue();
            }
            throw new InvalidMessageException(name + " is out of range");
        }
        throw wrongType(name, "an integer", value);
    }

    boolean bool(String name, boolean defaultValue) {
        Object value = fields.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw wrongType(name, "a boolean", value);
    }

    Bytes bytes(String name, Bytes defaultValue) {
        Object value = fields.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof byte[] raw) {
            return Bytes.of(raw);
        }
        if (value instanceof Bytes b) {
            return b;
        }
        throw wrongType(name, "bytes", value);
    }

    Bytes optionalBytes(String name) {
        return bytes(name, null);
    }

    List<String> stringList(String name) {
        List<?> list = list(name);
        List<String> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new InvalidMessageException(name + " must contain only strings");
            }
            out.add(s);
        }
        return out;
    }

    List<Map<String, ?>> mapList(String name) {
        List<?> list = list(name);
        List<Map<String, ?>> out = new ArrayList<>(list.size());
        for (Object item : list) {
            out.add(asStringKeyedMap(name, item));
        }
        return out;
    }

    Map<String, ?> optionalMap(String name) {
        Object value = fields.get(name);
        return value == null ? null : asStringKeyedMap(name, value);
    }

    private List<?> list(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw wrongType(name, "a list", value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asStringKeyedMap(String name, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw wrongType(name, "a map", value);
        }
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                throw new InvalidMessageException(name + " keys must be strings");
            }
        }
        return (Map<String, ?>) map;
    }

    private static InvalidMessageException wrongType(String name, String expected, Object actual) {
        return new InvalidMessageException(
                name + " must be " + expected + " (was " + actual.getClass().getSimpleName() + ")");
    }
}
