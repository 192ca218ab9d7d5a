package com.questrail.cpor.protocol.model;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-freezes untyped map payloads (batch entries, error details).
 *
 * <p>Accepted leaf values are text, booleans, integers, floating point,
 * binary and {@code null}. Integers are widened to {@link Long} (or kept as
 * {@link BigInteger} when larger), binary is held as {@link Bytes}, so a
 * payload compares equal to itself after a wire round trip. Map key order is
 * preserved.</p>
 */
final class UntypedPayloads
{
    private UntypedPayloads() {}

    static List<Map<String, Object>> freezeMapList(List<? extends Map<String, ?>> maps, String field) {
        if (maps == null) {
            throw new InvalidMessageException(field + " must be a list");
        }
        List<Map<String, Object>> out = new ArrayList<>(maps.size());
        for (Map<String, ?> map : maps) {
            if (map == null) {
                throw new InvalidMessageException(field + " entries must be maps");
            }
            out.add(freezeMap(map, field));
        }
        return Collections.unmodifiableList(out);
    }

    static Map<String, Object> freezeMap(Map<String, ?> map, String field) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : map.entrySet()) {
            if (e.getKey() == null) {
                throw new InvalidMessageException(field + " keys must be strings");
            }
            out.put(e.getKey(), freezeValue(e.getValue(), field));
        }
        return Collections.unmodifiableMap(out);
    }

    @SuppressWarnings("unchecked")
    private static Object freezeValue(Object value, String field) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Long
                || value instanceof Double
                || value instanceof Bytes) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof byte[] raw) {
            return Bytes.of(raw);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(freezeValue(item, field));
            }
            return Collections.unmodifiableList(out);
        }
        if (value instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!(key instanceof String)) {
                    throw new InvalidMessageException(field + " keys must be strings");
                }
            }
            return freezeMap((Map<String, ?>) map, field);
        }
        throw new InvalidMessageException(
                field + " contains an unsupported value type: " + value.getClass().getSimpleName());
    }
}
