package io.timeline.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings payload values to the shape Jackson produces when it reads them back as untyped
 * {@code Object}: integers as the smallest of {@code Integer}, {@code Long}, {@code BigInteger};
 * fractions as {@code Double}; arrays and collections as lists; nested maps with string keys.
 */
final class JsonValues {
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private JsonValues() {}

    static Map<String, Object> object(Map<?, ?> map) {
        var out = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> out.put(String.valueOf(k), value(v)));
        return Collections.unmodifiableMap(out);
    }

    static Object value(Object v) {
        if (v instanceof Map<?, ?> m) return object(m);
        if (v instanceof Collection<?> c) return list(c);
        if (v instanceof Object[] a) return list(Arrays.asList(a));
        if (v instanceof Number n) return number(n);
        return v;
    }

    private static List<Object> list(Collection<?> items) {
        var out = new ArrayList<Object>(items.size());
        for (var item : items) out.add(value(item));
        return Collections.unmodifiableList(out);
    }

    private static Number number(Number n) {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) return n.intValue();
        if (n instanceof Long l) return integral(BigInteger.valueOf(l));
        if (n instanceof BigInteger b) return integral(b);
        // Jackson writes a float with its own shortest digits, so widen through the decimal form
        if (n instanceof Float f) return Double.parseDouble(f.toString());
        if (n instanceof BigDecimal d) return d.doubleValue();
        return n.doubleValue();
    }

    private static Number integral(BigInteger b) {
        if (b.bitLength() < 32) return b.intValue();
        if (b.compareTo(LONG_MIN) >= 0 && b.compareTo(LONG_MAX) <= 0) return b.longValue();
        return b;
    }
}
