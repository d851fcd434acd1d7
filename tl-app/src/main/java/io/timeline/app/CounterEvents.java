package io.timeline.app;

import io.timeline.core.Event;
import io.timeline.core.HlcClock;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds and reads counter events: {@code {"key": <name>, "amount": <int>}}. */
public final class CounterEvents {
    public static final String DEFAULT_KEY = "counter";

    private CounterEvents() {}

    public static Event increment(HlcClock clock, String key, int amount) {
        return create(clock, CounterEventType.INCREMENT, key, amount);
    }

    public static Event decrement(HlcClock clock, String key, int amount) {
        return create(clock, CounterEventType.DECREMENT, key, amount);
    }

    public static Event setValue(HlcClock clock, String key, int value) {
        return create(clock, CounterEventType.SET_VALUE, key, value);
    }

    public static Event reset(HlcClock clock, String key) {
        return create(clock, CounterEventType.RESET, key, 0);
    }

    private static Event create(HlcClock clock, CounterEventType type, String key, int amount) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", key);
        data.put("amount", amount);
        return new Event(clock.now(), type.wireName(), data);
    }

    static String key(Event e) {
        var key = e.data().get("key");
        return key == null ? DEFAULT_KEY : key.toString();
    }

    /**
     * Missing amount: 1 for increments/decrements, 0 for set/reset. Amounts that are not whole
     * numbers within {@code int} range are rejected.
     */
    static int amount(Event e, CounterEventType type) {
        if (e.data().get("amount") instanceof Number n) {
            try {
                return new BigDecimal(n.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException ex) {
                throw new IllegalArgumentException("Amount of " + e.id() + " is not a 32-bit integer: " + n, ex);
            }
        }
        return switch (type) {
            case INCREMENT, DECREMENT -> 1;
            case SET_VALUE, RESET -> 0;
        };
    }
}
