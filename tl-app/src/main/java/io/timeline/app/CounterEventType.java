package io.timeline.app;

import io.timeline.core.UnknownEventTypeException;

/** Closed set of counter events, keyed by their wire name. */
public enum CounterEventType {
    SET_VALUE("SetValue"),
    RESET("Reset"),
    INCREMENT("Increment"),
    DECREMENT("Decrement");

    private final String wireName;

    CounterEventType(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    public static CounterEventType of(String type) {
        for (var t : values()) {
            if (t.wireName.equals(type)) return t;
        }
        throw new UnknownEventTypeException(type);
    }
}
