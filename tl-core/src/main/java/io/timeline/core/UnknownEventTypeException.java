package io.timeline.core;

/** A projection received an event type outside the set it knows how to apply. */
public class UnknownEventTypeException extends RuntimeException {
    private final String type;

    public UnknownEventTypeException(String type) {
        super("Unknown event type: " + type);
        this.type = type;
    }

    public String type() { return type; }
}
