package io.timeline.store;

/** Persistence failure in a store backend (I/O or record corruption). */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) { super(message); }

    public EventStoreException(String message, Throwable cause) { super(message, cause); }
}
