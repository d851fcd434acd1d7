package io.timeline.store;

/** Creates a backend-specific store bound to a projection's callback. */
@FunctionalInterface
public interface EventStoreFactory {
    EventStore create(EventProcessor processor);
}
