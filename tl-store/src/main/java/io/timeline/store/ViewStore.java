package io.timeline.store;

import io.timeline.core.Event;

import java.util.Collection;

/**
 * Query-side state derived from an {@link EventStore}.
 *
 * <p>Implementations own their state and their store; the store is built with {@link #onEvent} as
 * its processor. {@code state()} must be a pure function of the events applied since the last
 * {@link #onReset()}.
 *
 * @param <S> derived state type
 */
public interface ViewStore<S> extends AutoCloseable {

    EventStore eventStore();

    S state();

    /** Apply one event. Unknown types raise {@link io.timeline.core.UnknownEventTypeException}. */
    void onEvent(Event event);

    /** Return the derived state to its zero value. */
    void onReset();

    default void init() {}

    /** Reset, then cut the log back to {@code event} and re-apply the kept prefix. */
    default boolean restoreToEvent(Event event) {
        onReset();
        return eventStore().restoreToEvent(event);
    }

    /** Reset, then merge {@code events} into the log and re-apply the union. */
    default void mergeEvents(Collection<Event> events) {
        onReset();
        eventStore().mergeEvents(events);
    }

    /** Recompute the state from the full log, e.g. after the projection logic changed. */
    default void rebuild() {
        onReset();
        eventStore().replayAll();
    }

    /** Hook for view-owned resources; runs before the store is released. */
    default void onDispose() {}

    default void dispose() {
        try {
            onDispose();
        } finally {
            eventStore().dispose();
        }
    }

    @Override
    default void close() { dispose(); }
}
