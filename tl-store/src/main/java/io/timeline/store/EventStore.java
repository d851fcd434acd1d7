package io.timeline.store;

import io.timeline.core.Event;
import io.timeline.core.Hlc;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Flow;
import java.util.concurrent.Flow.Publisher;

/**
 * Append-only event log with sequential dispatch to a single {@link EventProcessor}.
 *
 * <p>{@link #onEvent()} only carries events dispatched after subscription. Use
 * {@link #snapshotAndSubscribe(Flow.Subscriber)} when history and live events are both needed.
 */
public interface EventStore extends AutoCloseable {

    /** Persist then dispatch one event. Queued events ahead of it are dispatched first (FIFO). */
    void add(Event event);

    /** Sort by id, persist the batch, then dispatch it in that order. */
    void addAll(Collection<Event> events);

    List<Event> getAll();

    Optional<Event> getById(Hlc id);

    default Optional<Event> getById(String id) { return getById(Hlc.parse(id)); }

    /** Drop pending and persisted events; publishes an empty snapshot. */
    void deleteAll();

    Publisher<Event> onEvent();

    Publisher<List<Event>> onSnapshot();

    /** Current events plus an atomic subscription to everything dispatched afterwards. */
    List<Event> snapshotAndSubscribe(Flow.Subscriber<? super Event> subscriber);

    /**
     * Cut the log back to the prefix ending at {@code target} and re-dispatch that prefix.
     *
     * @return false when no event has {@code target}'s id; the log is then re-added unchanged
     */
    boolean restoreToEvent(Event target);

    /** Union with {@code events} by id, then re-add everything in id order. */
    void mergeEvents(Collection<Event> events);

    /** Re-run the processor over the persisted events without persisting or publishing. */
    void replayAll();

    void replayAll(Collection<Event> events);

    void dispose();

    boolean isDisposed();

    @Override
    default void close() { dispose(); }
}
