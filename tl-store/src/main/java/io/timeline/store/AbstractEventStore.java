package io.timeline.store;

import io.timeline.core.Event;
import io.timeline.core.Hlc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Queue, dispatch, replay, restore and merge on top of a backend that only knows how to persist,
 * load and clear events.
 *
 * <p>Every mutating operation holds this store's monitor, so at most one dispatch is in flight.
 * A processor may call back into the store from the dispatching thread.
 *
 * <p>Publisher deliveries are staged in an outbox while the monitor is held and submitted after it
 * is released, in commit order. A full subscriber buffer therefore blocks only the publishing
 * thread, never readers of the store.
 */
public abstract class AbstractEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractEventStore.class);

    protected static final Comparator<Event> BY_ID = Comparator.comparing(Event::id);

    private final EventProcessor processor;
    private final Queue<Event> queue = new ArrayDeque<>();
    private final SubmissionPublisher<Event> bus = new SubmissionPublisher<>();
    private final SubmissionPublisher<List<Event>> snapshots = new SubmissionPublisher<>();
    private final Queue<Runnable> outbox = new ArrayDeque<>();
    private final ReentrantLock publishing = new ReentrantLock();
    private volatile boolean disposed;

    protected AbstractEventStore(EventProcessor processor) {
        this.processor = processor == null ? EventProcessor.NONE : processor;
    }

    /* ---------- backend hooks ---------- */

    protected abstract void persist(Event event);

    /** Persist a batch already sorted by id. Backends with transactions override this. */
    protected void persistAll(List<Event> sorted) {
        for (var e : sorted) persist(e);
    }

    protected abstract List<Event> loadAll();

    protected abstract Optional<Event> load(Hlc id);

    protected abstract void clear();

    /** Release the backend handle; called once from {@link #dispose()}. */
    protected void release() {}

    /* ---------- EventStore ---------- */

    @Override
    public void add(Event event) {
        Objects.requireNonNull(event, "event");
        try {
            synchronized (this) {
                checkOpen();
                persist(event);
                queue.add(event);
                drain();
            }
        } finally {
            publish();
        }
    }

    @Override
    public void addAll(Collection<Event> events) {
        try {
            synchronized (this) {
                checkOpen();
                append(events);
            }
        } finally {
            publish();
        }
    }

    private void append(Collection<Event> events) {
        if (events == null || events.isEmpty()) return;
        var sorted = sortById(events);
        persistAll(sorted);
        queue.addAll(sorted);
        drain();
    }

    private void drain() {
        while (!queue.isEmpty()) {
            var e = queue.poll();
            log.debug("Dispatching {} ({})", e.id(), e.type());
            processor.process(e);
            outbox.add(() -> bus.submit(e));
        }
    }

    /**
     * Submits staged deliveries. Only one thread publishes at a time; a caller that finds the lock
     * taken leaves its entries to the current holder, which re-checks the outbox before leaving.
     */
    private void publish() {
        if (Thread.holdsLock(this)) return;
        while (publishing.tryLock()) {
            try {
                flushOutbox();
            } finally {
                publishing.unlock();
            }
            if (!hasOutgoing()) return;
        }
    }

    private void flushOutbox() {
        Runnable next;
        while ((next = nextOutgoing()) != null) next.run();
    }

    private synchronized Runnable nextOutgoing() {
        return disposed ? null : outbox.poll();
    }

    private synchronized boolean hasOutgoing() {
        return !disposed && !outbox.isEmpty();
    }

    @Override
    public synchronized List<Event> getAll() {
        checkOpen();
        return List.copyOf(loadAll());
    }

    @Override
    public synchronized Optional<Event> getById(Hlc id) {
        checkOpen();
        return load(Objects.requireNonNull(id, "id"));
    }

    @Override
    public void deleteAll() {
        try {
            synchronized (this) {
                checkOpen();
                wipe();
            }
        } finally {
            publish();
        }
    }

    private void wipe() {
        queue.clear();
        clear();
        log.info("Cleared event store {}", getClass().getSimpleName());
        outbox.add(() -> snapshots.submit(List.of()));
    }

    @Override
    public Flow.Publisher<Event> onEvent() { return bus; }

    @Override
    public Flow.Publisher<List<Event>> onSnapshot() { return snapshots; }

    @Override
    public List<Event> snapshotAndSubscribe(Flow.Subscriber<? super Event> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (Thread.holdsLock(this)) return subscribeNow(subscriber);

        // Everything staged before the subscription is part of the snapshot, so it must reach the
        // publisher first.
        List<Event> snapshot = null;
        publishing.lock();
        try {
            while (snapshot == null) {
                flushOutbox();
                synchronized (this) {
                    if (outbox.isEmpty()) snapshot = subscribeNow(subscriber);
                }
            }
        } finally {
            publishing.unlock();
        }
        publish();
        return snapshot;
    }

    private synchronized List<Event> subscribeNow(Flow.Subscriber<? super Event> subscriber) {
        checkOpen();
        bus.subscribe(subscriber);
        return List.copyOf(loadAll());
    }

    @Override
    public boolean restoreToEvent(Event target) {
        Objects.requireNonNull(target, "target");
        try {
            synchronized (this) {
                checkOpen();
                var staged = new ArrayList<Event>();
                boolean found = false;
                for (var e : loadAll()) {
                    staged.add(e);
                    if (e.id().equals(target.id())) {
                        found = true;
                        break;
                    }
                }
                log.info("Restoring to {} (found={}, keeping {} events)", target.id(), found, staged.size());
                wipe();
                append(staged);
                return found;
            }
        } finally {
            publish();
        }
    }

    @Override
    public void mergeEvents(Collection<Event> events) {
        try {
            synchronized (this) {
                checkOpen();
                var union = new LinkedHashMap<Hlc, Event>();
                for (var e : loadAll()) union.putIfAbsent(e.id(), e);
                int before = union.size();
                if (events != null) {
                    for (var e : events) union.putIfAbsent(e.id(), e);
                }
                log.info("Merging {} new events into {}", union.size() - before, before);
                wipe();
                append(union.values());
            }
        } finally {
            publish();
        }
    }

    @Override
    public void replayAll() {
        List<Event> events;
        synchronized (this) {
            checkOpen();
            events = loadAll();
        }
        replayAll(events);
    }

    @Override
    public synchronized void replayAll(Collection<Event> events) {
        checkOpen();
        if (events == null) return;
        var sorted = sortById(events);
        log.info("Replaying {} events", sorted.size());
        for (var e : sorted) processor.process(e);
    }

    @Override
    public synchronized void dispose() {
        if (disposed) return;
        disposed = true;
        queue.clear();
        outbox.clear();
        try {
            bus.close();
            snapshots.close();
        } finally {
            release();
        }
    }

    @Override
    public boolean isDisposed() { return disposed; }

    protected final void checkOpen() {
        if (disposed) throw new IllegalStateException(getClass().getSimpleName() + " is disposed");
    }

    static List<Event> sortById(Collection<Event> events) {
        return events.stream().sorted(BY_ID).toList();
    }
}
