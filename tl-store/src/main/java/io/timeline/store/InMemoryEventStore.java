package io.timeline.store;

import io.timeline.core.Event;
import io.timeline.core.Hlc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Process-lifetime store for tests and ephemeral state. A repeated id replaces the event in place. */
public final class InMemoryEventStore extends AbstractEventStore {
    private final Map<Hlc, Event> events = new LinkedHashMap<>();

    public InMemoryEventStore(EventProcessor processor) { super(processor); }

    public InMemoryEventStore() { this(EventProcessor.NONE); }

    @Override
    protected void persist(Event event) { events.put(event.id(), event); }

    @Override
    protected List<Event> loadAll() { return List.copyOf(events.values()); }

    @Override
    protected Optional<Event> load(Hlc id) { return Optional.ofNullable(events.get(id)); }

    @Override
    protected void clear() { events.clear(); }
}
