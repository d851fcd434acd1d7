package io.timeline.store;

import io.timeline.core.Event;

/** Callback invoked once per dispatched event, usually a projection's {@code onEvent}. */
@FunctionalInterface
public interface EventProcessor {
    void process(Event event);

    EventProcessor NONE = e -> {};
}
