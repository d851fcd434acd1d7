package io.timeline.app;

import io.timeline.core.Event;
import io.timeline.store.EventStore;
import io.timeline.store.EventStoreFactory;
import io.timeline.store.ViewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Named integer counters projected from counter events. */
public final class CounterView implements ViewStore<Map<String, Integer>> {
    private static final Logger log = LoggerFactory.getLogger(CounterView.class);

    private final Map<String, Integer> counters = new ConcurrentHashMap<>();
    private final EventStore store;

    public CounterView(EventStoreFactory stores) {
        this.store = stores.create(this::onEvent);
    }

    @Override
    public EventStore eventStore() { return store; }

    @Override
    public Map<String, Integer> state() { return Map.copyOf(counters); }

    public int count(String key) { return counters.getOrDefault(key, 0); }

    public int count() { return count(CounterEvents.DEFAULT_KEY); }

    @Override
    public void onEvent(Event e) {
        var type = CounterEventType.of(e.type());
        var key = CounterEvents.key(e);
        int amount = CounterEvents.amount(e, type);
        int current = count(key);
        int next = switch (type) {
            case SET_VALUE, RESET -> amount;
            case INCREMENT -> current + amount;
            case DECREMENT -> current - amount;
        };
        counters.put(key, next);
        log.debug("{} {} -> {}", type, key, next);
    }

    @Override
    public void onReset() { counters.clear(); }
}
