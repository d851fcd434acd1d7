package io.timeline.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain fact. {@code id} is unique within a store; {@code data} keeps insertion order
 * and may hold any JSON-compatible value (including {@code null}). Numbers, lists and nested maps
 * are normalised to the types they decode to, so an event equals its own JSON round trip.
 */
public record Event(Hlc id, String type, Map<String, Object> data, String schemaVersion) {

    public static final String DEFAULT_SCHEMA_VERSION = "1.0.0";

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : JsonValues.object(data);
        if (schemaVersion == null || schemaVersion.isBlank()) schemaVersion = DEFAULT_SCHEMA_VERSION;
    }

    public Event(Hlc id, String type, Map<String, Object> data) {
        this(id, type, data, DEFAULT_SCHEMA_VERSION);
    }

    /** Fresh event stamped by {@code clock} for its default node. */
    public static Event of(HlcClock clock, String type, Map<String, Object> data) {
        return new Event(clock.now(), type, data);
    }

    public Instant timestamp() { return id.toInstant(); }

    public String nodeId() { return id.nodeId(); }

    public long counter() { return id.counter(); }
}
