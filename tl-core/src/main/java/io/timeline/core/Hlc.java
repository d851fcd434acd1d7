package io.timeline.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Hybrid logical clock identifier: physical millis, a logical counter and the issuing node.
 *
 * Canonical form is {@code "<physicalTime>:<counter>:<nodeId>"}. Ordering compares time, then
 * counter, then node id (lexicographic), which makes it a strict total order. The counter is an
 * unsigned 32-bit value held in a {@code long}.
 */
public record Hlc(long physicalTimeMillis, long counter, String nodeId) implements Comparable<Hlc> {

    public static final long MAX_COUNTER = 0xFFFF_FFFFL;

    public static final Comparator<Hlc> ORDER = Comparator
            .comparingLong(Hlc::physicalTimeMillis)
            .thenComparingLong(Hlc::counter)
            .thenComparing(Hlc::nodeId);

    public Hlc {
        if (physicalTimeMillis < 0) throw new IllegalArgumentException("physicalTimeMillis < 0: " + physicalTimeMillis);
        if (counter < 0 || counter > MAX_COUNTER) throw new IllegalArgumentException("counter out of range: " + counter);
        if (nodeId == null || nodeId.isEmpty()) throw new IllegalArgumentException("nodeId is empty");
    }

    /** Parse the canonical form; node ids may themselves contain ':'. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Hlc parse(String value) {
        if (value == null) throw new MalformedIdentifierException("null", "identifier is null");
        var parts = value.split(":", 3);
        if (parts.length != 3) throw new MalformedIdentifierException(value, "expected time:counter:node");
        long time;
        long counter;
        try {
            time = Long.parseLong(parts[0]);
            counter = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            throw new MalformedIdentifierException(value, "non-numeric time or counter");
        }
        if (time < 0 || counter < 0) throw new MalformedIdentifierException(value, "negative time or counter");
        if (counter > MAX_COUNTER) throw new MalformedIdentifierException(value, "counter exceeds 32 bits");
        if (parts[2].isEmpty()) throw new MalformedIdentifierException(value, "empty node id");
        // reject "+1" / " 1" style input that parseLong tolerates
        if (!parts[0].equals(Long.toString(time)) || !parts[1].equals(Long.toString(counter))) {
            throw new MalformedIdentifierException(value, "non-canonical number");
        }
        return new Hlc(time, counter, parts[2]);
    }

    /** -1, 0 or 1. */
    public static int compare(Hlc a, Hlc b) {
        return Integer.signum(ORDER.compare(a, b));
    }

    @Override
    public int compareTo(Hlc other) { return compare(this, Objects.requireNonNull(other)); }

    public boolean isBefore(Hlc other) { return compareTo(other) < 0; }

    public boolean isAfter(Hlc other) { return compareTo(other) > 0; }

    public Instant toInstant() { return Instant.ofEpochMilli(physicalTimeMillis); }

    @JsonValue
    public String format() { return physicalTimeMillis + ":" + counter + ":" + nodeId; }

    @Override public String toString() { return format(); }
}
