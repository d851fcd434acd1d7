package io.timeline.core;

import java.time.Clock;
import java.util.Objects;

/**
 * Issues monotonically increasing {@link Hlc}s.
 *
 * Each instance owns its last issued (physical, counter) pair; share the instance between
 * producers that must be ordered against each other. Thread-safe.
 */
public final class HlcClock {
    private final Clock clock;
    private final String defaultNode;

    private long lastPhysical = -1;
    private long lastCounter;

    public HlcClock(Clock clock, String defaultNode) {
        this.clock = Objects.requireNonNull(clock);
        this.defaultNode = Nodes.node(defaultNode);
    }

    public HlcClock(String defaultNode) { this(Clock.systemUTC(), defaultNode); }

    public HlcClock() { this(Clock.systemUTC(), null); }

    public String defaultNode() { return defaultNode; }

    public Hlc now() { return now(defaultNode); }

    /**
     * Next identifier for {@code nodeId}. A physical reading ahead of the last issue resets the
     * counter; otherwise the last physical time is kept and the counter advances, so a clock that
     * steps backwards never produces a smaller identifier.
     */
    public synchronized Hlc now(String nodeId) {
        long pt = clock.millis();
        if (pt > lastPhysical) {
            lastPhysical = pt;
            lastCounter = 0;
        } else {
            lastCounter = nextCounter(lastCounter);
        }
        return new Hlc(lastPhysical, lastCounter, nodeId);
    }

    /** Merge a remote identifier so that the next local issue sorts after it. */
    public synchronized Hlc observe(Hlc remote) {
        Objects.requireNonNull(remote);
        long pt = clock.millis();
        long max = Math.max(pt, Math.max(lastPhysical, remote.physicalTimeMillis()));
        if (max == lastPhysical && max == remote.physicalTimeMillis()) {
            lastCounter = nextCounter(Math.max(lastCounter, remote.counter()));
        } else if (max == lastPhysical) {
            lastCounter = nextCounter(lastCounter);
        } else if (max == remote.physicalTimeMillis()) {
            lastCounter = nextCounter(remote.counter());
        } else {
            lastCounter = 0;
        }
        lastPhysical = max;
        return new Hlc(lastPhysical, lastCounter, defaultNode);
    }

    private static long nextCounter(long counter) {
        if (counter >= Hlc.MAX_COUNTER) {
            throw new IllegalStateException("HLC counter overflow within one millisecond");
        }
        return counter + 1;
    }

    @Override
    public synchronized String toString() {
        return "HlcClock{node=" + defaultNode + ", last=" + lastPhysical + ":" + lastCounter + '}';
    }
}
