package io.timeline.core;

import java.util.Optional;

/** Default node identity for this process. */
public final class Nodes {

    /** Fallback when neither configuration nor environment names the node. */
    public static final String DEFAULT_NODE = "api";

    private static final String ENV_NODE =
            Optional.ofNullable(System.getenv("TIMELINE_NODE"))
                    .filter(s -> !s.isBlank())
                    .orElse(null);

    private Nodes() {}

    /**
     * Effective node name.
     * Precedence: explicit value → env(TIMELINE_NODE) → "api"
     */
    public static String node(String configured) {
        if (configured != null && !configured.isBlank()) return configured.trim();
        return ENV_NODE != null ? ENV_NODE : DEFAULT_NODE;
    }

    public static String node() { return node(null); }
}
