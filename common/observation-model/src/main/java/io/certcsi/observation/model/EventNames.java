package io.certcsi.observation.model;

import java.util.Locale;
import java.util.UUID;

/**
 * Generates debugging names for events, e.g.
 * {@code event-pvc-bound-3f0c1b52-9d4e-4b7a-8a51-0c6f2d9e7b11}. The random UUID suffix keeps names
 * unique across every run sharing a store.
 */
public final class EventNames {

    private EventNames() {}

    public static String generate(EventType type) {
        String tag = type.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return "event-" + tag + "-" + UUID.randomUUID();
    }
}
