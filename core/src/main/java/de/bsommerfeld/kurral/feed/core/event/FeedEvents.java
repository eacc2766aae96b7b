package de.bsommerfeld.kurral.feed.core.event;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;

import java.util.List;

/**
 * Events published by the feed service after a viewer changed their
 * preferences. Consumers live outside the ranking engine.
 */
public final class FeedEvents {

    private FeedEvents() {
    }

    /**
     * A viewer's feed configuration was replaced.
     *
     * @param viewerId the viewer whose configuration changed
     * @param config   the new configuration (a private copy)
     * @param changes  human-readable change log, possibly empty
     */
    public record FeedConfigChangedEvent(String viewerId, FeedConfig config, List<String> changes) {

        public FeedConfigChangedEvent {
            config = config.copy();
            changes = List.copyOf(changes);
        }
    }

    /**
     * Interests to add to or remove from a viewer's stored interest set.
     * Never published with both lists empty.
     */
    public record InterestsAdjustedEvent(String viewerId, List<String> add, List<String> remove) {

        public InterestsAdjustedEvent {
            add = List.copyOf(add);
            remove = List.copyOf(remove);
        }
    }
}
