package de.bsommerfeld.kurral.feed.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered tiers controlling how strongly content from followed authors is
 * favored. Declaration order is the tier order, weakest first.
 */
public enum FollowingWeight {

    NONE(0),
    LIGHT(10),
    MEDIUM(30),
    HEAVY(50);

    private final int boost;

    FollowingWeight(int boost) {
        this.boost = boost;
    }

    /** Score points added for a followed (or own) post at this tier. */
    public int boost() {
        return boost;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a tier from its lowercase key ("none", "light", ...).
     *
     * @throws IllegalArgumentException for unknown keys
     */
    @JsonCreator
    public static FollowingWeight fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
