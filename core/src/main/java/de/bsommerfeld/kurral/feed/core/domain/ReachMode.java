package de.bsommerfeld.kurral.feed.core.domain;

/**
 * Visibility rule family attached to a post.
 */
public enum ReachMode {

    /** Visible to everyone. */
    OPEN,

    /** Visible only to the audience computed from the policy's gates. */
    TARGETED
}
