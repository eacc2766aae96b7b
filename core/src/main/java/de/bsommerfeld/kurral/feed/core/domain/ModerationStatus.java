package de.bsommerfeld.kurral.feed.core.domain;

/**
 * Outcome of the external fact-check pipeline for a single post.
 * Posts that were never checked are treated as {@link #CLEAN}.
 */
public enum ModerationStatus {

    CLEAN,
    NEEDS_REVIEW,
    BLOCKED;

    public boolean isBlocked() {
        return this == BLOCKED;
    }
}
