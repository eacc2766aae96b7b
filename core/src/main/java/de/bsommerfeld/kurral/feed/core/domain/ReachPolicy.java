package de.bsommerfeld.kurral.feed.core.domain;

import dev.langchain4j.data.embedding.Embedding;

import java.util.Objects;
import java.util.Optional;

/**
 * Reach settings of a post. For {@link ReachMode#TARGETED} posts the two
 * gates decide which side of the follow graph may see the post; an optional
 * target-audience embedding replaces the gates whenever the viewer carries a
 * profile embedding too. A targeted policy with both gates closed is legal
 * and leaves the post visible to its author only.
 *
 * @param mode              open or targeted
 * @param allowFollowers    targeted only: followers of the author may see it
 * @param allowNonFollowers targeted only: non-followers may see it
 * @param targetAudience    targeted only: embedding of the intended audience
 */
public record ReachPolicy(
        ReachMode mode,
        boolean allowFollowers,
        boolean allowNonFollowers,
        Optional<Embedding> targetAudience) {

    private static final ReachPolicy OPEN = new ReachPolicy(ReachMode.OPEN, true, true, Optional.empty());

    public ReachPolicy {
        Objects.requireNonNull(mode, "mode");
        targetAudience = targetAudience == null ? Optional.empty() : targetAudience;
    }

    public static ReachPolicy open() {
        return OPEN;
    }

    public static ReachPolicy targeted(boolean allowFollowers, boolean allowNonFollowers) {
        return new ReachPolicy(ReachMode.TARGETED, allowFollowers, allowNonFollowers, Optional.empty());
    }

    /**
     * Returns a copy carrying the given target-audience embedding.
     */
    public ReachPolicy withTargetAudience(Embedding embedding) {
        return new ReachPolicy(mode, allowFollowers, allowNonFollowers, Optional.ofNullable(embedding));
    }

    public boolean isOpen() {
        return mode == ReachMode.OPEN;
    }
}
