package de.bsommerfeld.kurral.feed.ranking;

import de.bsommerfeld.kurral.feed.core.domain.Candidate;

import java.util.List;

/**
 * A candidate together with its relevance score and the reasons behind it.
 * Created fresh on every ranking pass.
 *
 * @param candidate the scored post
 * @param score     sum of all scoring terms (may be negative)
 * @param reasons   human-readable reasons in term order, never empty
 */
public record ScoredCandidate(Candidate candidate, double score, List<String> reasons) {

    public ScoredCandidate {
        reasons = List.copyOf(reasons);
    }

    /**
     * UI explanation, e.g. {@code Because: you follow @ana + active conversation}.
     */
    public String explanation() {
        return "Because: " + String.join(" + ", reasons);
    }
}
