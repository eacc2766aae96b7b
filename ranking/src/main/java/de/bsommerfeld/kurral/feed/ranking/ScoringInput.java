package de.bsommerfeld.kurral.feed.ranking;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Everything a {@link ScoringTerm} may look at. The audience similarity is
 * computed once per candidate and shared by all terms.
 *
 * @param candidate  the post being scored
 * @param viewer     the viewer, {@code null} for anonymous scoring
 * @param config     the viewer's feed configuration
 * @param now        reference time for recency
 * @param similarity profile/audience cosine similarity, empty when either
 *                   embedding is missing
 */
public record ScoringInput(
        Candidate candidate,
        Viewer viewer,
        FeedConfig config,
        Instant now,
        OptionalDouble similarity) {
}
