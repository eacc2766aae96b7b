package de.bsommerfeld.kurral.feed.store;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Document-store contract the feed service reads its inputs from. All
 * implementations must be thread-safe; requests for different viewers may
 * arrive concurrently.
 *
 * <p>
 * The ranking engine never talks to a store directly. It receives plain
 * values loaded through this interface.
 */
public interface FeedStore {

    /**
     * Returns the viewer with the given id, or {@code null} if unknown.
     */
    Viewer getViewer(String viewerId);

    /**
     * Inserts or replaces a viewer.
     */
    void saveViewer(Viewer viewer);

    /**
     * Inserts or replaces a candidate post.
     */
    void saveCandidate(Candidate candidate);

    default void saveCandidates(Collection<Candidate> candidates) {
        candidates.forEach(this::saveCandidate);
    }

    /**
     * Returns all candidates created at or after {@code since}, newest first.
     */
    List<Candidate> getCandidatesSince(Instant since);

    /**
     * Returns the viewer's stored feed configuration, or {@code null} if the
     * viewer never tuned their feed. Callers get their own copy.
     */
    FeedConfig getFeedConfig(String viewerId);

    void saveFeedConfig(String viewerId, FeedConfig config);

    /**
     * Adds and removes free-form interests of a viewer. Removal is applied
     * after addition.
     *
     * @return {@code false} if the viewer is unknown
     */
    boolean applyInterestAdjustment(String viewerId, List<String> add, List<String> remove);
}
