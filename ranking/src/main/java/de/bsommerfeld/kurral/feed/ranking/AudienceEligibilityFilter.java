package de.bsommerfeld.kurral.feed.ranking;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.ReachPolicy;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import de.bsommerfeld.kurral.feed.core.vector.AudienceSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Decides whether a single post may be shown to a single viewer at all,
 * independent of how it would rank.
 *
 * <p>
 * Rules, first match wins:
 * <ol>
 * <li>blocked posts are hidden from everyone but their author</li>
 * <li>posts without reach data are hidden</li>
 * <li>posts whose primary topic is muted are hidden, unless muting is
 * relaxed; an author still sees their own targeted post</li>
 * <li>open posts are visible</li>
 * <li>the author sees their own targeted post</li>
 * <li>targeted posts: with both embeddings present, the profile/audience
 * cosine similarity must reach the threshold; otherwise the follower and
 * non-follower gates decide</li>
 * </ol>
 * A missing viewer can only see open posts.
 */
@Singleton
public class AudienceEligibilityFilter {

    private static final Logger LOG = LoggerFactory.getLogger(AudienceEligibilityFilter.class);

    private final double defaultSimilarityThreshold;

    @Inject
    public AudienceEligibilityFilter(RankingConfig rankingConfig) {
        this.defaultSimilarityThreshold = rankingConfig.getSimilarityThreshold();
    }

    public boolean isEligible(Candidate candidate, Viewer viewer, FeedConfig config) {
        return isEligible(candidate, viewer, config, false);
    }

    /**
     * @param relaxMuted if {@code true}, muted topics do not hide posts; used by
     *                   the selector's fallback when muting emptied the feed
     */
    public boolean isEligible(Candidate candidate, Viewer viewer, FeedConfig config, boolean relaxMuted) {
        Objects.requireNonNull(config, "config");

        boolean author = viewer != null && viewer.isAuthorOf(candidate);
        if (candidate.moderation().isBlocked() && !author)
            return false;

        ReachPolicy reach = candidate.reach();
        if (reach == null) {
            LOG.debug("Candidate {} has no reach settings, hiding it", candidate.id());
            return false;
        }

        if (!relaxMuted && config.mutes(candidate.topic()) && !(author && !reach.isOpen()))
            return false;

        if (reach.isOpen())
            return true;
        if (author)
            return true;

        if (viewer == null)
            return false;

        OptionalDouble similarity = AudienceSimilarity.between(viewer, candidate);
        if (similarity.isPresent()) {
            double threshold = config.similarityThresholdOr(defaultSimilarityThreshold);
            boolean accepted = similarity.getAsDouble() >= threshold;
            if (!accepted) {
                LOG.trace("Candidate {} targeted audience mismatch for {} ({} < {})",
                        candidate.id(), viewer.id(), similarity.getAsDouble(), threshold);
            }
            return accepted;
        }

        boolean following = viewer.follows(candidate.authorId());
        if (reach.allowFollowers() && following)
            return true;
        return reach.allowNonFollowers() && !following;
    }
}
