package de.bsommerfeld.kurral.feed.ranking;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import de.bsommerfeld.kurral.feed.core.vector.AudienceSimilarity;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds the {@link ScoringTerm}s over one candidate. Terms whose absolute
 * contribution exceeds the reason threshold contribute their reason; a
 * candidate nothing speaks for is explained as a recent post.
 */
@Singleton
public class RelevanceScorer {

    static final String FALLBACK_REASON = "recent post";

    private final List<ScoringTerm> terms;
    private final double reasonThreshold;
    private final Clock clock;

    @Inject
    public RelevanceScorer(RankingConfig rankingConfig, Clock clock) {
        this(List.of(ScoringTerm.values()), rankingConfig.getReasonThreshold(), clock);
    }

    RelevanceScorer(List<ScoringTerm> terms, double reasonThreshold, Clock clock) {
        this.terms = List.copyOf(terms);
        this.reasonThreshold = reasonThreshold;
        this.clock = clock;
    }

    public ScoredCandidate score(Candidate candidate, Viewer viewer, FeedConfig config) {
        return score(candidate, viewer, config, clock.instant());
    }

    /**
     * Scores against an explicit reference time so that one ranking pass uses
     * a single "now" for every candidate.
     */
    public ScoredCandidate score(Candidate candidate, Viewer viewer, FeedConfig config, Instant now) {
        Objects.requireNonNull(config, "config");
        ScoringInput input = new ScoringInput(candidate, viewer, config, now,
                AudienceSimilarity.between(viewer, candidate));

        double score = 0;
        List<String> reasons = new ArrayList<>();
        for (ScoringTerm term : terms) {
            TermContribution contribution = term.evaluate(input);
            score += contribution.delta();
            if (contribution.reason() != null && Math.abs(contribution.delta()) > reasonThreshold)
                reasons.add(contribution.reason());
        }
        if (reasons.isEmpty())
            reasons.add(FALLBACK_REASON);
        return new ScoredCandidate(candidate, score, reasons);
    }
}
