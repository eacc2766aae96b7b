package de.bsommerfeld.kurral.feed.ranking;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Produces the final "For You" page: time window, eligibility (with a
 * relaxed-mute fallback), scoring, tie-band ordering and the per-author
 * diversity cap.
 *
 * <p>
 * The selector never fabricates results. If nothing survives, the page is
 * empty.
 */
@Singleton
public class RankedSelector {

    private static final Logger LOG = LoggerFactory.getLogger(RankedSelector.class);

    private static final int[] WINDOW_STEPS = { 3, 7, 14, 21, 28 };

    private final AudienceEligibilityFilter eligibilityFilter;
    private final RelevanceScorer scorer;
    private final RankingConfig rankingConfig;
    private final Clock clock;
    private final TieBandOrdering ordering;
    private final AuthorDiversityCap diversityCap;

    @Inject
    public RankedSelector(AudienceEligibilityFilter eligibilityFilter, RelevanceScorer scorer,
            RankingConfig rankingConfig, Clock clock) {
        this.eligibilityFilter = eligibilityFilter;
        this.scorer = scorer;
        this.rankingConfig = rankingConfig;
        this.clock = clock;
        this.ordering = new TieBandOrdering(rankingConfig.getTieThreshold(), rankingConfig.getTiePercentage());
        this.diversityCap = new AuthorDiversityCap(rankingConfig.getTopWindowSize(),
                rankingConfig.getTopWindowAuthorLimit(), rankingConfig.getTotalAuthorLimit());
    }

    public List<ScoredCandidate> rank(Collection<Candidate> candidates, Viewer viewer, FeedConfig config) {
        return rank(candidates, viewer, config, rankingConfig.getDefaultLimit());
    }

    public List<ScoredCandidate> rank(Collection<Candidate> candidates, Viewer viewer, FeedConfig config,
            int limit) {
        Objects.requireNonNull(config, "config");
        if (viewer == null || candidates == null || candidates.isEmpty() || limit <= 0)
            return List.of();

        Instant now = clock.instant();
        int baseWindow = clampWindow(config.getTimeWindowDays(), rankingConfig.getMaxTimeWindowDays());
        List<Integer> windows = rankingConfig.isExpandTimeWindow()
                ? windowSequence(baseWindow, rankingConfig.getMaxTimeWindowDays())
                : List.of(baseWindow);

        for (int days : windows) {
            List<Candidate> recent = withinWindow(candidates, now, days);
            if (recent.isEmpty())
                continue;

            List<Candidate> eligible = eligible(recent, viewer, config, false);
            if (eligible.isEmpty()) {
                eligible = eligible(recent, viewer, config, true);
                if (!eligible.isEmpty())
                    LOG.debug("Muted topics emptied the feed for {}, relaxing mutes ({} candidates)",
                            viewer.id(), eligible.size());
            }
            if (eligible.isEmpty())
                continue;

            List<ScoredCandidate> scored = new ArrayList<>(eligible.size());
            for (Candidate candidate : eligible)
                scored.add(scorer.score(candidate, viewer, config, now));

            List<ScoredCandidate> page = diversityCap.apply(ordering.sort(scored), limit);
            LOG.debug("Ranked {} of {} candidates for {} over {} days", page.size(), candidates.size(),
                    viewer.id(), days);
            return page;
        }
        LOG.debug("No eligible candidates for {}", viewer.id());
        return List.of();
    }

    private List<Candidate> withinWindow(Collection<Candidate> candidates, Instant now, int days) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.createdAt().isAfter(cutoff))
                .collect(Collectors.toList());
    }

    private List<Candidate> eligible(List<Candidate> candidates, Viewer viewer, FeedConfig config,
            boolean relaxMuted) {
        return candidates.stream()
                .filter(c -> eligibilityFilter.isEligible(c, viewer, config, relaxMuted))
                .collect(Collectors.toList());
    }

    static int clampWindow(int days, int maxDays) {
        return Math.max(1, Math.min(days, maxDays));
    }

    /**
     * Windows tried when expansion is enabled: the base window, then
     * progressively wider ones up to the maximum, without repeats.
     */
    static List<Integer> windowSequence(int baseDays, int maxDays) {
        Set<Integer> sequence = new LinkedHashSet<>();
        int base = clampWindow(baseDays, maxDays);
        sequence.add(base);
        for (int step : WINDOW_STEPS)
            sequence.add(clampWindow(base + step, maxDays));
        sequence.add(maxDays);
        return new ArrayList<>(sequence);
    }
}
