package de.bsommerfeld.kurral.feed.ranking;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;
import de.bsommerfeld.kurral.feed.core.domain.ModerationStatus;
import de.bsommerfeld.kurral.feed.core.domain.ReachPolicy;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import dev.langchain4j.data.embedding.Embedding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RelevanceScorerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private RelevanceScorer scorer;
    private FeedConfig config;
    private Viewer viewer;

    @BeforeEach
    void setUp() {
        scorer = new RelevanceScorer(new RankingConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
        config = new FeedConfig();
        viewer = new Viewer("viewer", Set.of("ana"), Set.of());
    }

    private static Candidate post(String authorId, String topic, Duration age) {
        return new Candidate("c-" + authorId, authorId, topic, NOW.minus(age));
    }

    @Test
    void score_shouldGiveExactlyFiftyForHeavyFollowOfStalePost() {
        config.setFollowingWeight(FollowingWeight.HEAVY);
        var candidate = post("ana", "music", Duration.ofHours(40));

        var scored = scorer.score(candidate, viewer, config);

        assertEquals(50.0, scored.score());
        assertEquals(List.of("you follow @ana"), scored.reasons());
    }

    @Test
    void score_shouldUseAuthorHandleInFollowReason() {
        var candidate = new Candidate("c1", "ana", "ana_codes", "dev", List.of(), ReachPolicy.open(),
                NOW.minus(Duration.ofDays(2)), 0, null);

        var scored = scorer.score(candidate, viewer, config);

        assertEquals(30.0, scored.score());
        assertEquals("Because: you follow @ana_codes", scored.explanation());
    }

    @Test
    void score_shouldExplainOwnPost() {
        var own = post("viewer", "dev", Duration.ofDays(3));

        var scored = scorer.score(own, viewer, config);

        assertEquals(30.0, scored.score());
        assertEquals(List.of("your own post"), scored.reasons());
    }

    @Test
    void score_shouldFallBackToRecentPostReason() {
        var fresh = post("stranger", "sports", Duration.ZERO);

        var scored = scorer.score(fresh, viewer, config);

        assertEquals(15.0, scored.score());
        assertEquals(List.of("recent post"), scored.reasons());
    }

    @Test
    void score_shouldDecayRecencyByHalfPointPerHour() {
        var sixHoursOld = post("stranger", "sports", Duration.ofHours(6));

        assertEquals(12.0, scorer.score(sixHoursOld, viewer, config).score(), 1e-9);
    }

    @Test
    void score_shouldTreatFuturePostsAsBrandNew() {
        var future = new Candidate("c-future", "stranger", "sports", NOW.plus(Duration.ofHours(3)));

        assertEquals(15.0, scorer.score(future, viewer, config).score(), 1e-9);
    }

    @Test
    void score_shouldRewardMatchingInterests() {
        var interested = new Viewer("viewer", Set.of(), Set.of("Rust"));
        var candidate = post("stranger", "dev", Duration.ofDays(2))
                .withSemanticTopics(List.of("rust", "async Rust", "cooking"));

        var scored = scorer.score(candidate, interested, config);

        assertEquals(40.0, scored.score(), 1e-9);
        assertEquals(List.of("matches your interest \"rust\""), scored.reasons());
    }

    @Test
    void score_shouldCapInterestBonus() {
        var interested = new Viewer("viewer", Set.of(), Set.of("ai"));
        var candidate = post("stranger", "dev", Duration.ofDays(2))
                .withSemanticTopics(List.of("ai", "ai agents", "open ai", "ai safety", "ai art", "ai music"));

        assertEquals(55.0, scorer.score(candidate, interested, config).score(), 1e-9);
    }

    @Test
    void score_shouldApplyLikedAndMutedTopics() {
        config.setLikedTopics(List.of("dev"));
        config.setMutedTopics(List.of("crypto"));
        var liked = post("stranger", "DEV", Duration.ofDays(2));
        var muted = post("stranger", "crypto", Duration.ofDays(2));

        var likedScore = scorer.score(liked, viewer, config);
        var mutedScore = scorer.score(muted, viewer, config);

        assertEquals(25.0, likedScore.score());
        assertEquals(List.of("topic #dev you like"), likedScore.reasons());
        assertEquals(-100.0, mutedScore.score());
        assertEquals(List.of("topic #crypto you muted"), mutedScore.reasons());
    }

    @Test
    void score_shouldBoostActiveConversationsOnlyWhenEnabled() {
        var busy = post("stranger", "sports", Duration.ofDays(2)).withCommentCount(99);

        var boosted = scorer.score(busy, viewer, config);
        config.setBoostActiveConversations(false);
        var plain = scorer.score(busy, viewer, config);

        assertEquals(10.0, boosted.score(), 1e-9);
        assertEquals(List.of("active conversation"), boosted.reasons());
        assertEquals(0.0, plain.score());
    }

    @Test
    void score_shouldNotExplainContributionsAtTheThreshold() {
        // log10(10) * 5 = 5, not above the reason threshold
        var quiet = post("stranger", "sports", Duration.ofDays(2)).withCommentCount(9);

        var scored = scorer.score(quiet, viewer, config);

        assertEquals(5.0, scored.score(), 1e-9);
        assertEquals(List.of("recent post"), scored.reasons());
    }

    @Test
    void score_shouldAddSemanticSimilarity() {
        var embeddedViewer = viewer.withProfileEmbedding(Embedding.from(new float[] { 1f, 0f }));
        var reach = ReachPolicy.targeted(false, true).withTargetAudience(Embedding.from(new float[] { 3f, 0f }));
        var candidate = post("stranger", "dev", Duration.ofDays(2)).withReach(reach);

        var scored = scorer.score(candidate, embeddedViewer, config);

        assertEquals(35.0, scored.score(), 1e-6);
        assertEquals(List.of("aligns with your profile (100% similarity)"), scored.reasons());
    }

    @Test
    void score_shouldPenaliseModeration() {
        var pending = post("stranger", "dev", Duration.ofDays(2)).withModeration(ModerationStatus.NEEDS_REVIEW);

        var scored = scorer.score(pending, viewer, config);

        assertEquals(-20.0, scored.score());
        assertEquals(List.of("fact-check needs review"), scored.reasons());
    }

    @Test
    void score_shouldListReasonsInTermOrder() {
        config.setLikedTopics(List.of("dev"));
        var candidate = post("ana", "dev", Duration.ofDays(1)).withCommentCount(999);

        var scored = scorer.score(candidate, viewer, config);

        assertEquals("Because: you follow @ana + topic #dev you like + active conversation",
                scored.explanation());
    }

    @Test
    void score_shouldStrictlyIncreaseWithFollowingWeight() {
        var candidate = post("ana", "dev", Duration.ofHours(5)).withCommentCount(3);
        double previous = Double.NEGATIVE_INFINITY;

        for (FollowingWeight weight : FollowingWeight.values()) {
            config.setFollowingWeight(weight);
            double score = scorer.score(candidate, viewer, config).score();
            assertTrue(score > previous, "score did not increase at " + weight);
            previous = score;
        }
    }

    @Test
    void score_shouldIgnoreMissingViewer() {
        var fresh = post("ana", "dev", Duration.ZERO);

        assertEquals(15.0, scorer.score(fresh, null, config).score());
    }
}
