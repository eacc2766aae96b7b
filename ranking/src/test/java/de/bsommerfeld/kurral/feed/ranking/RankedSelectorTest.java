package de.bsommerfeld.kurral.feed.ranking;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;
import de.bsommerfeld.kurral.feed.core.domain.ReachPolicy;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RankedSelectorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private RankingConfig rankingConfig;
    private RankedSelector selector;
    private FeedConfig config;
    private Viewer viewer;

    @BeforeEach
    void setUp() {
        rankingConfig = new RankingConfig();
        selector = newSelector(rankingConfig);
        config = new FeedConfig();
        viewer = new Viewer("viewer", Set.of("ana"), Set.of());
    }

    private static RankedSelector newSelector(RankingConfig rankingConfig) {
        return new RankedSelector(new AudienceEligibilityFilter(rankingConfig),
                new RelevanceScorer(rankingConfig, CLOCK), rankingConfig, CLOCK);
    }

    private static Candidate post(String id, String authorId, String topic, Duration age) {
        return new Candidate(id, authorId, topic, NOW.minus(age));
    }

    private static List<String> ids(List<ScoredCandidate> list) {
        return list.stream().map(s -> s.candidate().id()).collect(Collectors.toList());
    }

    @Test
    void rank_shouldReturnEmptyForMissingViewer() {
        var candidates = List.of(post("c1", "ana", "dev", Duration.ofHours(1)));

        assertTrue(selector.rank(candidates, null, config).isEmpty());
    }

    @Test
    void rank_shouldReturnEmptyForNonPositiveLimit() {
        var candidates = List.of(post("c1", "ana", "dev", Duration.ofHours(1)));

        assertTrue(selector.rank(candidates, viewer, config, 0).isEmpty());
    }

    @Test
    void rank_shouldOrderByScore() {
        var followed = post("followed", "ana", "dev", Duration.ofHours(2));
        var stranger = post("stranger", "bob", "dev", Duration.ofHours(1));

        var page = selector.rank(List.of(stranger, followed), viewer, config);

        assertEquals(List.of("followed", "stranger"), ids(page));
        assertEquals(44.0, page.get(0).score(), 1e-9);
    }

    @Test
    void rank_shouldDropPostsOutsideTimeWindow() {
        var recent = post("recent", "bob", "dev", Duration.ofDays(2));
        var old = post("old", "bob", "music", Duration.ofDays(10));

        assertEquals(List.of("recent"), ids(selector.rank(List.of(recent, old), viewer, config)));

        config.setTimeWindowDays(14);
        assertEquals(List.of("recent", "old"), ids(selector.rank(List.of(recent, old), viewer, config)));
    }

    @Test
    void rank_shouldClampTimeWindow() {
        var twoDays = post("two-days", "bob", "dev", Duration.ofDays(2));
        var fortyDays = post("forty-days", "carl", "dev", Duration.ofDays(40));
        var twentyDays = post("twenty-days", "dora", "dev", Duration.ofDays(20));

        config.setTimeWindowDays(0);
        assertTrue(selector.rank(List.of(twoDays), viewer, config).isEmpty());

        config.setTimeWindowDays(365);
        assertEquals(List.of("twenty-days"), ids(selector.rank(List.of(fortyDays, twentyDays), viewer, config)));
    }

    @Test
    void rank_shouldExcludeMutedTopicsWhenOthersRemain() {
        config.setMutedTopics(List.of("crypto"));
        var muted = post("muted", "ana", "crypto", Duration.ofHours(1));
        var kept = post("kept", "bob", "dev", Duration.ofHours(1));

        assertEquals(List.of("kept"), ids(selector.rank(List.of(muted, kept), viewer, config)));
    }

    @Test
    void rank_shouldRelaxMutesWhenEverythingIsMuted() {
        config.setMutedTopics(List.of("crypto"));
        var muted = post("muted", "bob", "crypto", Duration.ofHours(1));

        var page = selector.rank(List.of(muted), viewer, config);

        assertEquals(List.of("muted"), ids(page));
        assertTrue(page.get(0).score() < 0);
        assertTrue(page.get(0).reasons().contains("topic #crypto you muted"));
    }

    @Test
    void rank_shouldIncludeAuthorOnlyPostForAuthor() {
        var own = post("own", "viewer", "dev", Duration.ofHours(3)).withReach(ReachPolicy.targeted(false, false));
        var hidden = post("hidden", "bob", "dev", Duration.ofHours(3)).withReach(ReachPolicy.targeted(false, false));

        assertEquals(List.of("own"), ids(selector.rank(List.of(own, hidden), viewer, config)));
    }

    @Test
    void rank_shouldBreakNearTiesByRecency() {
        var olderHigher = post("older", "bob", "dev", Duration.ofHours(1)).withCommentCount(1);
        var newer = post("newer", "carl", "dev", Duration.ZERO);

        // about 16.0 vs 15.0, inside the 2 point band
        assertEquals(List.of("newer", "older"), ids(selector.rank(List.of(olderHigher, newer), viewer, config)));
    }

    @Test
    void rank_shouldCapPostsPerAuthor() {
        config.setFollowingWeight(FollowingWeight.HEAVY);
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 10; i++)
            candidates.add(post("ana-" + i, "ana", "dev", Duration.ofMinutes(i)));
        for (int i = 0; i < 30; i++)
            candidates.add(post("other-" + i, "author-" + i, "dev", Duration.ofMinutes(i)));

        var page = selector.rank(candidates, viewer, config);

        Map<String, Integer> topCounts = new HashMap<>();
        Map<String, Integer> totalCounts = new HashMap<>();
        for (int i = 0; i < page.size(); i++) {
            String author = page.get(i).candidate().authorId();
            totalCounts.merge(author, 1, Integer::sum);
            if (i < 20)
                topCounts.merge(author, 1, Integer::sum);
        }
        assertTrue(topCounts.values().stream().allMatch(c -> c <= 3));
        assertTrue(totalCounts.values().stream().allMatch(c -> c <= 5));
        assertEquals(33, page.size());
    }

    @Test
    void rank_shouldRespectLimit() {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 10; i++)
            candidates.add(post("c" + i, "author-" + i, "dev", Duration.ofMinutes(i)));

        assertEquals(3, selector.rank(candidates, viewer, config, 3).size());
    }

    @Test
    void rank_shouldBeIdempotent() {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 25; i++)
            candidates.add(post("c" + i, i % 3 == 0 ? "ana" : "author-" + i, i % 2 == 0 ? "dev" : "music",
                    Duration.ofHours(i)).withCommentCount(i * 2));

        var first = selector.rank(candidates, viewer, config);
        var second = selector.rank(candidates, viewer, config);

        assertEquals(first, second);
    }

    @Test
    void rank_shouldNotDependOnCandidateOrder() {
        // 15.0, about 16.0 and about 17.9: neighbours tie, the outer pair does not
        var newest = post("newest", "bob", "dev", Duration.ZERO);
        var middle = post("middle", "carl", "dev", Duration.ofHours(1)).withCommentCount(1);
        var oldest = post("oldest", "dora", "dev", Duration.ofHours(2)).withCommentCount(5);

        List<List<Candidate>> orderings = List.of(
                List.of(newest, middle, oldest), List.of(newest, oldest, middle),
                List.of(middle, newest, oldest), List.of(middle, oldest, newest),
                List.of(oldest, newest, middle), List.of(oldest, middle, newest));

        Set<List<String>> pages = new HashSet<>();
        for (List<Candidate> candidates : orderings)
            pages.add(ids(selector.rank(candidates, viewer, config)));

        assertEquals(1, pages.size());
        assertEquals(3, pages.iterator().next().size());
    }

    @Test
    void rank_shouldExpandWindowWhenEnabled() {
        var old = post("old", "bob", "dev", Duration.ofDays(9));

        assertTrue(selector.rank(List.of(old), viewer, config).isEmpty());

        rankingConfig.setExpandTimeWindow(true);
        var expanding = newSelector(rankingConfig);
        assertEquals(List.of("old"), ids(expanding.rank(List.of(old), viewer, config)));
    }

    @Test
    void windowSequence_shouldWidenUpToMaximumWithoutRepeats() {
        assertEquals(List.of(7, 10, 14, 21, 28, 30), RankedSelector.windowSequence(7, 30));
        assertEquals(List.of(30), RankedSelector.windowSequence(30, 30));
        assertEquals(List.of(1, 4, 8, 15, 22, 29, 30), RankedSelector.windowSequence(0, 30));
    }
}
