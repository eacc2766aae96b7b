package de.bsommerfeld.kurral.feed.store;

import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.FollowingWeight;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFeedStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private InMemoryFeedStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeedStore();
    }

    @Test
    void getViewer_shouldReturnNullForUnknownId() {
        assertNull(store.getViewer("nobody"));
        assertNull(store.getViewer(null));
    }

    @Test
    void saveViewer_shouldBeRetrievable() {
        var viewer = new Viewer("u1", Set.of("u2"), Set.of("rust"));
        store.saveViewer(viewer);

        assertEquals(viewer, store.getViewer("u1"));
    }

    @Test
    void getCandidatesSince_shouldFilterAndSortNewestFirst() {
        store.saveCandidates(List.of(
                new Candidate("old", "a", "dev", NOW.minus(Duration.ofDays(10))),
                new Candidate("mid", "a", "dev", NOW.minus(Duration.ofDays(2))),
                new Candidate("new", "b", "music", NOW.minus(Duration.ofHours(1)))));

        var ids = store.getCandidatesSince(NOW.minus(Duration.ofDays(7))).stream()
                .map(Candidate::id)
                .collect(Collectors.toList());

        assertEquals(List.of("new", "mid"), ids);
    }

    @Test
    void saveCandidate_shouldReplaceExistingId() {
        store.saveCandidate(new Candidate("c1", "a", "dev", NOW));
        store.saveCandidate(new Candidate("c1", "a", "music", NOW));

        var all = store.getCandidatesSince(NOW.minus(Duration.ofDays(1)));
        assertEquals(1, all.size());
        assertEquals("music", all.get(0).topic());
    }

    @Test
    void getFeedConfig_shouldReturnNullWhenNeverStored() {
        assertNull(store.getFeedConfig("u1"));
    }

    @Test
    void saveFeedConfig_shouldStoreIndependentCopy() {
        var config = new FeedConfig();
        config.setFollowingWeight(FollowingWeight.HEAVY);
        store.saveFeedConfig("u1", config);

        config.setFollowingWeight(FollowingWeight.NONE);
        var loaded = store.getFeedConfig("u1");
        loaded.setLikedTopics(List.of("dev"));

        assertEquals(FollowingWeight.HEAVY, store.getFeedConfig("u1").getFollowingWeight());
        assertTrue(store.getFeedConfig("u1").getLikedTopics().isEmpty());
    }

    @Test
    void applyInterestAdjustment_shouldAddThenRemove() {
        store.saveViewer(new Viewer("u1", Set.of(), Set.of("Rust", "cooking")));

        boolean applied = store.applyInterestAdjustment("u1", List.of("react", "ai"), List.of("rust", "ai"));

        assertTrue(applied);
        assertEquals(Set.of("cooking", "react"), store.getViewer("u1").interests());
    }

    @Test
    void applyInterestAdjustment_shouldReportUnknownViewer() {
        assertFalse(store.applyInterestAdjustment("ghost", List.of("react"), List.of()));
        assertNull(store.getViewer("ghost"));
    }
}
