package de.bsommerfeld.kurral.feed.store;

import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link FeedStore} backed by concurrent maps. Nothing survives a restart.
 * Feed configurations are copied on the way in and out so callers can never
 * change stored state by accident.
 */
@Singleton
public class InMemoryFeedStore implements FeedStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryFeedStore.class);

    private final Map<String, Viewer> viewers = new ConcurrentHashMap<>();
    private final Map<String, Candidate> candidates = new ConcurrentHashMap<>();
    private final Map<String, FeedConfig> configs = new ConcurrentHashMap<>();

    @Override
    public Viewer getViewer(String viewerId) {
        return viewerId == null ? null : viewers.get(viewerId);
    }

    @Override
    public void saveViewer(Viewer viewer) {
        viewers.put(viewer.id(), viewer);
    }

    @Override
    public void saveCandidate(Candidate candidate) {
        candidates.put(candidate.id(), candidate);
    }

    @Override
    public List<Candidate> getCandidatesSince(Instant since) {
        return candidates.values().stream()
                .filter(c -> !c.createdAt().isBefore(since))
                .sorted(Comparator.comparing(Candidate::createdAt).reversed()
                        .thenComparing(Candidate::id))
                .collect(Collectors.toList());
    }

    @Override
    public FeedConfig getFeedConfig(String viewerId) {
        FeedConfig stored = viewerId == null ? null : configs.get(viewerId);
        return stored == null ? null : stored.copy();
    }

    @Override
    public void saveFeedConfig(String viewerId, FeedConfig config) {
        configs.put(viewerId, config.copy());
        LOG.debug("Stored feed config for {}: {}", viewerId, config);
    }

    @Override
    public boolean applyInterestAdjustment(String viewerId, List<String> add, List<String> remove) {
        if (viewerId == null)
            return false;
        Viewer updated = viewers.computeIfPresent(viewerId, (id, viewer) -> {
            Set<String> interests = new LinkedHashSet<>(viewer.interests());
            add.forEach(interest -> interests.add(interest.toLowerCase(Locale.ROOT)));
            remove.forEach(interest -> interests.removeIf(existing -> existing.equalsIgnoreCase(interest)));
            return viewer.withInterests(interests);
        });
        if (updated == null) {
            LOG.warn("Interest adjustment for unknown viewer {} dropped", viewerId);
            return false;
        }
        LOG.debug("Viewer {} interests now {}", viewerId, updated.interests());
        return true;
    }
}
