package de.bsommerfeld.kurral.feed.service;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.kurral.feed.core.config.FeedConfig;
import de.bsommerfeld.kurral.feed.core.config.GlobalConfig;
import de.bsommerfeld.kurral.feed.core.domain.Candidate;
import de.bsommerfeld.kurral.feed.core.domain.Viewer;
import de.bsommerfeld.kurral.feed.core.event.ApplicationEventBus;
import de.bsommerfeld.kurral.feed.core.event.FeedEvents.FeedConfigChangedEvent;
import de.bsommerfeld.kurral.feed.core.event.FeedEvents.InterestsAdjustedEvent;
import de.bsommerfeld.kurral.feed.instruction.CompiledInstruction;
import de.bsommerfeld.kurral.feed.instruction.InstructionCompiler;
import de.bsommerfeld.kurral.feed.ranking.RankedSelector;
import de.bsommerfeld.kurral.feed.ranking.ScoredCandidate;
import de.bsommerfeld.kurral.feed.store.FeedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for callers: loads viewer, candidates and feed configuration
 * from the {@link FeedStore}, runs the ranking pipeline and compiles viewer
 * instructions into stored configurations.
 *
 * <p>
 * Viewers without a stored configuration get a copy of the onboarding
 * defaults from {@code config.toml}. Interest changes are not written here;
 * they are published as {@link InterestsAdjustedEvent} and persisted by
 * whoever listens.
 */
@Singleton
public class ForYouFeedService {

    private static final Logger LOG = LoggerFactory.getLogger(ForYouFeedService.class);

    private final FeedStore store;
    private final RankedSelector selector;
    private final InstructionCompiler compiler;
    private final ApplicationEventBus eventBus;
    private final GlobalConfig globalConfig;
    private final Clock clock;

    @Inject
    public ForYouFeedService(FeedStore store, RankedSelector selector, InstructionCompiler compiler,
            ApplicationEventBus eventBus, GlobalConfig globalConfig, Clock clock) {
        this.store = store;
        this.selector = selector;
        this.compiler = compiler;
        this.eventBus = eventBus;
        this.globalConfig = globalConfig;
        this.clock = clock;
    }

    public List<ScoredCandidate> forYou(String viewerId) {
        return forYou(viewerId, globalConfig.getRanking().getDefaultLimit());
    }

    /**
     * Ranks the viewer's "For You" page. Unknown viewers get an empty page.
     */
    public List<ScoredCandidate> forYou(String viewerId, int limit) {
        Viewer viewer = store.getViewer(viewerId);
        if (viewer == null) {
            LOG.warn("Requested feed for unknown viewer {}", viewerId);
            return List.of();
        }

        FeedConfig config = feedConfigFor(viewerId);
        Instant since = clock.instant().minus(Duration.ofDays(globalConfig.getRanking().getMaxTimeWindowDays()));
        List<Candidate> candidates = store.getCandidatesSince(since);

        List<ScoredCandidate> page = selector.rank(candidates, viewer, config, limit);
        if (globalConfig.isDebugMode()) {
            for (int i = 0; i < page.size(); i++) {
                ScoredCandidate item = page.get(i);
                LOG.info("#{} {} ({}) {}", i + 1, item.candidate().id(), String.format("%.2f", item.score()),
                        item.explanation());
            }
        }
        return page;
    }

    /**
     * The viewer's stored configuration, or a copy of the onboarding defaults.
     */
    public FeedConfig feedConfigFor(String viewerId) {
        FeedConfig stored = store.getFeedConfig(viewerId);
        return stored != null ? stored : globalConfig.getDefaults().copy();
    }

    /**
     * Compiles an instruction against the viewer's current configuration,
     * stores the result and publishes the resulting events.
     *
     * @throws de.bsommerfeld.kurral.feed.instruction.InvalidInstructionException
     *         if the instruction is empty; nothing is stored then
     */
    public CompiledInstruction tune(String viewerId, String instruction) {
        CompiledInstruction compiled = compiler.compile(instruction, feedConfigFor(viewerId));

        store.saveFeedConfig(viewerId, compiled.newConfig());
        if (compiled.hasChanges())
            eventBus.post(new FeedConfigChangedEvent(viewerId, compiled.newConfig(), compiled.changes()));
        if (compiled.hasInterestChanges())
            eventBus.post(new InterestsAdjustedEvent(viewerId, compiled.interestsToAdd(),
                    compiled.interestsToRemove()));

        LOG.info("Tuned feed for {}: {}", viewerId, compiled.summary());
        return compiled;
    }
}
