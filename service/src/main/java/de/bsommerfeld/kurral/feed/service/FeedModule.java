package de.bsommerfeld.kurral.feed.service;

import com.google.inject.AbstractModule;
import de.bsommerfeld.kurral.feed.core.config.ConfigLoader;
import de.bsommerfeld.kurral.feed.core.config.GlobalConfig;
import de.bsommerfeld.kurral.feed.core.config.InstructionConfig;
import de.bsommerfeld.kurral.feed.core.config.RankingConfig;
import de.bsommerfeld.kurral.feed.core.domain.TopicVocabulary;
import de.bsommerfeld.kurral.feed.store.FeedStore;
import de.bsommerfeld.kurral.feed.store.InMemoryFeedStore;
import de.bsommerfeld.kurral.feed.store.InterestAdjustmentListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Guice module wiring the feed engine.
 *
 * <p>
 * Configuration comes from the TOML file given to the constructor, from the
 * path in the {@value #CONFIG_PROPERTY} system property, or from the bundled
 * {@value #DEFAULT_RESOURCE}, in that order. A missing file is created with
 * defaults; an unreadable one fails injector creation.
 */
public class FeedModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(FeedModule.class);

    public static final String CONFIG_PROPERTY = "kurral.feed.config";
    static final String DEFAULT_RESOURCE = "feed-defaults.toml";

    private final Path configPath;
    private final Clock clock;

    public FeedModule() {
        this(pathFromSystemProperty(), Clock.systemUTC());
    }

    public FeedModule(Path configPath) {
        this(configPath, Clock.systemUTC());
    }

    /**
     * @param configPath TOML file to load, {@code null} for the bundled defaults
     * @param clock      time source of the ranking pipeline
     */
    public FeedModule(Path configPath, Clock clock) {
        this.configPath = configPath;
        this.clock = clock;
    }

    @Override
    protected void configure() {
        GlobalConfig config;
        if (configPath != null) {
            config = ConfigLoader.load(configPath);
        } else {
            LOG.info("No configuration path given, using bundled {}", DEFAULT_RESOURCE);
            config = ConfigLoader.loadResource(DEFAULT_RESOURCE);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(RankingConfig.class).toInstance(config.getRanking());
        bind(InstructionConfig.class).toInstance(config.getInstruction());
        bind(TopicVocabulary.class).toInstance(config.getTopics().toVocabulary());
        bind(Clock.class).toInstance(clock);

        bind(FeedStore.class).to(InMemoryFeedStore.class);
        bind(InterestAdjustmentListener.class).asEagerSingleton();

        if (config.isDebugMode())
            LOG.info("Debug mode enabled, ranked pages will be logged with their reasons");
    }

    private static Path pathFromSystemProperty() {
        String property = System.getProperty(CONFIG_PROPERTY);
        if (property == null || property.isBlank())
            return null;
        return Paths.get(property);
    }
}
