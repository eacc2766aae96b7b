package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml. Every section is always present; missing sections in
 * the file keep their defaults.
 */
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("ranking")
    private RankingConfig ranking = new RankingConfig();

    @JsonProperty("instruction")
    private InstructionConfig instruction = new InstructionConfig();

    @JsonProperty("topics")
    private TopicConfig topics = new TopicConfig();

    // onboarding defaults for viewers without a stored feed config
    @JsonProperty("defaults")
    private FeedConfig defaults = new FeedConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public RankingConfig getRanking() {
        return ranking;
    }

    public InstructionConfig getInstruction() {
        return instruction;
    }

    public TopicConfig getTopics() {
        return topics;
    }

    public FeedConfig getDefaults() {
        return defaults;
    }
}
