package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tuning constants of the ranking pipeline. Values are persisted in
 * config.toml and loaded at startup; setters only exist for tests and the
 * config mapper.
 */
public class RankingConfig {

    // page size when the caller does not ask for one
    @JsonProperty("default-limit")
    private int defaultLimit = 50;

    @JsonProperty("max-time-window-days")
    private int maxTimeWindowDays = 30;

    // minimum cosine similarity for embedding-gated targeted posts
    @JsonProperty("similarity-threshold")
    private double similarityThreshold = 0.7;

    // scores closer than max(tie-threshold, |score| * tie-percentage) count as tied
    @JsonProperty("tie-threshold")
    private double tieThreshold = 2.0;

    @JsonProperty("tie-percentage")
    private double tiePercentage = 0.05;

    @JsonProperty("top-window-size")
    private int topWindowSize = 20;

    @JsonProperty("top-window-author-limit")
    private int topWindowAuthorLimit = 3;

    @JsonProperty("total-author-limit")
    private int totalAuthorLimit = 5;

    // scoring terms smaller than this (absolute) do not produce a reason
    @JsonProperty("reason-threshold")
    private double reasonThreshold = 5.0;

    // retry empty pages over wider time windows before giving up
    @JsonProperty("expand-time-window")
    private boolean expandTimeWindow = false;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxTimeWindowDays() {
        return maxTimeWindowDays;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public double getTieThreshold() {
        return tieThreshold;
    }

    public double getTiePercentage() {
        return tiePercentage;
    }

    public int getTopWindowSize() {
        return topWindowSize;
    }

    public int getTopWindowAuthorLimit() {
        return topWindowAuthorLimit;
    }

    public int getTotalAuthorLimit() {
        return totalAuthorLimit;
    }

    public double getReasonThreshold() {
        return reasonThreshold;
    }

    public boolean isExpandTimeWindow() {
        return expandTimeWindow;
    }

    public void setExpandTimeWindow(boolean expandTimeWindow) {
        this.expandTimeWindow = expandTimeWindow;
    }
}
