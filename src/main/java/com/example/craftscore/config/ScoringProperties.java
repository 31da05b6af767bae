package com.example.craftscore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for the scoring engine.
 */
@ConfigurationProperties(prefix = "craftscore")
public record ScoringProperties(
        @DefaultValue Evaluation evaluation,
        @DefaultValue Oracle oracle,
        @DefaultValue Skill skill
) {

    /**
     * Parallel criterion evaluation.
     *
     * @param timeout Budget for one criterion evaluation before its fallback is used
     */
    public record Evaluation(@DefaultValue("30s") Duration timeout) {}

    /**
     * Oracle client behaviour.
     *
     * @param maxRetries   Retries after the first failed call
     * @param backoff      Delay before the first retry, grows linearly
     * @param modelVersion Label stamped into scoring metadata
     */
    public record Oracle(
            @DefaultValue("2") int maxRetries,
            @DefaultValue("2s") Duration backoff,
            @DefaultValue("gpt-4o") String modelVersion
    ) {}

    /**
     * @param maxUpdateAttempts Read-modify-write attempts for one skill update under write conflicts
     */
    public record Skill(@DefaultValue("3") int maxUpdateAttempts) {}

    public static ScoringProperties defaults() {
        return new ScoringProperties(
                new Evaluation(Duration.ofSeconds(30)),
                new Oracle(2, Duration.ofSeconds(2), "gpt-4o"),
                new Skill(3));
    }
}
