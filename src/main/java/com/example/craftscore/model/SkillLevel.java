package com.example.craftscore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Five-tier skill ladder. Ranges are contiguous, non-overlapping and cover 0-100.
 */
public enum SkillLevel {

    NOVICE(0, 20, "Beginning crafter learning fundamental skills"),
    APPRENTICE(21, 40, "Developing crafter with growing confidence"),
    JOURNEYMAN(41, 60, "Competent crafter with solid technical skills"),
    CRAFTSMAN(61, 80, "Skilled artisan with advanced expertise"),
    MASTER(81, 100, "Master craftsperson with exceptional skill and innovation");

    private final int minScore;
    private final int maxScore;
    private final String description;

    SkillLevel(int minScore, int maxScore, String description) {
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.description = description;
    }

    public int minScore() {
        return minScore;
    }

    public int maxScore() {
        return maxScore;
    }

    public String description() {
        return description;
    }

    public boolean contains(int score) {
        return score >= minScore && score <= maxScore;
    }

    /** The level above this one, empty at {@link #MASTER}. */
    public Optional<SkillLevel> next() {
        int nextOrdinal = ordinal() + 1;
        SkillLevel[] levels = values();
        return nextOrdinal < levels.length ? Optional.of(levels[nextOrdinal]) : Optional.empty();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SkillLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Skill level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown skill level: " + value, e);
        }
    }
}
