package com.dcruver.gitpet.io;

import com.dcruver.gitpet.progression.LevelCalculator;
import com.dcruver.gitpet.progression.ProgressionState;
import com.dcruver.gitpet.progression.VitalityCalculator;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.time.Instant;

/**
 * Persisted pet document. Stored as JSON in the state file.
 *
 * The level is written out for readers of the file but never read back;
 * it is always recomputed from experience.
 */
@Data
@Builder(toBuilder = true)
@With
@JsonIgnoreProperties(value = {"level"}, allowGetters = true, ignoreUnknown = true)
public class PetState {
    public static final String DEFAULT_NAME = "Doge";
    public static final int DEFAULT_VITALITY = 50;

    private final String name;
    private final long experience;
    private final int vitality;
    private final Instant lastVisit;
    private final Instant createdAt;

    // Lifetime counters
    private final long totalScans;
    private final long totalFeeds;
    private final int longestStreak;
    private final long cleanTreeCount;
    private final long totalPlays;

    @JsonCreator
    public PetState(
            @JsonProperty("name") String name,
            @JsonProperty("experience") @JsonAlias("xp") long experience,
            @JsonProperty("vitality") @JsonAlias("hp") int vitality,
            @JsonProperty("lastVisit") Instant lastVisit,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("totalScans") long totalScans,
            @JsonProperty("totalFeeds") long totalFeeds,
            @JsonProperty("longestStreak") int longestStreak,
            @JsonProperty("cleanTreeCount") long cleanTreeCount,
            @JsonProperty("totalPlays") long totalPlays) {
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
        this.experience = Math.max(0, experience);
        this.vitality = VitalityCalculator.clamp(vitality);
        this.lastVisit = lastVisit;
        this.createdAt = createdAt;
        this.totalScans = Math.max(0, totalScans);
        this.totalFeeds = Math.max(0, totalFeeds);
        this.longestStreak = Math.max(0, longestStreak);
        this.cleanTreeCount = Math.max(0, cleanTreeCount);
        this.totalPlays = Math.max(0, totalPlays);
    }

    /**
     * A freshly hatched pet
     */
    public static PetState newPet(String name, Instant now) {
        return PetState.builder()
            .name(name)
            .experience(0)
            .vitality(DEFAULT_VITALITY)
            .lastVisit(now)
            .createdAt(now)
            .build();
    }

    public int getLevel() {
        return LevelCalculator.level(experience);
    }

    public ProgressionState progression() {
        return new ProgressionState(experience, vitality, lastVisit);
    }
}
