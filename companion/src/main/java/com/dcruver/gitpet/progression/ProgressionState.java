package com.dcruver.gitpet.progression;

import lombok.Value;

import java.time.Instant;

/**
 * The progression-relevant slice of the pet. Level is always derived.
 */
@Value
public class ProgressionState {
    long experience;
    int vitality;
    Instant lastVisit;

    public int getLevel() {
        return LevelCalculator.level(experience);
    }

    public Mood mood(long idleSeconds) {
        return MoodCalculator.calculate(vitality, idleSeconds);
    }
}
