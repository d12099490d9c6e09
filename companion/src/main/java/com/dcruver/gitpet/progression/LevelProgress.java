package com.dcruver.gitpet.progression;

import lombok.Value;

/**
 * Position of an experience total inside its level band.
 */
@Value
public class LevelProgress {
    int level;

    // Experience earned since the level's threshold
    long current;

    // Experience between this level's threshold and the next; at max level equals current
    long span;

    int percentage;

    public boolean isMaxLevel() {
        return level == LevelCalculator.MAX_LEVEL;
    }
}
