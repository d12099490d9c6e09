package com.dcruver.gitpet.progression;

import java.util.List;

/**
 * Experience to level ladder: five plateaus starting at 0, 100, 300, 600 and 1000 XP.
 */
public final class LevelCalculator {

    public static final int MAX_LEVEL = 5;

    private static final long[] THRESHOLDS = {0, 100, 300, 600, 1000};

    private static final List<String> TITLES = List.of(
        "Puppy", "Young Dog", "Adult Dog", "Cool Dog", "Legendary Doge");

    private static final List<String> DESCRIPTIONS = List.of(
        "Just learning to fetch commits",
        "Knows a few tricks",
        "A loyal repository companion",
        "Ships clean code in style",
        "Much commit. Very health. Wow.");

    private LevelCalculator() {
    }

    /**
     * Level 1-5 for an experience total; negative experience counts as 0
     */
    public static int level(long experience) {
        int level = 1;
        for (int i = 1; i < THRESHOLDS.length; i++) {
            if (experience >= THRESHOLDS[i]) {
                level = i + 1;
            }
        }
        return level;
    }

    public static boolean didLevelUp(long oldExperience, long newExperience) {
        return level(newExperience) > level(oldExperience);
    }

    /**
     * Experience required to reach a level (1-5)
     */
    public static long threshold(int level) {
        int index = Math.min(MAX_LEVEL, Math.max(1, level)) - 1;
        return THRESHOLDS[index];
    }

    public static LevelProgress progress(long experience) {
        long xp = Math.max(0, experience);
        int level = level(xp);
        long floor = threshold(level);
        long current = xp - floor;

        if (level == MAX_LEVEL) {
            return new LevelProgress(level, current, current, 100);
        }

        long span = threshold(level + 1) - floor;
        int percentage = (int) Math.min(100, current * 100 / span);
        return new LevelProgress(level, current, span, percentage);
    }

    public static String title(int level) {
        return TITLES.get(Math.min(MAX_LEVEL, Math.max(1, level)) - 1);
    }

    public static String description(int level) {
        return DESCRIPTIONS.get(Math.min(MAX_LEVEL, Math.max(1, level)) - 1);
    }
}
