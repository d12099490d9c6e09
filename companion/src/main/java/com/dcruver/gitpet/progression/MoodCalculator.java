package com.dcruver.gitpet.progression;

/**
 * Maps vitality and idle time to a {@link Mood}.
 */
public final class MoodCalculator {

    /**
     * Seconds without interaction after which the pet falls asleep
     */
    public static final long SLEEP_AFTER_SECONDS = 60;

    private MoodCalculator() {
    }

    /**
     * Idle time wins over vitality; otherwise thresholds 90/70/50/25 pick the mood.
     */
    public static Mood calculate(int vitality, long idleSeconds) {
        if (idleSeconds >= SLEEP_AFTER_SECONDS) {
            return Mood.SLEEPING;
        }
        if (vitality >= 90) {
            return Mood.EXCITED;
        }
        if (vitality >= 70) {
            return Mood.HAPPY;
        }
        if (vitality >= 50) {
            return Mood.NEUTRAL;
        }
        if (vitality >= 25) {
            return Mood.SAD;
        }
        return Mood.SICK;
    }
}
