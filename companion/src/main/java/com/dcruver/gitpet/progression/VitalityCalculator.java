package com.dcruver.gitpet.progression;

import com.dcruver.gitpet.domain.RepositoryHealth;

import java.time.Duration;
import java.time.Instant;

/**
 * Vitality (HP) derivation and the decay applied after time away.
 */
public final class VitalityCalculator {

    public static final int MAX_VITALITY = 100;

    // Decay never pushes vitality below this
    public static final int DECAY_FLOOR = 10;

    static final long GRACE_HOURS = 24;
    static final int DECAY_PER_DAY = 5;
    static final int MAX_DECAY = 30;

    private VitalityCalculator() {
    }

    public static int vitality(RepositoryHealth health) {
        return clamp(health.getTotalScore());
    }

    /**
     * Decay points owed for the time between the last visit and now.
     * Nothing is owed inside the 24 hour grace period, for a missing visit or for a clock that went backwards.
     */
    public static int decay(Instant lastVisit, Instant now) {
        if (lastVisit == null || now == null) {
            return 0;
        }
        Duration away = Duration.between(lastVisit, now);
        if (away.isNegative()) {
            return 0;
        }

        long hours = away.toHours();
        if (hours < GRACE_HOURS) {
            return 0;
        }
        long days = (hours - GRACE_HOURS) / 24;
        return (int) Math.min(MAX_DECAY, days * DECAY_PER_DAY);
    }

    /**
     * Subtract decay; whenever decay applies the result is floored at {@value #DECAY_FLOOR}
     */
    public static int applyDecay(int vitality, int decay) {
        if (decay <= 0) {
            return clamp(vitality);
        }
        return clamp(Math.max(DECAY_FLOOR, vitality - decay));
    }

    public static int clamp(int vitality) {
        return Math.min(MAX_VITALITY, Math.max(0, vitality));
    }
}
