package com.dcruver.gitpet.progression;

/**
 * Actions that earn experience, with their base reward.
 */
public enum XpAction {
    SCAN(2),
    FEED_ISSUE(5),
    PLAY(10),
    TRICK(15),
    FAILED_TRICK(5),
    STATS_CHECK(1),
    COMMIT(10),
    SMART_COMMIT(15),
    STREAK_DAY(3),
    CLEAN_TREE(5),
    HAS_TESTS(15),
    FIRST_VISIT_OF_DAY(10);

    private final int baseReward;

    XpAction(int baseReward) {
        this.baseReward = baseReward;
    }

    public int getBaseReward() {
        return baseReward;
    }

    public int reward() {
        return reward(1);
    }

    /**
     * Base reward times the multiplier (issue count, streak days); a non-positive multiplier earns nothing
     */
    public int reward(int multiplier) {
        if (multiplier <= 0) {
            return 0;
        }
        return baseReward * multiplier;
    }
}
