package com.dcruver.gitpet.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One evaluated, weighted repository metric.
 * Created fresh on every scan and never mutated.
 */
@Value
@Builder
@With
public class HealthCheck {
    public static final String COMMITS_THIS_WEEK = "Commits this week";
    public static final String COMMIT_STREAK = "Commit streak";
    public static final String WORKING_TREE = "Working tree";
    public static final String TESTS = "Tests";
    public static final String README = "README";
    public static final String LAST_ACTIVITY = "Last activity";

    String name;
    HealthStatus status;

    // Display string, e.g. "12 commits"
    String value;

    // The number the display string was built from, so nobody re-parses value
    long rawValue;

    // Percentage weight in the total score
    int weight;

    // 0-100
    int score;

    // Set when the metric fell back to its worst case because a probe failed
    String details;

    public boolean isDegraded() {
        return details != null;
    }
}
