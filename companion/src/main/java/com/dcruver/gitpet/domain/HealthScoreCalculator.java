package com.dcruver.gitpet.domain;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns raw repository metrics into weighted health checks.
 * Weights must sum to 100; a configuration that doesn't is replaced by the defaults.
 */
@Component
@ConfigurationProperties(prefix = "gitpet.health.weights")
@Data
@Slf4j
public class HealthScoreCalculator {
    static final int DEFAULT_COMMIT_FREQUENCY = 30;
    static final int DEFAULT_STREAK = 15;
    static final int DEFAULT_WORKING_TREE = 20;
    static final int DEFAULT_TESTS = 15;
    static final int DEFAULT_README = 5;
    static final int DEFAULT_RECENT_ACTIVITY = 15;

    private int commitFrequency = DEFAULT_COMMIT_FREQUENCY;
    private int streak = DEFAULT_STREAK;
    private int workingTree = DEFAULT_WORKING_TREE;
    private int tests = DEFAULT_TESTS;
    private int readme = DEFAULT_README;
    private int recentActivity = DEFAULT_RECENT_ACTIVITY;

    /**
     * Fall back to the default weights when the configured ones don't sum to 100
     */
    @PostConstruct
    public void validateWeights() {
        int total = commitFrequency + streak + workingTree + tests + readme + recentActivity;
        boolean negative = commitFrequency < 0 || streak < 0 || workingTree < 0
            || tests < 0 || readme < 0 || recentActivity < 0;

        if (total != 100 || negative) {
            log.warn("Health weights sum to {} (must be 100 with no negatives), using defaults", total);
            commitFrequency = DEFAULT_COMMIT_FREQUENCY;
            streak = DEFAULT_STREAK;
            workingTree = DEFAULT_WORKING_TREE;
            tests = DEFAULT_TESTS;
            readme = DEFAULT_README;
            recentActivity = DEFAULT_RECENT_ACTIVITY;
        }
    }

    /**
     * Commits (30): 10+ great, 5-9 ok, 1-4 warning, none bad
     */
    public HealthCheck weeklyCommits(int count) {
        HealthStatus status;
        int score;
        if (count >= 10) {
            status = HealthStatus.GREAT;
            score = 100;
        } else if (count >= 5) {
            status = HealthStatus.OK;
            score = 75;
        } else if (count >= 1) {
            status = HealthStatus.WARNING;
            score = 40;
        } else {
            status = HealthStatus.BAD;
            score = 0;
        }
        return check(HealthCheck.COMMITS_THIS_WEEK, status, count + " commits", count, commitFrequency, score);
    }

    /**
     * Streak (15): a week or more great, 3-6 days ok, 1-2 warning
     */
    public HealthCheck commitStreak(int days) {
        HealthStatus status;
        int score;
        if (days >= 7) {
            status = HealthStatus.GREAT;
            score = 100;
        } else if (days >= 3) {
            status = HealthStatus.OK;
            score = 70;
        } else if (days >= 1) {
            status = HealthStatus.WARNING;
            score = 40;
        } else {
            status = HealthStatus.BAD;
            score = 0;
        }
        return check(HealthCheck.COMMIT_STREAK, status, days + " days", days, streak, score);
    }

    /**
     * Working tree (20): clean great, under 5 changes ok, under 10 warning
     */
    public HealthCheck workingTree(int changedFiles) {
        HealthStatus status;
        int score;
        if (changedFiles <= 0) {
            status = HealthStatus.GREAT;
            score = 100;
        } else if (changedFiles < 5) {
            status = HealthStatus.OK;
            score = 60;
        } else if (changedFiles < 10) {
            status = HealthStatus.WARNING;
            score = 30;
        } else {
            status = HealthStatus.BAD;
            score = 0;
        }
        String value = changedFiles <= 0 ? "clean" : changedFiles + " changed files";
        return check(HealthCheck.WORKING_TREE, status, value, Math.max(0, changedFiles), workingTree, score);
    }

    /**
     * Tests (15): missing tests cost points but don't zero the metric
     */
    public HealthCheck testFiles(int count) {
        if (count > 0) {
            return check(HealthCheck.TESTS, HealthStatus.GREAT, count + " test files", count, tests, 100);
        }
        return check(HealthCheck.TESTS, HealthStatus.WARNING, "no tests found", 0, tests, 20);
    }

    /**
     * README (5)
     */
    public HealthCheck readme(boolean present) {
        if (present) {
            return check(HealthCheck.README, HealthStatus.GREAT, "present", 1, readme, 100);
        }
        return check(HealthCheck.README, HealthStatus.WARNING, "missing", 0, readme, 30);
    }

    /**
     * Recent activity (15): hours since the last commit; no commits at all scores 0
     */
    public HealthCheck recentActivity(Instant lastCommit, Instant now) {
        if (lastCommit == null) {
            return check(HealthCheck.LAST_ACTIVITY, HealthStatus.BAD, "no commits", -1, recentActivity, 0);
        }

        Duration since = Duration.between(lastCommit, now);
        if (since.isNegative()) {
            since = Duration.ZERO;
        }
        double hours = since.toMillis() / 3_600_000.0;
        long days = since.toDays();

        if (hours < 24) {
            return check(HealthCheck.LAST_ACTIVITY, HealthStatus.GREAT, "today", since.toHours(), recentActivity, 100);
        } else if (hours < 72) {
            return check(HealthCheck.LAST_ACTIVITY, HealthStatus.OK, days + " days ago", since.toHours(), recentActivity, 70);
        } else if (hours < 168) {
            return check(HealthCheck.LAST_ACTIVITY, HealthStatus.WARNING, days + " days ago", since.toHours(), recentActivity, 40);
        }
        return check(HealthCheck.LAST_ACTIVITY, HealthStatus.BAD, days + " days ago", since.toHours(), recentActivity, 10);
    }

    /**
     * Weight-normalized weighted mean of the check scores, rounded, 0-100
     */
    public int totalScore(List<HealthCheck> checks) {
        int totalWeight = 0;
        long weighted = 0;
        for (HealthCheck check : checks) {
            if (check.getWeight() <= 0) {
                continue;
            }
            totalWeight += check.getWeight();
            weighted += (long) clampScore(check.getScore()) * check.getWeight();
        }

        if (totalWeight == 0) {
            return 0;
        }
        return clampScore((int) Math.round((double) weighted / totalWeight));
    }

    private static HealthCheck check(String name, HealthStatus status, String value, long rawValue,
                                     int weight, int score) {
        return HealthCheck.builder()
            .name(name)
            .status(status)
            .value(value)
            .rawValue(rawValue)
            .weight(weight)
            .score(score)
            .build();
    }

    private static int clampScore(int score) {
        return Math.min(100, Math.max(0, score));
    }
}
