package com.dcruver.gitpet.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result of one repository scan.
 * Either a complete scan or the {@link #notARepository()} sentinel; never partial.
 */
@Value
@Builder
public class RepositoryHealth {
    boolean gitRepo;

    // Display order; irrelevant for scoring
    List<HealthCheck> checks;

    // Weighted mean of check scores, 0-100
    int totalScore;

    long commitCount;

    Instant lastCommitAt;

    int streak;

    private static final RepositoryHealth NOT_A_REPOSITORY = RepositoryHealth.builder()
        .gitRepo(false)
        .checks(List.of())
        .totalScore(0)
        .commitCount(0)
        .lastCommitAt(null)
        .streak(0)
        .build();

    /**
     * Canonical result for a directory outside any git work tree
     */
    public static RepositoryHealth notARepository() {
        return NOT_A_REPOSITORY;
    }

    public Optional<Instant> getLastCommit() {
        return Optional.ofNullable(lastCommitAt);
    }

    public Optional<HealthCheck> findCheck(String name) {
        return checks.stream()
            .filter(check -> check.getName().equals(name))
            .findFirst();
    }

    /**
     * True when the working-tree check saw no changed paths
     */
    public boolean isWorkingTreeClean() {
        return findCheck(HealthCheck.WORKING_TREE)
            .map(check -> !check.isDegraded() && check.getRawValue() == 0)
            .orElse(false);
    }

    public boolean hasTests() {
        return findCheck(HealthCheck.TESTS)
            .map(check -> check.getRawValue() > 0)
            .orElse(false);
    }
}
