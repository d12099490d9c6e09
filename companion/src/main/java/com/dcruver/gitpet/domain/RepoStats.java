package com.dcruver.gitpet.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Secondary repository statistics shown on the stats screen.
 * Not part of the health score.
 */
@Value
@Builder
public class RepoStats {
    public static final String UNKNOWN_EXTENSION = "unknown";

    // Whole days since the first commit
    long firstCommitDays;

    long totalCommits;

    // Most common file extension among tracked files, e.g. ".java"
    String topExtension;

    long topExtensionCount;

    // Mean subject length of the recent commits, rounded
    int averageCommitMessageLength;

    public static RepoStats empty() {
        return RepoStats.builder()
            .topExtension(UNKNOWN_EXTENSION)
            .build();
    }
}
