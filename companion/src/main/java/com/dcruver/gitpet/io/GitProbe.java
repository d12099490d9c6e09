package com.dcruver.gitpet.io;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Definition of a single bounded git query: arguments, timeout and output limit.
 */
@Value
@Builder
public class GitProbe {
    /**
     * Short name used in logs, e.g. "weekly-commits"
     */
    String name;

    /**
     * Arguments passed after the git executable
     */
    List<String> arguments;

    Duration timeout;

    int maxOutputBytes;

    public static GitProbe of(String name, Duration timeout, int maxOutputBytes, String... arguments) {
        return GitProbe.builder()
            .name(name)
            .arguments(List.of(arguments))
            .timeout(timeout)
            .maxOutputBytes(maxOutputBytes)
            .build();
    }
}
