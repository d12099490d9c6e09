package com.dcruver.gitpet.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Timeouts and limits for git probes.
 */
@Configuration
@ConfigurationProperties(prefix = "gitpet.probe")
@Data
public class ProbeProperties {
    private String executable = "git";

    // rev-parse, status, single-commit log
    private Duration lightTimeout = Duration.ofSeconds(3);

    // multi-commit log, ls-files
    private Duration logTimeout = Duration.ofSeconds(5);

    // git grep over the work tree
    private Duration grepTimeout = Duration.ofSeconds(10);

    private int maxOutputBytes = 4 * 1024 * 1024;

    private int streakLookback = 100;

    private int messageSampleSize = 50;

    private int grepMatchLimit = 10;
}
