package com.dcruver.gitpet.domain;

import com.dcruver.gitpet.config.ProbeProperties;
import com.dcruver.gitpet.io.GitProbe;
import com.dcruver.gitpet.io.GitProbeRunner;
import com.dcruver.gitpet.io.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Narrow git questions, each answered by one bounded probe.
 *
 * Collectors never throw: "not a repository", "no commits yet", timeouts and
 * unexpected output all come back as {@link ProbeResult} failures and the caller
 * picks the worst-case fallback for its metric.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GitMetricsCollector {

    static final List<String> README_NAMES = List.of(
        "README.md", "README.txt", "README", "readme.md", "Readme.md", "README.adoc");

    private final GitProbeRunner probeRunner;
    private final ProbeProperties probeProperties;
    private final Clock clock;

    /**
     * Whether the working directory is inside a git work tree
     */
    public ProbeResult<Boolean> isInsideWorkTree() {
        return run(light("is-inside-work-tree", "rev-parse", "--is-inside-work-tree"))
            .map(out -> "true".equals(out.trim()));
    }

    /**
     * Commits in the trailing 7 calendar days (today and the six days before it)
     */
    public ProbeResult<Integer> weeklyCommitCount() {
        ZoneId zone = clock.getZone();
        ZonedDateTime windowStart = LocalDate.now(clock).minusDays(6).atStartOfDay(zone);
        long windowStartEpoch = windowStart.toEpochSecond();

        // git reads a bare number of more than eight digits as epoch seconds
        return run(history("weekly-commits", "log", "--since=" + windowStartEpoch, "--format=%ct"))
            .map(out -> (int) GitOutput.epochSeconds(out).stream()
                .filter(epoch -> epoch >= windowStartEpoch)
                .count());
    }

    /**
     * Distinct local dates of the most recent commits, newest first
     */
    public ProbeResult<List<LocalDate>> recentCommitDates() {
        ZoneId zone = clock.getZone();
        return run(history("recent-commit-dates",
                "log", "-" + probeProperties.getStreakLookback(), "--format=%ct"))
            .map(out -> GitOutput.epochSeconds(out).stream()
                .map(epoch -> Instant.ofEpochSecond(epoch).atZone(zone).toLocalDate())
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList());
    }

    /**
     * Modified, staged and untracked paths in the working tree
     */
    public ProbeResult<Integer> workingTreeChangeCount() {
        return run(light("working-tree", "status", "--porcelain"))
            .map(out -> GitOutput.lines(out).size());
    }

    /**
     * Tracked files that follow a test naming convention
     */
    public ProbeResult<Integer> testFileCount() {
        return trackedFiles()
            .map(files -> (int) files.stream()
                .filter(TestFileConventions::isTestFile)
                .count());
    }

    /**
     * Whether a README sits in the working directory
     */
    public ProbeResult<Boolean> hasReadme() {
        boolean found = README_NAMES.stream()
            .map(name -> probeRunner.getWorkingDirectory().resolve(name))
            .anyMatch(Files::isRegularFile);
        return ProbeResult.success(found);
    }

    /**
     * Committer time of HEAD; fails on a repository without commits
     */
    public ProbeResult<Instant> lastCommitTime() {
        return run(light("last-commit", "log", "-1", "--format=%ct"))
            .map(out -> Instant.ofEpochSecond(Long.parseLong(out.trim())));
    }

    public ProbeResult<Long> totalCommitCount() {
        return run(light("total-commits", "rev-list", "--count", "HEAD"))
            .map(out -> Long.parseLong(out.trim()));
    }

    /**
     * Committer time of the oldest root commit reachable from HEAD
     */
    public ProbeResult<Instant> firstCommitTime() {
        return run(history("first-commit", "log", "--max-parents=0", "--format=%ct", "HEAD"))
            .map(out -> GitOutput.epochSeconds(out).stream()
                .min(Long::compare)
                .map(Instant::ofEpochSecond)
                .orElse(null));
    }

    public ProbeResult<List<String>> trackedFiles() {
        return run(history("tracked-files", "ls-files"))
            .map(GitOutput::lines);
    }

    /**
     * Subject lines of the most recent commits
     */
    public ProbeResult<List<String>> recentCommitSubjects() {
        return run(history("commit-subjects",
                "log", "-" + probeProperties.getMessageSampleSize(), "--format=%s"))
            .map(GitOutput::lines);
    }

    /**
     * "file:line:content" matches of an extended regex in tracked files.
     * No match is a non-zero exit for git grep, so callers fall back to an empty list.
     */
    public ProbeResult<List<String>> grep(String name, String extendedRegex, List<String> pathspecs) {
        List<String> arguments = new ArrayList<>(List.of("grep", "-n", "-I", "-E", extendedRegex, "--"));
        arguments.addAll(pathspecs);

        GitProbe probe = GitProbe.builder()
            .name(name)
            .arguments(arguments)
            .timeout(probeProperties.getGrepTimeout())
            .maxOutputBytes(probeProperties.getMaxOutputBytes())
            .build();

        int limit = probeProperties.getGrepMatchLimit();
        return run(probe)
            .map(out -> GitOutput.lines(out).stream()
                .limit(limit)
                .toList());
    }

    private ProbeResult<String> run(GitProbe probe) {
        ProbeResult<String> result = probeRunner.run(probe);
        if (result.isFailure()) {
            log.debug("Probe {} degraded: {}", probe.getName(), result.describeFailure());
        }
        return result;
    }

    private GitProbe light(String name, String... arguments) {
        return GitProbe.of(name, probeProperties.getLightTimeout(), probeProperties.getMaxOutputBytes(), arguments);
    }

    private GitProbe history(String name, String... arguments) {
        return GitProbe.of(name, probeProperties.getLogTimeout(), probeProperties.getMaxOutputBytes(), arguments);
    }

    /**
     * Tolerant parsing helpers for git output.
     */
    static final class GitOutput {

        private GitOutput() {
        }

        static List<String> lines(String output) {
            if (output == null || output.isBlank()) {
                return List.of();
            }
            return output.lines()
                .filter(line -> !line.isBlank())
                .toList();
        }

        /**
         * Parse one epoch-seconds value per line, skipping lines that are not numbers
         */
        static List<Long> epochSeconds(String output) {
            return lines(output).stream()
                .map(line -> parseLong(line.trim()))
                .flatMap(Optional::stream)
                .toList();
        }

        static Optional<Long> parseLong(String text) {
            try {
                return Optional.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    }
}
