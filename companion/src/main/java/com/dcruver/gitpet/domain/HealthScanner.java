package com.dcruver.gitpet.domain;

import com.dcruver.gitpet.io.ProbeFailure;
import com.dcruver.gitpet.io.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans the working copy and builds a {@link RepositoryHealth} snapshot.
 *
 * The six collectors run concurrently and are joined before scoring; a slow or
 * failing probe only degrades its own check.
 */
@Component
@Slf4j
public class HealthScanner {

    static final int MAX_CODE_ISSUES = 8;

    private static final List<String> SOURCE_PATHSPECS = List.of(
        "*.java", "*.kt", "*.ts", "*.js", "*.tsx", "*.jsx", "*.py", "*.rb", "*.go");

    private static final String TODO_PATTERN = "TODO|FIXME";
    private static final String DEBUG_OUTPUT_PATTERN = "console\\.log|System\\.(out|err)\\.print|printStackTrace\\(";

    private static final Pattern GREP_LINE = Pattern.compile("^([^:]+):(\\d+):(.*)$");

    private final GitMetricsCollector collector;
    private final HealthScoreCalculator scoreCalculator;
    private final ExecutorService scanExecutor;
    private final Clock clock;

    public HealthScanner(GitMetricsCollector collector,
                         HealthScoreCalculator scoreCalculator,
                         @Qualifier("scanExecutor") ExecutorService scanExecutor,
                         Clock clock) {
        this.collector = collector;
        this.scoreCalculator = scoreCalculator;
        this.scanExecutor = scanExecutor;
        this.clock = clock;
    }

    /**
     * Scan the working copy. Outside a git work tree no collector is invoked.
     */
    public RepositoryHealth scan() {
        if (!collector.isInsideWorkTree().orElse(false)) {
            log.info("Not inside a git work tree, skipping scan");
            return RepositoryHealth.notARepository();
        }

        long started = System.nanoTime();
        log.info("Scanning repository health...");

        CompletableFuture<ProbeResult<Integer>> weekly = submit("weekly-commits", collector::weeklyCommitCount);
        CompletableFuture<ProbeResult<List<LocalDate>>> dates = submit("streak", collector::recentCommitDates);
        CompletableFuture<ProbeResult<Integer>> changes = submit("working-tree", collector::workingTreeChangeCount);
        CompletableFuture<ProbeResult<Integer>> tests = submit("tests", collector::testFileCount);
        CompletableFuture<ProbeResult<Boolean>> readme = submit("readme", collector::hasReadme);
        CompletableFuture<ProbeResult<Instant>> lastCommit = submit("last-commit", collector::lastCommitTime);
        CompletableFuture<ProbeResult<Long>> total = submit("total-commits", collector::totalCommitCount);

        // Join point: scoring waits for every collector
        CompletableFuture.allOf(weekly, dates, changes, tests, readme, lastCommit, total).join();

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);

        ProbeResult<Integer> weeklyResult = weekly.join();
        ProbeResult<List<LocalDate>> datesResult = dates.join();
        ProbeResult<Integer> changesResult = changes.join();
        ProbeResult<Integer> testsResult = tests.join();
        ProbeResult<Boolean> readmeResult = readme.join();
        ProbeResult<Instant> lastCommitResult = lastCommit.join();

        int streak = StreakCalculator.calculate(datesResult.orElse(List.of()), today);
        Instant lastCommitAt = lastCommitResult.orElse(null);

        List<HealthCheck> checks = new ArrayList<>();
        checks.add(degradeIfFailed(scoreCalculator.weeklyCommits(weeklyResult.orElse(0)), weeklyResult));
        checks.add(degradeIfFailed(scoreCalculator.commitStreak(streak), datesResult));
        checks.add(workingTreeCheck(changesResult));
        checks.add(degradeIfFailed(scoreCalculator.testFiles(testsResult.orElse(0)), testsResult));
        checks.add(degradeIfFailed(scoreCalculator.readme(readmeResult.orElse(false)), readmeResult));
        checks.add(lastActivityCheck(lastCommitResult, now));

        int totalScore = scoreCalculator.totalScore(checks);

        RepositoryHealth health = RepositoryHealth.builder()
            .gitRepo(true)
            .checks(List.copyOf(checks))
            .totalScore(totalScore)
            .commitCount(Math.max(0, total.join().orElse(0L)))
            .lastCommitAt(lastCommitAt)
            .streak(streak)
            .build();

        log.info("Scan completed in {}ms: score {} / 100, streak {} days",
            Duration.ofNanos(System.nanoTime() - started).toMillis(), totalScore, streak);
        return health;
    }

    /**
     * Secondary statistics; any probe that fails leaves its field at the default
     */
    public RepoStats collectStats() {
        if (!collector.isInsideWorkTree().orElse(false)) {
            return RepoStats.empty();
        }

        Instant now = clock.instant();
        long firstCommitDays = collector.firstCommitTime()
            .map(first -> Math.max(0, Duration.between(first, now).toDays()))
            .orElse(0L);
        long totalCommits = collector.totalCommitCount().orElse(0L);

        Map<String, Long> extensions = extensionHistogram(collector.trackedFiles().orElse(List.of()));
        Map.Entry<String, Long> top = extensions.entrySet().stream()
            // Ties go to the alphabetically first extension
            .max(Comparator.comparingLong((Map.Entry<String, Long> entry) -> entry.getValue())
                .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
            .orElse(null);

        List<String> subjects = collector.recentCommitSubjects().orElse(List.of());
        int averageLength = 0;
        if (!subjects.isEmpty()) {
            long totalLength = subjects.stream().mapToLong(String::length).sum();
            averageLength = (int) Math.round((double) totalLength / subjects.size());
        }

        return RepoStats.builder()
            .firstCommitDays(firstCommitDays)
            .totalCommits(totalCommits)
            .topExtension(top != null ? top.getKey() : RepoStats.UNKNOWN_EXTENSION)
            .topExtensionCount(top != null ? top.getValue() : 0)
            .averageCommitMessageLength(averageLength)
            .build();
    }

    /**
     * TODO/FIXME markers and leftover debug output, at most {@value #MAX_CODE_ISSUES}
     */
    public List<CodeIssue> findCodeIssues() {
        if (!collector.isInsideWorkTree().orElse(false)) {
            return List.of();
        }

        List<CodeIssue> issues = new ArrayList<>();
        for (String line : collector.grep("todo-markers", TODO_PATTERN, SOURCE_PATHSPECS).orElse(List.of())) {
            parseGrepLine(line, false).ifPresent(issues::add);
        }
        for (String line : collector.grep("debug-output", DEBUG_OUTPUT_PATTERN, SOURCE_PATHSPECS).orElse(List.of())) {
            parseGrepLine(line, true).ifPresent(issues::add);
        }

        log.info("Found {} code issues", issues.size());
        return issues.size() > MAX_CODE_ISSUES ? List.copyOf(issues.subList(0, MAX_CODE_ISSUES)) : List.copyOf(issues);
    }

    static Map<String, Long> extensionHistogram(List<String> files) {
        Map<String, Long> counts = new TreeMap<>();
        for (String file : files) {
            String fileName = file.substring(file.lastIndexOf('/') + 1);
            int dot = fileName.lastIndexOf('.');
            // ".gitignore" has no extension
            if (dot > 0 && dot < fileName.length() - 1) {
                counts.merge(fileName.substring(dot), 1L, Long::sum);
            }
        }
        return counts;
    }

    static Optional<CodeIssue> parseGrepLine(String line, boolean debugOutput) {
        Matcher matcher = GREP_LINE.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        int lineNumber;
        try {
            lineNumber = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            lineNumber = 0;
        }

        String content = matcher.group(3).trim();
        CodeIssue.Type type;
        if (debugOutput) {
            type = CodeIssue.Type.DEBUG_OUTPUT;
        } else {
            type = content.toUpperCase().contains("FIXME") ? CodeIssue.Type.FIXME : CodeIssue.Type.TODO;
        }

        if (content.length() > CodeIssue.MAX_CONTENT_LENGTH) {
            content = content.substring(0, CodeIssue.MAX_CONTENT_LENGTH);
        }
        return Optional.of(new CodeIssue(type, matcher.group(1), lineNumber, content));
    }

    private <T> CompletableFuture<ProbeResult<T>> submit(String metric, Supplier<ProbeResult<T>> task) {
        try {
            return CompletableFuture.supplyAsync(task, scanExecutor)
                .exceptionally(e -> {
                    log.warn("Collector {} failed unexpectedly", metric, e);
                    return ProbeResult.failure(ProbeFailure.EXECUTION_FAILED, String.valueOf(e.getMessage()));
                });
        } catch (RejectedExecutionException e) {
            log.warn("Collector {} rejected by scan executor: {}", metric, e.getMessage());
            return CompletableFuture.completedFuture(
                ProbeResult.failure(ProbeFailure.EXECUTION_FAILED, "scan executor unavailable"));
        }
    }

    // An unreadable status counts as the worst case, never as clean
    private HealthCheck workingTreeCheck(ProbeResult<Integer> changes) {
        if (changes.isSuccess()) {
            return scoreCalculator.workingTree(changes.orElse(0));
        }
        return scoreCalculator.workingTree(Integer.MAX_VALUE)
            .withValue("unknown")
            .withRawValue(-1)
            .withDetails(changes.describeFailure());
    }

    // A failing `git log -1` on an unborn branch is the honest "no commits" answer
    private HealthCheck lastActivityCheck(ProbeResult<Instant> lastCommit, Instant now) {
        HealthCheck check = scoreCalculator.recentActivity(lastCommit.orElse(null), now);
        if (lastCommit.getFailure() == ProbeFailure.NON_ZERO_EXIT) {
            return check;
        }
        return degradeIfFailed(check, lastCommit);
    }

    private static HealthCheck degradeIfFailed(HealthCheck check, ProbeResult<?> result) {
        if (result.isSuccess()) {
            return check;
        }
        return check.withDetails(result.describeFailure());
    }
}
