package com.dcruver.gitpet.domain;

import com.dcruver.gitpet.io.ProbeFailure;
import com.dcruver.gitpet.io.ProbeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Scanner orchestration against a mocked collector: short-circuiting, degradation and fan-out.
 */
class HealthScannerTest {

    private static final Instant NOW = Instant.parse("2025-03-12T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 12);

    private GitMetricsCollector collector;
    private ExecutorService executor;
    private HealthScanner scanner;

    @BeforeEach
    void setUp() {
        collector = mock(GitMetricsCollector.class);
        executor = Executors.newFixedThreadPool(7);

        HealthScoreCalculator calculator = new HealthScoreCalculator();
        calculator.validateWeights();

        scanner = new HealthScanner(collector, calculator, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testOutsideRepositoryRunsNoCollectors() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(false));

        RepositoryHealth health = scanner.scan();

        assertSame(RepositoryHealth.notARepository(), health);
        assertFalse(health.isGitRepo());
        assertTrue(health.getChecks().isEmpty());
        verify(collector).isInsideWorkTree();
        verifyNoMoreInteractions(collector);
    }

    @Test
    void testFailedDetectionIsTreatedAsNoRepository() {
        when(collector.isInsideWorkTree())
            .thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));

        RepositoryHealth health = scanner.scan();

        assertFalse(health.isGitRepo());
        assertEquals(0, health.getTotalScore());
        verify(collector).isInsideWorkTree();
        verifyNoMoreInteractions(collector);
    }

    @Test
    void testHealthyRepositoryScoresAllChecks() {
        stubHealthyRepository();

        RepositoryHealth health = scanner.scan();

        assertTrue(health.isGitRepo());
        assertEquals(100, health.getTotalScore());
        assertEquals(7, health.getStreak());
        assertEquals(250, health.getCommitCount());
        assertTrue(health.isWorkingTreeClean());
        assertTrue(health.hasTests());

        List<String> names = health.getChecks().stream().map(HealthCheck::getName).toList();
        assertEquals(List.of(
            HealthCheck.COMMITS_THIS_WEEK,
            HealthCheck.COMMIT_STREAK,
            HealthCheck.WORKING_TREE,
            HealthCheck.TESTS,
            HealthCheck.README,
            HealthCheck.LAST_ACTIVITY), names);
        assertTrue(health.getChecks().stream().noneMatch(HealthCheck::isDegraded));
    }

    @Test
    void testFailedProbeDegradesOnlyItsCheck() {
        stubHealthyRepository();
        when(collector.workingTreeChangeCount())
            .thenReturn(ProbeResult.failure(ProbeFailure.TIMED_OUT, "timed out after 3000ms"));

        RepositoryHealth health = scanner.scan();

        HealthCheck tree = health.findCheck(HealthCheck.WORKING_TREE).orElseThrow();
        assertTrue(tree.isDegraded());
        assertTrue(tree.getDetails().startsWith("TIMED_OUT"));
        assertEquals(0, tree.getScore());
        assertEquals("unknown", tree.getValue());
        assertFalse(health.isWorkingTreeClean());

        // 100 overall minus the working tree's 20 points
        assertEquals(80, health.getTotalScore());
        assertEquals(1, health.getChecks().stream().filter(HealthCheck::isDegraded).count());
    }

    @Test
    void testRepositoryWithoutCommitsFallsBackToWorstCase() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));
        when(collector.weeklyCommitCount()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));
        when(collector.recentCommitDates()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));
        when(collector.workingTreeChangeCount()).thenReturn(ProbeResult.success(2));
        when(collector.testFileCount()).thenReturn(ProbeResult.success(0));
        when(collector.hasReadme()).thenReturn(ProbeResult.success(false));
        when(collector.lastCommitTime()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));
        when(collector.totalCommitCount()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));

        RepositoryHealth health = scanner.scan();

        assertTrue(health.isGitRepo());
        assertEquals(0, health.getStreak());
        assertEquals(0, health.getCommitCount());
        assertTrue(health.getLastCommit().isEmpty());
        assertEquals("no commits", health.findCheck(HealthCheck.LAST_ACTIVITY).orElseThrow().getValue());
        // 20*60 + 15*20 + 5*30 = 1650
        assertEquals(17, health.getTotalScore());
    }

    @Test
    void testTimedOutLastCommitDegradesActivity() {
        stubHealthyRepository();
        when(collector.lastCommitTime())
            .thenReturn(ProbeResult.failure(ProbeFailure.TIMED_OUT, "timed out after 3000ms"));

        RepositoryHealth health = scanner.scan();

        HealthCheck activity = health.findCheck(HealthCheck.LAST_ACTIVITY).orElseThrow();
        assertTrue(activity.isDegraded());
        assertTrue(activity.getDetails().startsWith("TIMED_OUT"));
        assertEquals(0, activity.getScore());
        assertEquals(1, health.getChecks().stream().filter(HealthCheck::isDegraded).count());
    }

    @Test
    void testMissingCommitsDoNotDegradeActivity() {
        stubHealthyRepository();
        when(collector.lastCommitTime())
            .thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 128"));

        HealthCheck activity = scanner.scan().findCheck(HealthCheck.LAST_ACTIVITY).orElseThrow();

        assertFalse(activity.isDegraded());
        assertEquals("no commits", activity.getValue());
    }

    @Test
    void testCollectorExceptionDoesNotEscape() {
        stubHealthyRepository();
        when(collector.testFileCount()).thenThrow(new IllegalStateException("boom"));

        RepositoryHealth health = scanner.scan();

        HealthCheck tests = health.findCheck(HealthCheck.TESTS).orElseThrow();
        assertTrue(tests.isDegraded());
        assertEquals(20, tests.getScore());
    }

    @Test
    void testCollectorsRunConcurrently() {
        stubHealthyRepository();
        when(collector.weeklyCommitCount()).thenAnswer(inv -> slow(ProbeResult.success(12)));
        when(collector.recentCommitDates()).thenAnswer(inv -> slow(ProbeResult.success(lastDays(7))));
        when(collector.workingTreeChangeCount()).thenAnswer(inv -> slow(ProbeResult.success(0)));
        when(collector.testFileCount()).thenAnswer(inv -> slow(ProbeResult.success(4)));
        when(collector.hasReadme()).thenAnswer(inv -> slow(ProbeResult.success(true)));
        when(collector.lastCommitTime()).thenAnswer(inv -> slow(ProbeResult.success(NOW.minus(Duration.ofHours(2)))));

        long started = System.nanoTime();
        RepositoryHealth health = scanner.scan();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals(100, health.getTotalScore());
        // Six 400ms collectors back to back would take 2.4s
        assertTrue(elapsedMillis < 1500, "scan took " + elapsedMillis + "ms");
    }

    @Test
    void testCollectStats() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));
        when(collector.firstCommitTime()).thenReturn(ProbeResult.success(NOW.minus(Duration.ofDays(42))));
        when(collector.totalCommitCount()).thenReturn(ProbeResult.success(321L));
        when(collector.trackedFiles()).thenReturn(ProbeResult.success(List.of(
            "src/App.java", "src/Util.java", "web/index.ts", "README.md", ".gitignore", "Makefile")));
        when(collector.recentCommitSubjects()).thenReturn(ProbeResult.success(List.of("fix", "add feature")));

        RepoStats stats = scanner.collectStats();

        assertEquals(42, stats.getFirstCommitDays());
        assertEquals(321, stats.getTotalCommits());
        assertEquals(".java", stats.getTopExtension());
        assertEquals(2, stats.getTopExtensionCount());
        // (3 + 11) / 2
        assertEquals(7, stats.getAverageCommitMessageLength());
    }

    @Test
    void testCollectStatsWithFailingProbesUsesDefaults() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));
        when(collector.firstCommitTime()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, null));
        when(collector.totalCommitCount()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, null));
        when(collector.trackedFiles()).thenReturn(ProbeResult.failure(ProbeFailure.TIMED_OUT, null));
        when(collector.recentCommitSubjects()).thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, null));

        RepoStats stats = scanner.collectStats();

        assertEquals(0, stats.getFirstCommitDays());
        assertEquals(0, stats.getTotalCommits());
        assertEquals(RepoStats.UNKNOWN_EXTENSION, stats.getTopExtension());
        assertEquals(0, stats.getAverageCommitMessageLength());
    }

    @Test
    void testFindCodeIssuesParsesAndCaps() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));

        List<String> todoLines = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            todoLines.add("src/App.java:" + i + ":    // TODO item " + i);
        }
        todoLines.add("src/Util.java:7:  // fixme: handle null");
        when(collector.grep(eq("todo-markers"), anyString(), anyList())).thenReturn(ProbeResult.success(todoLines));
        when(collector.grep(eq("debug-output"), anyString(), anyList())).thenReturn(ProbeResult.success(List.of(
            "web/index.ts:12:console.log('here')",
            "web/index.ts:40:console.log('" + "x".repeat(80) + "')")));

        List<CodeIssue> issues = scanner.findCodeIssues();

        assertEquals(HealthScanner.MAX_CODE_ISSUES, issues.size());
        assertEquals(CodeIssue.Type.TODO, issues.get(0).getType());
        assertEquals("src/App.java", issues.get(0).getFile());
        assertEquals(1, issues.get(0).getLine());
        assertEquals("// TODO item 1", issues.get(0).getContent());
        assertEquals(CodeIssue.Type.FIXME, issues.get(6).getType());
        assertEquals(CodeIssue.Type.DEBUG_OUTPUT, issues.get(7).getType());
    }

    @Test
    void testLongIssueContentIsTruncated() {
        CodeIssue issue = HealthScanner.parseGrepLine("a.js:3:console.log('" + "y".repeat(100) + "')", true)
            .orElseThrow();
        assertEquals(CodeIssue.MAX_CONTENT_LENGTH, issue.getContent().length());
        assertFalse(HealthScanner.parseGrepLine("Binary file matches", false).isPresent());
    }

    @Test
    void testNoIssuesWhenGrepFindsNothing() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));
        when(collector.grep(anyString(), anyString(), anyList()))
            .thenReturn(ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code 1"));

        List<CodeIssue> issues = scanner.findCodeIssues();

        assertNotNull(issues);
        assertTrue(issues.isEmpty());
    }

    private void stubHealthyRepository() {
        when(collector.isInsideWorkTree()).thenReturn(ProbeResult.success(true));
        when(collector.weeklyCommitCount()).thenReturn(ProbeResult.success(12));
        when(collector.recentCommitDates()).thenReturn(ProbeResult.success(lastDays(7)));
        when(collector.workingTreeChangeCount()).thenReturn(ProbeResult.success(0));
        when(collector.testFileCount()).thenReturn(ProbeResult.success(4));
        when(collector.hasReadme()).thenReturn(ProbeResult.success(true));
        when(collector.lastCommitTime()).thenReturn(ProbeResult.success(NOW.minus(Duration.ofHours(2))));
        when(collector.totalCommitCount()).thenReturn(ProbeResult.success(250L));
    }

    private static List<LocalDate> lastDays(int days) {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            dates.add(TODAY.minusDays(i));
        }
        return dates;
    }

    private static <T> T slow(T value) throws InterruptedException {
        Thread.sleep(400);
        return value;
    }
}
