package com.dcruver.gitpet.domain;

import com.dcruver.gitpet.config.ProbeProperties;
import com.dcruver.gitpet.io.GitProbeRunner;
import com.dcruver.gitpet.io.ProbeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Collectors against a real throwaway repository. Skipped when git is not installed.
 */
class GitMetricsCollectorTest {

    @TempDir
    Path repoDir;

    private final Clock clock = Clock.systemDefaultZone();
    private GitProbeRunner runner;

    @BeforeAll
    static void requireGit() {
        assumeTrue(gitAvailable(), "git executable not available");
    }

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.shutdown();
        }
    }

    @Test
    void testPlainDirectoryIsNotARepository() {
        GitMetricsCollector collector = collector();

        assertFalse(collector.isInsideWorkTree().orElse(false));
    }

    @Test
    void testEmptyRepositoryDegradesCommitProbes() throws Exception {
        git("init", "-q");
        GitMetricsCollector collector = collector();

        assertTrue(collector.isInsideWorkTree().orElse(false));
        assertTrue(collector.lastCommitTime().isFailure());
        assertTrue(collector.totalCommitCount().isFailure());
        assertEquals(0, collector.workingTreeChangeCount().orElse(-1));
        assertEquals(0, collector.testFileCount().orElse(-1));
        assertFalse(collector.hasReadme().orElse(true));
    }

    @Test
    void testRepositoryWithOneCommit() throws Exception {
        git("init", "-q");
        Files.writeString(repoDir.resolve("README.md"), "# demo\n");
        Files.createDirectories(repoDir.resolve("src"));
        Files.writeString(repoDir.resolve("src/App.java"), "class App {\n    // TODO wire up\n}\n");
        Files.writeString(repoDir.resolve("src/AppTest.java"), "class AppTest {}\n");
        git("add", ".");
        commit("initial commit");

        GitMetricsCollector collector = collector();
        Instant now = clock.instant();

        assertTrue(collector.isInsideWorkTree().orElse(false));
        assertEquals(1, collector.weeklyCommitCount().orElse(-1));
        assertEquals(List.of(LocalDate.now(clock)), collector.recentCommitDates().orElse(List.of()));
        assertEquals(1, collector.testFileCount().orElse(-1));
        assertTrue(collector.hasReadme().orElse(false));
        assertEquals(1L, collector.totalCommitCount().orElse(-1L));
        assertEquals(List.of("initial commit"), collector.recentCommitSubjects().orElse(List.of()));
        assertEquals(3, collector.trackedFiles().orElse(List.of()).size());

        Instant lastCommit = collector.lastCommitTime().orElse(Instant.EPOCH);
        assertTrue(Duration.between(lastCommit, now).abs().toMinutes() < 5);
        assertEquals(lastCommit, collector.firstCommitTime().orElse(Instant.EPOCH));

        ProbeResult<List<String>> todos = collector.grep("todo", "TODO|FIXME", List.of("*.java"));
        assertEquals(1, todos.orElse(List.of()).size());
        assertTrue(todos.orElse(List.of()).get(0).startsWith("src/App.java:2:"));
    }

    @Test
    void testWorkingTreeCountsModifiedAndUntrackedFiles() throws Exception {
        git("init", "-q");
        Files.writeString(repoDir.resolve("notes.txt"), "one\n");
        git("add", ".");
        commit("add notes");

        Files.writeString(repoDir.resolve("notes.txt"), "two\n");
        Files.writeString(repoDir.resolve("scratch.txt"), "new\n");

        assertEquals(2, collector().workingTreeChangeCount().orElse(-1));
    }

    @Test
    void testGrepWithoutMatchesIsFailure() throws Exception {
        git("init", "-q");
        Files.writeString(repoDir.resolve("Clean.java"), "class Clean {}\n");
        git("add", ".");
        commit("clean");

        assertTrue(collector().grep("todo", "TODO|FIXME", List.of("*.java")).isFailure());
    }

    private GitMetricsCollector collector() {
        runner = new GitProbeRunner(repoDir, "git");
        return new GitMetricsCollector(runner, new ProbeProperties(), clock);
    }

    private void commit(String message) throws Exception {
        git("-c", "user.name=Git Pet", "-c", "user.email=pet@example.com", "-c", "commit.gpgsign=false",
            "commit", "-q", "-m", message);
    }

    private void git(String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));

        Process process = new ProcessBuilder(command)
            .directory(repoDir.toFile())
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .start();
        assertTrue(process.waitFor(30, TimeUnit.SECONDS), "git " + String.join(" ", args) + " hung");
        assertEquals(0, process.exitValue(), "git " + String.join(" ", args) + " failed");
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version")
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
