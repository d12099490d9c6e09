package com.dcruver.gitpet.io;

import com.dcruver.gitpet.config.ProbeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs single git queries against the working directory.
 *
 * Every failure mode (timeout, non-zero exit, missing executable, oversized output)
 * is returned as a {@link ProbeResult} failure; nothing is thrown to the caller.
 * Each call forks its own process and shares no state with other calls.
 */
@Component
@Slf4j
public class GitProbeRunner {

    // Time allowed for the output reader to drain after the process has exited
    private static final long OUTPUT_DRAIN_MILLIS = 1000;

    private final Path workingDirectory;
    private final String executable;
    private final ExecutorService outputReaders;

    @Autowired
    public GitProbeRunner(@Value("${gitpet.working-dir:.}") String workingDir, ProbeProperties probeProperties) {
        this(Path.of(workingDir), probeProperties.getExecutable());
    }

    public GitProbeRunner(Path workingDirectory, String executable) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
        this.executable = executable;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("probe-output-");
        threadFactory.setDaemon(true);
        this.outputReaders = Executors.newCachedThreadPool(threadFactory);

        log.debug("GitProbeRunner using '{}' in {}", executable, this.workingDirectory);
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Execute the probe and return its stdout, or a failure result.
     */
    public ProbeResult<String> run(GitProbe probe) {
        List<String> command = new ArrayList<>(probe.getArguments().size() + 1);
        command.add(executable);
        command.addAll(probe.getArguments());

        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(workingDirectory.toFile())
            .redirectError(ProcessBuilder.Redirect.DISCARD);
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");
        builder.environment().put("GIT_PAGER", "cat");

        long started = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.debug("Probe {} could not start: {}", probe.getName(), e.getMessage());
            return ProbeResult.failure(ProbeFailure.EXECUTION_FAILED, e.getMessage());
        }

        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Probe {}: failed to close stdin: {}", probe.getName(), e.getMessage());
        }

        Future<byte[]> output = outputReaders.submit(() -> readBounded(process, probe.getMaxOutputBytes()));

        try {
            if (!process.waitFor(probe.getTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                output.cancel(true);
                log.warn("Probe {} timed out after {}ms", probe.getName(), probe.getTimeout().toMillis());
                return ProbeResult.failure(ProbeFailure.TIMED_OUT,
                    "timed out after " + probe.getTimeout().toMillis() + "ms");
            }

            byte[] stdout = output.get(OUTPUT_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            log.debug("Probe {} exited with {} in {}ms", probe.getName(), exitCode,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));

            if (exitCode != 0) {
                return ProbeResult.failure(ProbeFailure.NON_ZERO_EXIT, "exit code " + exitCode);
            }
            return ProbeResult.success(new String(stdout, StandardCharsets.UTF_8));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            output.cancel(true);
            return ProbeResult.failure(ProbeFailure.INTERRUPTED, "interrupted while waiting for " + probe.getName());

        } catch (ExecutionException e) {
            process.destroyForcibly();
            if (e.getCause() instanceof OutputLimitExceededException) {
                log.warn("Probe {} exceeded output limit of {} bytes", probe.getName(), probe.getMaxOutputBytes());
                return ProbeResult.failure(ProbeFailure.OUTPUT_TOO_LARGE, e.getCause().getMessage());
            }
            log.debug("Probe {} output could not be read", probe.getName(), e.getCause());
            return ProbeResult.failure(ProbeFailure.EXECUTION_FAILED, String.valueOf(e.getCause()));

        } catch (TimeoutException e) {
            process.destroyForcibly();
            output.cancel(true);
            return ProbeResult.failure(ProbeFailure.EXECUTION_FAILED, "output stream not closed after exit");
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    /**
     * Read stdout fully, killing the process once the limit is passed.
     */
    private static byte[] readBounded(Process process, int maxBytes) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];

        try (InputStream in = process.getInputStream()) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                if (buffer.size() + read > maxBytes) {
                    process.destroyForcibly();
                    throw new OutputLimitExceededException(maxBytes);
                }
                buffer.write(chunk, 0, read);
            }
        }
        return buffer.toByteArray();
    }

    private static final class OutputLimitExceededException extends IOException {
        OutputLimitExceededException(int maxBytes) {
            super("output exceeded " + maxBytes + " bytes");
        }
    }
}
