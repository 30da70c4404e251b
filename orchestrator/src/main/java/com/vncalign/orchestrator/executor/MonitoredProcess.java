package com.vncalign.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A started child process with bounded output capture and a hard timeout.
 *
 * Nothing blocks on the process: stdout and stderr are drained on
 * {@code ioExecutor}, the timeout is a task on {@code scheduler}, and
 * {@link #outcome()} completes once the process has exited and its pipes
 * have been drained (or after a short grace period if a grandchild still
 * holds them open).
 */
public class MonitoredProcess {

    private static final Logger log = LoggerFactory.getLogger(MonitoredProcess.class);

    private static final long DRAIN_GRACE_SECONDS = 2;

    private final String  jobId;
    private final Process process;
    private final OutputTail stdout;
    private final OutputTail stderr;
    private final CompletableFuture<ProcessOutcome> outcome;

    private volatile boolean timedOut;
    private volatile ScheduledFuture<?> timeoutTask;

    private MonitoredProcess(String jobId, Process process, int tailLines) {
        this.jobId   = jobId;
        this.process = process;
        this.stdout  = new OutputTail(tailLines);
        this.stderr  = new OutputTail(tailLines);
        this.outcome = new CompletableFuture<>();
    }

    /**
     * Start {@code command} and begin monitoring it.
     *
     * @throws IOException if the launcher cannot start the process
     */
    public static MonitoredProcess start(ProcessLauncher launcher,
                                         String jobId,
                                         List<String> command,
                                         Path workDir,
                                         Duration timeout,
                                         int tailLines,
                                         Executor ioExecutor,
                                         TaskScheduler scheduler) throws IOException {
        Process process = launcher.start(command, workDir);
        MonitoredProcess monitored = new MonitoredProcess(jobId, process, tailLines);
        monitored.watch(timeout, ioExecutor, scheduler);
        return monitored;
    }

    public CompletableFuture<ProcessOutcome> outcome() {
        return outcome;
    }

    public OptionalLong pid() {
        try {
            return OptionalLong.of(process.pid());
        } catch (UnsupportedOperationException e) {
            return OptionalLong.empty();
        }
    }

    /** The OS handle, when the launcher's process exposes one. */
    public Optional<ProcessHandle> handle() {
        try {
            return Optional.of(process.toHandle());
        } catch (UnsupportedOperationException e) {
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void watch(Duration timeout, Executor ioExecutor, TaskScheduler scheduler) {
        CompletableFuture<Void> drainOut = CompletableFuture.runAsync(
                () -> drain(process.getInputStream(), stdout, true), ioExecutor);
        CompletableFuture<Void> drainErr = CompletableFuture.runAsync(
                () -> drain(process.getErrorStream(), stderr, false), ioExecutor);

        timeoutTask = scheduler.schedule(this::kill, Instant.now().plus(timeout));

        process.onExit().whenCompleteAsync((p, err) -> {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) task.cancel(false);

            CompletableFuture.allOf(drainOut, drainErr)
                    .completeOnTimeout(null, DRAIN_GRACE_SECONDS, TimeUnit.SECONDS)
                    .whenComplete((ignored, drainErrCause) -> {
                        if (err != null) {
                            outcome.completeExceptionally(err);
                            return;
                        }
                        outcome.complete(new ProcessOutcome(
                                process.exitValue(), timedOut, stdout.text(), stderr.text()));
                    });
        }, ioExecutor);
    }

    private void kill() {
        if (!process.isAlive()) return;
        timedOut = true;
        log.warn("Process for {} exceeded its time limit, killing it", jobId);
        try {
            // The executor's CMTK tools are grandchildren; take them down first
            // so they do not keep running (and keep our pipes open).
            process.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            log.debug("Cannot enumerate descendants of process for {}", jobId);
        }
        process.destroyForcibly();
    }

    private void drain(InputStream in, OutputTail tail, boolean isStdout) {
        MDC.put("jobId", jobId);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                tail.append(line);
                if (isStdout) {
                    log.debug("[{}] {}", jobId, line);
                } else {
                    log.debug("[{}] stderr: {}", jobId, line);
                }
            }
        } catch (IOException e) {
            // Stream closed under us when the process was killed.
            log.debug("Output stream for {} closed: {}", jobId, e.getMessage());
        } catch (UncheckedIOException e) {
            log.debug("Output stream for {} failed: {}", jobId, e.getMessage());
        } finally {
            MDC.remove("jobId");
        }
    }
}
