package com.phillippitts.podcaster.service.audio;

import com.phillippitts.podcaster.exception.AssemblyException;
import com.phillippitts.podcaster.exception.AssemblyExceptionBuilder;
import com.phillippitts.podcaster.util.ProcessTimeouts;
import com.phillippitts.podcaster.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external audio tool invocation to completion.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Capture stdout and stderr concurrently with byte caps</li>
 *   <li>Enforce a timeout and terminate runaway processes</li>
 *   <li>Report failures as {@link AssemblyException} with exit code, duration and a stderr snippet</li>
 * </ul>
 *
 * <p>The runner keeps no per-invocation state in fields, so concurrent pipeline runs may share it.
 */
final class AudioProcessRunner {

    private static final Logger LOG = LogManager.getLogger(AudioProcessRunner.class);
    private static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;
    private final int maxStdoutBytes;
    private final int maxStderrBytes;

    /**
     * Process execution state: the process and its stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    AudioProcessRunner(ProcessFactory processFactory, int maxStdoutBytes, int maxStderrBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.maxStdoutBytes = maxStdoutBytes;
        this.maxStderrBytes = maxStderrBytes;
    }

    /**
     * Runs the command and waits for it to exit.
     *
     * @param tool       tool name for logs and errors ("ffmpeg", "ffprobe")
     * @param command    full command line
     * @param workingDir working directory (nullable)
     * @param timeout    maximum runtime
     * @return captured output of a zero-exit run
     * @throws AssemblyException on timeout, non-zero exit, or I/O error
     */
    ProcessOutput run(String tool, List<String> command, Path workingDir, Duration timeout) {
        Objects.requireNonNull(command, "command");
        long startTime = System.nanoTime();
        ProcessExecution exec = null;

        try {
            exec = start(tool, command, workingDir);

            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw toolError(tool, "Timeout after " + timeout.toSeconds() + "s", -1, exec.stderr(),
                        startTime, null);
            }

            // Ensure gobblers have a moment to flush
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw toolError(tool, "Non-zero exit: " + exitCode, exitCode, exec.stderr(), startTime, null);
            }

            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("{} finished in {}ms (stdout={} chars)", tool, durationMs, exec.stdout().length());
            return new ProcessOutput(exec.stdout().toString(), exec.stderr().toString(), exitCode, durationMs);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw toolError(tool, "I/O failure: " + e.getMessage(), -1,
                    exec == null ? null : exec.stderr(), startTime, e);
        } finally {
            cleanup(exec);
        }
    }

    private ProcessExecution start(String tool, List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", maxStdoutBytes);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err", maxStderrBytes);
        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a buffer until the cap is reached, then keeps draining without
     * accumulating so the child process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec == null) {
            return;
        }
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }

    private AssemblyException toolError(String tool, String msg, int exitCode, StringBuilder stderr,
                                        long startNano, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }

        AssemblyExceptionBuilder builder = AssemblyExceptionBuilder.create(tool + " " + msg)
                .tool(tool)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("stderr", stderrSnippet);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
