package com.mcpbridge.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A child process backing one instance.
 * <p>
 * Standard input and output stay open for the protocol client. Standard error is drained on a
 * daemon thread into a bounded buffer so a chatty server never blocks on a full pipe.
 */
public class ManagedProcess {

    private static final Logger log = LoggerFactory.getLogger(ManagedProcess.class);

    static final int MAX_STDERR_LINES = 200;
    private static final long FORCED_WAIT_SECONDS = 5;

    private final String instanceId;
    private final Process process;
    private final long startTime;
    private final LinkedList<String> stderrBuffer = new LinkedList<>();

    public ManagedProcess(String instanceId, Process process) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.process = Objects.requireNonNull(process, "process");
        this.startTime = System.currentTimeMillis();
        startStderrCapture();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getPid() {
        return process.pid();
    }

    public long getStartTime() {
        return startTime;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * @return the exit code, or {@code null} while the process is running
     */
    public Integer getExitCode() {
        return process.isAlive() ? null : process.exitValue();
    }

    /** Completes with the exit code once the process terminates. */
    public CompletableFuture<Integer> onExit() {
        return process.onExit().thenApply(Process::exitValue);
    }

    /** The child's standard input. */
    public OutputStream stdin() {
        return process.getOutputStream();
    }

    /** The child's standard output. */
    public InputStream stdout() {
        return process.getInputStream();
    }

    /**
     * Waits up to {@code timeout} for the process to exit.
     *
     * @return true if the process has exited
     */
    public boolean waitFor(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Requests graceful termination and escalates to a forced kill after {@code grace}.
     *
     * @return true if the forced kill was needed
     */
    public boolean terminate(Duration grace) {
        if (!process.isAlive()) {
            return false;
        }

        process.destroy();
        try {
            if (process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        log.warn("Instance {} (pid {}) did not exit within {}, forcing", instanceId, getPid(), grace);
        kill();
        return true;
    }

    /** Kills the process without a grace period. */
    public void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(FORCED_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return the most recent standard error lines, oldest first
     */
    public synchronized List<String> getRecentStderr() {
        return new ArrayList<>(stderrBuffer);
    }

    synchronized void addStderrLine(String line) {
        stderrBuffer.addLast(line);
        while (stderrBuffer.size() > MAX_STDERR_LINES) {
            stderrBuffer.removeFirst();
        }
    }

    private void startStderrCapture() {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    addStderrLine(line);
                    log.debug("[{}] {}", instanceId, line);
                }
            } catch (IOException e) {
                if (process.isAlive()) {
                    log.warn("Error capturing stderr of instance {}: {}", instanceId, e.getMessage());
                }
            }
        }, "stderr-" + instanceId);
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "instanceId='" + instanceId + '\'' +
                ", pid=" + getPid() +
                ", alive=" + isAlive() +
                '}';
    }
}
