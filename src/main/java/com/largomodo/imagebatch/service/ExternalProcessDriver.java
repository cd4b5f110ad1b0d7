package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.CancellationToken;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Base class for external servicing tools run once per image, with timeout,
 * cancellation and exit code enforcement.
 * <p>
 * The watchdog kills tools that exceed their timeout or whose cancellation token
 * fires, so a hung DISM-style process never holds an operation slot forever.
 * Non-zero exit codes fail fast with stderr captured for diagnostics.
 *
 * Subclasses: ExternalCommandExecutor
 */
public abstract class ExternalProcessDriver {

    protected static final long DEFAULT_TIMEOUT_MS = 60 * 60_000L;

    /**
     * Execute an external command with timeout, cancellation and exit code validation.
     *
     * @param command   command and arguments (command[0] = binary path)
     * @param timeoutMs watchdog timeout in milliseconds
     * @param token     cancellation destroys the process
     * @return captured stdout
     * @throws ProcessTimeoutException if the watchdog killed the process on timeout
     * @throws ProcessFailureException if the exit code is non-zero or execution fails
     * @throws CancellationException   if the token fired while the process ran
     */
    protected String executeCommand(List<String> command, long timeoutMs, CancellationToken token) throws IOException {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutMs + "ms");
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }

        CommandLine cmdLine = new CommandLine(command.get(0));
        for (String argument : command.subList(1, command.size())) {
            // Arguments are already split; quoting them again would pass literal quotes on Unix
            cmdLine.addArgument(argument, false);
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        DefaultExecutor executor = new DefaultExecutor();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        CancellableWatchdog watchdog = new CancellableWatchdog(timeoutMs);
        executor.setWatchdog(watchdog);
        Runnable kill = watchdog::cancel;
        token.onCancel(kill);

        try {
            token.throwIfCancelled();
            int exitCode = executor.execute(cmdLine);
            if (exitCode != 0) {
                throw new ProcessFailureException(
                        "Process exited with code " + exitCode + ": " + decode(stderr));
            }
            return decode(stdout);
        } catch (ExecuteException e) {
            // A process killed by the watchdog (timeout or cancel) also surfaces as ExecuteException
            if (token.isCancelled()) {
                throw new CancellationException("Process cancelled: " + command.get(0));
            }
            if (watchdog.killedProcess()) {
                throw new ProcessTimeoutException("Process exceeded timeout of " + timeoutMs + "ms");
            }
            throw new ProcessFailureException(
                    "Process failed: " + e.getMessage() + "\nStderr: " + decode(stderr));
        } finally {
            token.removeListener(kill);
        }
    }

    private static String decode(ByteArrayOutputStream stream) {
        return stream.toString(Charset.defaultCharset()).trim();
    }

    /**
     * Watchdog that only destroys a process it actually started watching.
     * {@link ExecuteWatchdog#destroyProcess()} waits for the process to start, which never
     * happens when the launch fails, so a cancel arriving before or after a failed launch
     * is recorded here and applied once {@link #start(Process)} runs.
     */
    static final class CancellableWatchdog extends ExecuteWatchdog {

        private boolean started;
        private boolean cancelRequested;

        CancellableWatchdog(long timeoutMs) {
            super(timeoutMs);
        }

        @Override
        public synchronized void start(Process processToMonitor) {
            super.start(processToMonitor);
            started = true;
            if (cancelRequested) {
                destroyProcess();
            }
        }

        synchronized void cancel() {
            cancelRequested = true;
            if (started) {
                destroyProcess();
            }
        }
    }

    public static class ProcessTimeoutException extends IOException {
        public ProcessTimeoutException(String message) {
            super(message);
        }
    }

    public static class ProcessFailureException extends IOException {
        public ProcessFailureException(String message) {
            super(message);
        }
    }
}
