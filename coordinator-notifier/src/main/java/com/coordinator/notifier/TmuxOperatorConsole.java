package com.coordinator.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Types into a tmux pane with {@code send-keys}. Text is sent literally ({@code -l}) so
 * shell metacharacters in notifications are not interpreted; submit sends Enter.
 */
public class TmuxOperatorConsole implements OperatorConsole {

    private static final Logger log = LoggerFactory.getLogger(TmuxOperatorConsole.class);

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Runs an external command and returns its exit code.
     */
    @FunctionalInterface
    public interface CommandRunner {
        int run(List<String> command) throws IOException, InterruptedException;
    }

    private final String target;
    private final CommandRunner runner;

    public TmuxOperatorConsole(String target) {
        this(target, TmuxOperatorConsole::runProcess);
    }

    public TmuxOperatorConsole(String target, CommandRunner runner) {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("tmux target is required");
        }
        this.target = target;
        this.runner = runner;
    }

    @Override
    public void writeLine(String text) {
        send(List.of("tmux", "send-keys", "-t", target, "-l", text));
    }

    @Override
    public void submit() {
        send(List.of("tmux", "send-keys", "-t", target, "Enter"));
    }

    private void send(List<String> command) {
        int exitCode;
        try {
            exitCode = runner.run(command);
        } catch (IOException e) {
            throw new OperatorConsoleException("Cannot run tmux for " + target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperatorConsoleException("Interrupted while sending to " + target, e);
        }
        if (exitCode != 0) {
            throw new OperatorConsoleException("tmux send-keys to " + target + " exited with " + exitCode);
        }
        log.trace("Sent {} to {}", command.get(command.size() - 1), target);
    }

    private static int runProcess(List<String> command) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .start();
        if (!process.waitFor(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("tmux did not finish within " + COMMAND_TIMEOUT);
        }
        return process.exitValue();
    }
}
