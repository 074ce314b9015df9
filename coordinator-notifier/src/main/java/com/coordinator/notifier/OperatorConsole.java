package com.coordinator.notifier;

/**
 * Where operator notifications end up, usually the operator agent's terminal.
 * Text is written first and submitted separately, the way a person types and presses Enter.
 */
public interface OperatorConsole {

    /**
     * Type a line of text without submitting it.
     *
     * @throws OperatorConsoleException if the console cannot be reached
     */
    void writeLine(String text);

    /**
     * Submit what was written.
     *
     * @throws OperatorConsoleException if the console cannot be reached
     */
    void submit();
}
