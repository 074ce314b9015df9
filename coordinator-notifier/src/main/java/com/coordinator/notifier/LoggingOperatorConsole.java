package com.coordinator.notifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console that writes submitted text to the {@code coordinator.operator} log.
 * Used where no terminal multiplexer is available.
 */
public class LoggingOperatorConsole implements OperatorConsole {

    private static final Logger operator = LoggerFactory.getLogger("coordinator.operator");

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public synchronized void writeLine(String text) {
        if (buffer.length() > 0) {
            buffer.append(System.lineSeparator());
        }
        buffer.append(text);
    }

    @Override
    public synchronized void submit() {
        if (buffer.length() == 0) {
            return;
        }
        operator.info(buffer.toString());
        buffer.setLength(0);
    }

    synchronized String buffered() {
        return buffer.toString();
    }
}
