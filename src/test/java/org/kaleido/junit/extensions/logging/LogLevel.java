package org.kaleido.junit.extensions.logging;

/**
 * Log levels watched by {@link LogWatchExtension}.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
