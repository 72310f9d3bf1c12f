package org.lexora.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} rules can refer to.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
