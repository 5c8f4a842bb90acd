package org.ecosocial.junit.extensions.logging;

/**
 * Log levels understood by {@link LogWatchExtension} annotations.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
