package org.mapforge.junit.extensions.logging;

/**
 * Levels the log assertions can refer to. DEBUG and TRACE are never checked.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
