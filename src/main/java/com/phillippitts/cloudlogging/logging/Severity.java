package com.phillippitts.cloudlogging.logging;

import org.apache.logging.log4j.Level;

/**
 * Google Cloud Logging severity vocabulary, declared from least to most severe.
 *
 * <p>{@link #DEFAULT} is the "no severity yet" value of a fresh {@link RequestLogs}; it is never
 * derived from a log event. Comparisons always use this ordering rather than raw Log4j2
 * {@code intLevel} values, whose scale runs the other way.
 */
public enum Severity {
    DEFAULT,
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /**
     * Maps a Log4j2 level onto the cloud vocabulary.
     *
     * <p>Custom levels land on the nearest standard level that is not more severe than they are,
     * so a level registered between WARN and INFO reports as INFO. A {@code null} level maps to
     * {@link #WARNING}.
     *
     * @param level Log4j2 level, possibly custom
     * @return matching cloud severity, never {@link #DEFAULT}
     */
    public static Severity fromLevel(Level level) {
        if (level == null) {
            return WARNING;
        }
        int intLevel = level.intLevel();
        if (intLevel <= Level.FATAL.intLevel()) {
            return CRITICAL;
        }
        if (intLevel <= Level.ERROR.intLevel()) {
            return ERROR;
        }
        if (intLevel <= Level.WARN.intLevel()) {
            return WARNING;
        }
        if (intLevel <= Level.INFO.intLevel()) {
            return INFO;
        }
        return DEBUG;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }
}
