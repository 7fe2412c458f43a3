package com.lispcalc.debug;

/** Severity of a debug message, ordered from most to least verbose. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel min) {
        return compareTo(min) >= 0;
    }
}
