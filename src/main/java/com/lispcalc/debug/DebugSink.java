package com.lispcalc.debug;

/** Pluggable debug output target (stdout, stderr, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
