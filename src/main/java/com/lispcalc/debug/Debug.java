package com.lispcalc.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the lexer, parser and both evaluators.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Silent until a sink is installed
 */
public final class Debug {

    // NOOP must be initialised before INSTANCE, whose constructor reads it
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at {@code min} and above to stderr, keeping stdout for program output. */
    public static void useSysErr(DebugLevel min) {
        INSTANCE.setSink(console(System.err, min));
    }

    public static DebugSink console(PrintStream out, DebugLevel min) {
        final DebugLevel floor = (min == null) ? DebugLevel.INFO : min;
        return (level, tag, message, error) -> {
            if (!level.atLeast(floor)) return;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void reset() {
        sinkRef.set(NOOP);
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
