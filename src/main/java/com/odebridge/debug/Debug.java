package com.odebridge.debug;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Process-wide log hub shared by every conversion stage.
 *
 * Messages go to one installed {@link DebugSink}; nothing is written until a host installs
 * one. Messages below the hub threshold are dropped before they reach the sink, so a
 * stage may log freely at TRACE.
 */
public final class Debug {

    // SILENT must be initialised before INSTANCE reads it
    private static final DebugSink SILENT = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private volatile DebugSink sink = SILENT;
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink; null restores the silent one. */
    public void setSink(DebugSink sink) {
        this.sink = (sink == null) ? SILENT : sink;
    }

    public DebugSink getSink() {
        return sink;
    }

    public void setThreshold(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getThreshold() {
        return threshold;
    }

    public boolean isEnabled(DebugLevel level) {
        return sink != SILENT && level.atLeast(threshold);
    }

    /** Writes "LEVEL [tag] message" lines, dropping anything below minLevel. */
    public static DebugSink streamSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (!level.atLeast(minLevel)) return;
            out.println(level + " [" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    /** Keeps every message in memory, formatted like {@link #streamSink}. */
    public static final class Recorder implements DebugSink {
        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void log(DebugLevel level, String tag, String message, Throwable error) {
            lines.add(level + " [" + tag + "] " + message);
        }

        public List<String> lines() {
            synchronized (lines) {
                return new ArrayList<>(lines);
            }
        }
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        sink.log(level, tag, message, error);
    }
}
