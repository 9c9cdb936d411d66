package com.odebridge.debug;

/** Destination of conversion log messages: stderr, a test recorder or a bridge into the host logger. */
@FunctionalInterface
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
