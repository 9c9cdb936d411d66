package com.odebridge.debug;

/** Log severities, least severe first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return compareTo(other) >= 0;
    }

    /** Case-insensitive lookup, for command line flags. */
    public static DebugLevel parse(String name) {
        for (DebugLevel l : values()) {
            if (l.name().equalsIgnoreCase(name)) return l;
        }
        throw new IllegalArgumentException("unknown log level '" + name + "'");
    }
}
