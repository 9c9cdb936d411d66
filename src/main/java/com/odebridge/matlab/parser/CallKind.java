package com.odebridge.matlab.parser;

/** Resolution of a name(args) node. UNKNOWN never survives a finished parse. */
public enum CallKind {
    UNKNOWN,
    CALL,
    INDEX
}
