package com.odebridge.matlab.parser;

/** What a name stands for in a scope, as far as the parser can tell. */
public enum Role {
    VARIABLE,
    FUNCTION,
    PARAMETER,
    UNKNOWN
}
