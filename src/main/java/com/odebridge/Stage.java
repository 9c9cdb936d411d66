package com.odebridge;

/** Pipeline stages, in execution order. */
public enum Stage {
    LEX,
    PARSE,
    EXTRACT,
    INFER,
    ASSEMBLE
}
