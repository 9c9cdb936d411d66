package com.odebridge.matlab.parser;

import com.odebridge.ConversionError;
import com.odebridge.Stage;

public final class ParseError extends ConversionError {
    private static final long serialVersionUID = 1L;

    private final String expected; // may be null
    private final String found;

    public ParseError(String message, SourcePosition position, String expected, String found) {
        super(Stage.PARSE, message, position);
        this.expected = expected;
        this.found = found;
    }

    /** What the parser was looking for, e.g. "')'" or "expression". */
    public String expected() { return expected; }

    /** Lexeme of the offending token ("end of input" at EOF). */
    public String found() { return found; }
}
