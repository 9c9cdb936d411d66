package com.odebridge.matlab.parser;

import com.odebridge.ConversionError;
import com.odebridge.Stage;

public final class LexError extends ConversionError {
    private static final long serialVersionUID = 1L;

    public LexError(String message, SourcePosition position) {
        super(Stage.LEX, message, position);
    }
}
