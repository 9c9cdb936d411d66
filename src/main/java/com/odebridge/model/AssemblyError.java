package com.odebridge.model;

import com.odebridge.ConversionError;
import com.odebridge.Stage;

/** Internal inconsistency between the extracted system and the inferred reactions. */
public final class AssemblyError extends ConversionError {
    private static final long serialVersionUID = 1L;

    public AssemblyError(String message) {
        super(Stage.ASSEMBLE, message, null);
    }
}
