package com.odebridge;

import java.util.Collections;
import java.util.List;

import com.odebridge.matlab.parser.SourcePosition;

/**
 * Base of every fatal error the conversion pipeline can surface.
 * A stage that produced one of these never hands its output to the next stage.
 */
public abstract class ConversionError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Stage stage;
    private final SourcePosition position; // may be null

    protected ConversionError(Stage stage, String message, SourcePosition position) {
        super(message);
        this.stage = stage;
        this.position = position;
    }

    protected ConversionError(Stage stage, String message, SourcePosition position, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.position = position;
    }

    public Stage stage() { return stage; }

    public SourcePosition position() { return position; }

    /** Every error this one stands for, in source order. Usually just itself. */
    public List<ConversionError> errors() {
        return Collections.singletonList(this);
    }

    /** Message prefixed with the source location when one is known. */
    public String describe() {
        String where = (position == null) ? "" : position + ": ";
        return where + stage.name().toLowerCase() + " error: " + getMessage();
    }
}
