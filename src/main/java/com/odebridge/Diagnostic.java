package com.odebridge;

import com.odebridge.matlab.parser.SourcePosition;

/**
 * Non-fatal finding attached to a conversion result. Never stops the pipeline.
 */
public class Diagnostic {

    public enum Severity { INFO, WARNING }

    public final Stage stage;
    public final Severity severity;
    public final String code;
    public final String message;
    public final SourcePosition position; // may be null

    public Diagnostic(Stage stage, Severity severity, String code, String message, SourcePosition position) {
        this.stage = stage;
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.position = position;
    }

    public static Diagnostic warning(Stage stage, String code, String message, SourcePosition position) {
        return new Diagnostic(stage, Severity.WARNING, code, message, position);
    }

    public static Diagnostic info(Stage stage, String code, String message, SourcePosition position) {
        return new Diagnostic(stage, Severity.INFO, code, message, position);
    }

    @Override
    public String toString() {
        String where = (position == null) ? "" : position + ": ";
        return where + severity.name().toLowerCase() + " [" + code + "] " + message;
    }
}
