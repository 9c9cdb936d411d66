package com.odebridge.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.odebridge.ConversionError;
import com.odebridge.Stage;
import com.odebridge.matlab.parser.SourcePosition;

public final class ExtractionError extends ConversionError {
    private static final long serialVersionUID = 1L;

    private final String identifier; // offending name, may be null
    private final List<ExtractionError> collected; // empty unless this groups several errors

    public ExtractionError(String message, SourcePosition position) {
        this(message, position, null);
    }

    public ExtractionError(String message, SourcePosition position, String identifier) {
        super(Stage.EXTRACT, message, position);
        this.identifier = identifier;
        this.collected = Collections.emptyList();
    }

    private ExtractionError(List<ExtractionError> errors) {
        super(Stage.EXTRACT, errors.size() + " extraction errors, first: " + errors.get(0).getMessage(),
                errors.get(0).position());
        this.identifier = errors.get(0).identifier;
        this.collected = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ExtractionError unbound(String name, SourcePosition position) {
        return new ExtractionError("Identifier '" + name + "' is neither a state variable nor a bound parameter",
                position, name);
    }

    /** One error standing for all of the given ones, which must not be empty. */
    public static ExtractionError of(List<ExtractionError> errors) {
        if (errors.isEmpty()) throw new IllegalArgumentException("no errors to report");
        if (errors.size() == 1) return errors.get(0);
        List<ExtractionError> flat = new ArrayList<>();
        for (ExtractionError e : errors) {
            if (e.collected.isEmpty()) flat.add(e);
            else flat.addAll(e.collected);
        }
        return new ExtractionError(flat);
    }

    public String identifier() { return identifier; }

    @Override
    public List<ConversionError> errors() {
        if (collected.isEmpty()) return super.errors();
        return new ArrayList<>(collected);
    }
}
