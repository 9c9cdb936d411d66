package com.odebridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.odebridge.extract.OdeSystem;
import com.odebridge.inference.InferenceResult;
import com.odebridge.model.StructuredModel;

/**
 * Outcome of converting one script: either a model or the fatal errors of the stage that
 * failed, plus every non-fatal diagnostic collected up to that point.
 */
public final class ConversionResult {
    public final String sourceName;
    private final StructuredModel model;
    private final OdeSystem system;
    private final InferenceResult inference;
    private final List<ConversionError> errors;
    private final List<Diagnostic> diagnostics;

    private ConversionResult(String sourceName, StructuredModel model, OdeSystem system, InferenceResult inference,
                             List<ConversionError> errors, List<Diagnostic> diagnostics) {
        this.sourceName = sourceName;
        this.model = model;
        this.system = system;
        this.inference = inference;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    static ConversionResult success(String sourceName, StructuredModel model, OdeSystem system,
                                    InferenceResult inference, List<Diagnostic> diagnostics) {
        return new ConversionResult(sourceName, model, system, inference, Collections.emptyList(), diagnostics);
    }

    static ConversionResult failure(String sourceName, OdeSystem system, List<? extends ConversionError> errors,
                                    List<Diagnostic> diagnostics) {
        if (errors.isEmpty()) throw new IllegalArgumentException("a failed conversion needs at least one error");
        return new ConversionResult(sourceName, null, system, null, new ArrayList<>(errors), diagnostics);
    }

    public boolean isSuccess() { return model != null; }

    /** The model, or null when the conversion failed. */
    public StructuredModel model() { return model; }

    /** The extracted ODE system, or null when extraction did not complete. */
    public OdeSystem system() { return system; }

    /** The inference outcome, or null when inference did not run. */
    public InferenceResult inference() { return inference; }

    public List<ConversionError> errors() { return errors; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    /** Stage of the failure, or null on success. */
    public Stage failedStage() {
        return errors.isEmpty() ? null : errors.get(0).stage();
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ConversionResult{" + sourceName + ": " + model + ", " + diagnostics.size() + " diagnostic(s)}"
                : "ConversionResult{" + sourceName + ": " + errors.size() + " error(s) in " + failedStage() + "}";
    }
}
