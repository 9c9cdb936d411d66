package com.odebridge.inference;

import java.util.Collections;
import java.util.List;

import com.odebridge.Diagnostic;
import com.odebridge.Stage;

/**
 * Non-fatal finding of reaction inference. Lists the state variables it concerns.
 */
public final class InferenceDiagnostic extends Diagnostic {
    public static final String COEFFICIENT_MISMATCH = "COEFFICIENT_MISMATCH";
    public static final String NON_POLYNOMIAL = "NON_POLYNOMIAL";
    public static final String UNREPRESENTABLE_TERM = "UNREPRESENTABLE_TERM";
    public static final String TIME_DERIVATIVE = "TIME_DERIVATIVE";

    public final List<String> species;

    InferenceDiagnostic(Severity severity, String code, String message, List<String> species) {
        super(Stage.INFER, severity, code, message, null);
        this.species = Collections.unmodifiableList(species);
    }
}
