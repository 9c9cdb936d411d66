package com.odebridge;

import java.util.ArrayList;
import java.util.List;

import com.odebridge.debug.Debug;
import com.odebridge.extract.ModelExtractor;
import com.odebridge.extract.OdeSystem;
import com.odebridge.inference.InferenceOptions;
import com.odebridge.inference.InferenceResult;
import com.odebridge.inference.ReactionInference;
import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.parser.Lexer;
import com.odebridge.matlab.parser.ParsedScript;
import com.odebridge.matlab.parser.Parser;
import com.odebridge.matlab.parser.Token;
import com.odebridge.model.ModelAssembler;
import com.odebridge.model.StructuredModel;

/**
 * Converts MATLAB/Octave ODE scripts into a {@link StructuredModel}.
 *
 * Pipeline: lex, parse (with call/index resolution), extract the ODE system, infer
 * reactions, assemble. A stage that fails stops the pipeline; its errors come back in the
 * {@link ConversionResult} together with the diagnostics gathered so far.
 *
 * An instance only holds options. Concurrent conversions on one instance are fine as long
 * as nobody changes the options meanwhile.
 */
public class OdeBridge {
    private static final String TAG = "odebridge.engine";

    /** How unsupported constructs inside the model code are treated. Default STRICT. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    private Mode mode = Mode.STRICT;
    private boolean inferReactions = true;
    private double coefficientTolerance = InferenceOptions.DEFAULT_TOLERANCE;
    private String compartmentId = ModelAssembler.DEFAULT_COMPARTMENT;
    private MatlabBuiltins builtins = MatlabBuiltins.standard();

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }

    public Mode getMode() { return mode; }

    /** When false every state variable becomes a rate rule. */
    public void setInferReactions(boolean infer) { this.inferReactions = infer; }

    public boolean isInferReactions() { return inferReactions; }

    public void setCoefficientTolerance(double tolerance) {
        InferenceOptions.defaults().withCoefficientTolerance(tolerance); // validates
        this.coefficientTolerance = tolerance;
    }

    public double getCoefficientTolerance() { return coefficientTolerance; }

    public void setCompartmentId(String id) {
        new ModelAssembler(id); // validates
        this.compartmentId = id;
    }

    public String getCompartmentId() { return compartmentId; }

    public void setBuiltins(MatlabBuiltins builtins) {
        this.builtins = (builtins == null) ? MatlabBuiltins.standard() : builtins;
    }

    public MatlabBuiltins getBuiltins() { return builtins; }

    public ConversionResult convert(String sourceName, String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        String name = (sourceName == null) ? "<script>" : sourceName;
        List<Diagnostic> diagnostics = new ArrayList<>();
        OdeSystem system = null;
        Debug.get().d(TAG, "converting " + name + " (" + mode + ")");
        try {
            List<Token> tokens = new Lexer(name, source).tokenize();
            ParsedScript script = new Parser(tokens, builtins).parse();
            if (script.hasErrors()) return failed(name, null, script.errors(), diagnostics);

            system = new ModelExtractor(builtins, mode == Mode.STRICT).extract(script);
            diagnostics.addAll(system.diagnostics());

            InferenceOptions options = InferenceOptions.defaults()
                    .withInferReactions(inferReactions)
                    .withCoefficientTolerance(coefficientTolerance);
            InferenceResult inference = new ReactionInference(options).infer(system);
            diagnostics.addAll(inference.diagnostics());

            StructuredModel model = new ModelAssembler(compartmentId).assemble(system, inference);
            Debug.get().i(TAG, name + ": " + model + ", " + diagnostics.size() + " diagnostic(s)");
            return ConversionResult.success(name, model, system, inference, diagnostics);
        } catch (ConversionError e) {
            return failed(name, system, e.errors(), diagnostics);
        }
    }

    private ConversionResult failed(String name, OdeSystem system, List<? extends ConversionError> errors,
                                    List<Diagnostic> diagnostics) {
        for (ConversionError e : errors) Debug.get().e(TAG, name + ": " + e.describe());
        return ConversionResult.failure(name, system, errors, diagnostics);
    }
}
