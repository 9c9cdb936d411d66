package com.odebridge.inference;

/**
 * Knobs of {@link ReactionInference}. Immutable; use the with* methods to derive variants.
 */
public final class InferenceOptions {
    public static final double DEFAULT_TOLERANCE = 1e-9;

    private static final InferenceOptions DEFAULTS = new InferenceOptions(true, DEFAULT_TOLERANCE);

    public final boolean inferReactions;
    public final double coefficientTolerance;

    private InferenceOptions(boolean inferReactions, double coefficientTolerance) {
        if (!(coefficientTolerance >= 0.0) || Double.isInfinite(coefficientTolerance)) {
            throw new IllegalArgumentException("coefficient tolerance must be a finite value >= 0, got " + coefficientTolerance);
        }
        this.inferReactions = inferReactions;
        this.coefficientTolerance = coefficientTolerance;
    }

    public static InferenceOptions defaults() {
        return DEFAULTS;
    }

    /** When false every non-trivial state variable becomes a rate rule. */
    public InferenceOptions withInferReactions(boolean infer) {
        return new InferenceOptions(infer, coefficientTolerance);
    }

    /** Relative tolerance of the "equal magnitude" test between paired coefficients. */
    public InferenceOptions withCoefficientTolerance(double tolerance) {
        return new InferenceOptions(inferReactions, tolerance);
    }

    boolean sameMagnitude(double a, double b) {
        double x = Math.abs(a);
        double y = Math.abs(b);
        return Math.abs(x - y) <= coefficientTolerance * Math.max(x, y);
    }

    @Override
    public String toString() {
        return "InferenceOptions{inferReactions=" + inferReactions + ", tolerance=" + coefficientTolerance + "}";
    }
}
