package com.odebridge.matlab;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Closed registry of names the translator knows without reading any source:
 * ODE solvers, built-in functions and built-in constants.
 *
 * Instances are immutable. {@link #standard()} is built once and shared; a caller that
 * needs extra names derives a copy through {@link #toBuilder()}.
 */
public final class MatlabBuiltins {

    /** A built-in that the symbolic layer can keep as a function node and fold when its arguments are constant. */
    public static final class MathFunction {
        public final String name;
        public final int arity;
        private final DoubleUnaryOperator unary;
        private final DoubleBinaryOperator binary;

        private MathFunction(String name, DoubleUnaryOperator unary, DoubleBinaryOperator binary) {
            this.name = name;
            this.unary = unary;
            this.binary = binary;
            this.arity = (unary != null) ? 1 : 2;
        }

        public static MathFunction unary(String name, DoubleUnaryOperator op) {
            return new MathFunction(name, op, null);
        }

        public static MathFunction binary(String name, DoubleBinaryOperator op) {
            return new MathFunction(name, null, op);
        }

        public double apply(double[] args) {
            if (args.length != arity) {
                throw new IllegalArgumentException(name + " expects " + arity + " argument(s), got " + args.length);
            }
            return (arity == 1) ? unary.applyAsDouble(args[0]) : binary.applyAsDouble(args[0], args[1]);
        }
    }

    private static final MatlabBuiltins STANDARD = createStandard();

    private final Set<String> solvers;
    private final Set<String> functions;
    private final Map<String, Double> constants;
    private final Map<String, MathFunction> math;

    private MatlabBuiltins(Builder b) {
        this.solvers = Collections.unmodifiableSet(new LinkedHashSet<>(b.solvers));
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(b.functions));
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(b.constants));
        this.math = Collections.unmodifiableMap(new LinkedHashMap<>(b.math));
    }

    public static MatlabBuiltins standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.solvers.addAll(solvers);
        b.functions.addAll(functions);
        b.constants.putAll(constants);
        b.math.putAll(math);
        return b;
    }

    public boolean isSolver(String name) {
        return solvers.contains(name);
    }

    /** True for any known non-solver built-in, constants and lowerable math functions included. */
    public boolean isFunction(String name) {
        return functions.contains(name) || math.containsKey(name) || constants.containsKey(name);
    }

    /** Known solver or built-in: a call no matter how it is spelled. */
    public boolean isKnown(String name) {
        return isSolver(name) || isFunction(name);
    }

    public boolean isConstant(String name) {
        return constants.containsKey(name);
    }

    /** Value of a built-in constant, or null. */
    public Double constant(String name) {
        return constants.get(name);
    }

    /** Lowerable math function, or null. */
    public MathFunction math(String name) {
        return math.get(name);
    }

    public Set<String> solvers() {
        return solvers;
    }

    public static final class Builder {
        private final Set<String> solvers = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private final Map<String, Double> constants = new LinkedHashMap<>();
        private final Map<String, MathFunction> math = new LinkedHashMap<>();

        private Builder() {}

        public Builder solver(String... names) {
            Collections.addAll(solvers, names);
            return this;
        }

        public Builder function(String... names) {
            Collections.addAll(functions, names);
            return this;
        }

        public Builder constant(String name, double value) {
            constants.put(name, value);
            return this;
        }

        public Builder math(MathFunction fn) {
            math.put(fn.name, fn);
            return this;
        }

        public MatlabBuiltins build() {
            return new MatlabBuiltins(this);
        }
    }

    private static MatlabBuiltins createStandard() {
        Builder b = builder()
                .solver("ode45", "ode23", "ode113", "ode15s", "ode23s", "ode23t", "ode23tb", "ode15i", "lsode")
                .constant("pi", Math.PI)
                .constant("Inf", Double.POSITIVE_INFINITY)
                .constant("inf", Double.POSITIVE_INFINITY)
                .constant("NaN", Double.NaN)
                .constant("nan", Double.NaN)
                .constant("eps", Math.ulp(1.0))
                .constant("true", 1.0)
                .constant("false", 0.0);

        b.math(MathFunction.unary("exp", Math::exp))
                .math(MathFunction.unary("log", Math::log))
                .math(MathFunction.unary("log10", Math::log10))
                .math(MathFunction.unary("log2", x -> Math.log(x) / Math.log(2.0)))
                .math(MathFunction.unary("sqrt", Math::sqrt))
                .math(MathFunction.unary("abs", Math::abs))
                .math(MathFunction.unary("sign", Math::signum))
                .math(MathFunction.unary("sin", Math::sin))
                .math(MathFunction.unary("cos", Math::cos))
                .math(MathFunction.unary("tan", Math::tan))
                .math(MathFunction.unary("asin", Math::asin))
                .math(MathFunction.unary("acos", Math::acos))
                .math(MathFunction.unary("atan", Math::atan))
                .math(MathFunction.unary("sinh", Math::sinh))
                .math(MathFunction.unary("cosh", Math::cosh))
                .math(MathFunction.unary("tanh", Math::tanh))
                .math(MathFunction.unary("floor", Math::floor))
                .math(MathFunction.unary("ceil", Math::ceil))
                .math(MathFunction.unary("round", x -> (x < 0) ? -Math.round(-x) : (double) Math.round(x)))
                .math(MathFunction.unary("fix", MatlabBuiltins::fix))
                .math(MathFunction.binary("power", Math::pow))
                .math(MathFunction.binary("atan2", Math::atan2))
                .math(MathFunction.binary("hypot", Math::hypot))
                .math(MathFunction.binary("mod", (x, y) -> (y == 0) ? x : x - Math.floor(x / y) * y))
                .math(MathFunction.binary("rem", (x, y) -> (y == 0) ? x : x - fix(x / y) * y))
                .math(MathFunction.binary("min", Math::min))
                .math(MathFunction.binary("max", Math::max));

        // array construction, i/o and plotting: calls the translator recognises but never lowers
        b.function("zeros", "ones", "eye", "rand", "randn", "linspace", "logspace", "repmat", "reshape",
                "size", "length", "numel", "ndims", "isempty", "sum", "prod", "cumsum", "diag", "transpose",
                "odeset", "odeget", "feval", "func2str", "str2func", "deal",
                "disp", "display", "fprintf", "printf", "sprintf", "num2str", "str2num", "strcat", "error", "warning",
                "plot", "semilogx", "semilogy", "loglog", "figure", "hold", "xlabel", "ylabel", "zlabel", "title",
                "legend", "subplot", "axis", "grid", "clf", "close", "drawnow", "pause", "print", "saveas",
                "clear", "clc", "format", "tic", "toc", "exist", "isfield", "struct", "cell", "fieldnames",
                "interp1", "fzero", "fsolve", "fminsearch");
        return b.build();
    }

    private static double fix(double x) {
        return (x < 0) ? Math.ceil(x) : Math.floor(x);
    }
}
