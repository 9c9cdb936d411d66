package com.odebridge.symbolic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable algebraic expression over constants, named variables, the time symbol and
 * function applications.
 *
 * Nodes are built only through the static factories, which flatten nested sums and
 * products and fold constants, so two expressions that print the same compare equal.
 * Equality is structural and order sensitive.
 */
public final class SymExpr {

    public enum Kind {
        CONSTANT,
        VARIABLE,
        TIME,
        SUM,
        PRODUCT,
        POWER,
        NEGATION,
        FUNCTION
    }

    public static final SymExpr ZERO = new SymExpr(Kind.CONSTANT, 0.0, null, Collections.emptyList());
    public static final SymExpr ONE = new SymExpr(Kind.CONSTANT, 1.0, null, Collections.emptyList());
    public static final SymExpr TIME = new SymExpr(Kind.TIME, 0.0, null, Collections.emptyList());

    private final Kind kind;
    private final double value;          // CONSTANT
    private final String name;           // VARIABLE, FUNCTION
    private final List<SymExpr> args;    // SUM/PRODUCT operands, POWER [base, exponent], NEGATION [operand], FUNCTION arguments

    private SymExpr(Kind kind, double value, String name, List<SymExpr> args) {
        this.kind = kind;
        this.value = value;
        this.name = name;
        this.args = args;
    }

    // -------------------------
    // Factories
    // -------------------------

    public static SymExpr constant(double value) {
        if (value == 0.0) return ZERO; // also maps -0.0
        if (value == 1.0) return ONE;
        return new SymExpr(Kind.CONSTANT, value, null, Collections.emptyList());
    }

    public static SymExpr variable(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("variable name must not be empty");
        return new SymExpr(Kind.VARIABLE, 0.0, name, Collections.emptyList());
    }

    public static SymExpr time() {
        return TIME;
    }

    public static SymExpr sum(SymExpr... operands) {
        List<SymExpr> list = new ArrayList<>();
        Collections.addAll(list, operands);
        return sum(list);
    }

    /** Flattens nested sums and folds constants into one operand, kept where the first constant was. */
    public static SymExpr sum(List<SymExpr> operands) {
        List<SymExpr> out = new ArrayList<>();
        double folded = 0.0;
        int constantSlot = -1;
        for (SymExpr op : flatten(Kind.SUM, operands)) {
            Double c = op.constantValue();
            if (c != null) {
                if (constantSlot < 0) {
                    constantSlot = out.size();
                    out.add(null);
                }
                folded += c;
            } else {
                out.add(op);
            }
        }
        if (constantSlot >= 0) {
            if (folded == 0.0 && out.size() > 1) out.remove(constantSlot);
            else out.set(constantSlot, constant(folded));
        }
        if (out.isEmpty()) return ZERO;
        if (out.size() == 1) return out.get(0);
        return new SymExpr(Kind.SUM, 0.0, null, Collections.unmodifiableList(out));
    }

    public static SymExpr product(SymExpr... operands) {
        List<SymExpr> list = new ArrayList<>();
        Collections.addAll(list, operands);
        return product(list);
    }

    /**
     * Flattens nested products, folds constants into a leading coefficient and pulls
     * negations out: product(-a, b) is -(a*b).
     */
    public static SymExpr product(List<SymExpr> operands) {
        List<SymExpr> out = new ArrayList<>();
        double coefficient = 1.0;
        for (SymExpr op : flatten(Kind.PRODUCT, operands)) {
            while (op.kind == Kind.NEGATION) {
                coefficient = -coefficient;
                op = op.args.get(0);
            }
            Double c = op.constantValue();
            if (c != null) {
                coefficient *= c;
            } else if (op.kind == Kind.PRODUCT) {
                // a pulled-out negation exposed another product
                for (SymExpr inner : op.args) {
                    Double ic = inner.constantValue();
                    if (ic != null) coefficient *= ic;
                    else out.add(inner);
                }
            } else {
                out.add(op);
            }
        }
        if (coefficient == 0.0) return ZERO;
        if (out.isEmpty()) return constant(coefficient);
        boolean negative = coefficient < 0;
        double magnitude = Math.abs(coefficient);
        if (magnitude != 1.0) out.add(0, constant(magnitude));
        SymExpr body = (out.size() == 1) ? out.get(0) : new SymExpr(Kind.PRODUCT, 0.0, null, Collections.unmodifiableList(out));
        return negative ? negate(body) : body;
    }

    public static SymExpr power(SymExpr base, SymExpr exponent) {
        Double b = base.constantValue();
        Double e = exponent.constantValue();
        if (b != null && e != null) return constant(Math.pow(b, e));
        if (e != null) {
            if (e == 0.0) return ONE;
            if (e == 1.0) return base;
        }
        if (b != null && b == 1.0) return ONE;
        List<SymExpr> pair = new ArrayList<>(2);
        pair.add(base);
        pair.add(exponent);
        return new SymExpr(Kind.POWER, 0.0, null, Collections.unmodifiableList(pair));
    }

    public static SymExpr negate(SymExpr operand) {
        Double c = operand.constantValue();
        if (c != null) return constant(-c);
        if (operand.kind == Kind.NEGATION) return operand.args.get(0);
        return new SymExpr(Kind.NEGATION, 0.0, null, Collections.singletonList(operand));
    }

    public static SymExpr subtract(SymExpr left, SymExpr right) {
        return sum(left, negate(right));
    }

    /** a / b as a * b^-1. */
    public static SymExpr divide(SymExpr left, SymExpr right) {
        Double r = right.constantValue();
        if (r != null && r != 0.0) return product(left, constant(1.0 / r));
        return product(left, power(right, constant(-1.0)));
    }

    public static SymExpr function(String name, List<SymExpr> arguments) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("function name must not be empty");
        return new SymExpr(Kind.FUNCTION, 0.0, name, Collections.unmodifiableList(new ArrayList<>(arguments)));
    }

    private static List<SymExpr> flatten(Kind kind, List<SymExpr> operands) {
        List<SymExpr> out = new ArrayList<>();
        for (SymExpr op : operands) {
            Objects.requireNonNull(op, "operand");
            if (op.kind == kind) out.addAll(op.args);
            else out.add(op);
        }
        return out;
    }

    // -------------------------
    // Accessors
    // -------------------------

    public Kind kind() { return kind; }

    /** Constant value; only meaningful for CONSTANT. */
    public double value() { return value; }

    /** Variable or function name, null for other kinds. */
    public String name() { return name; }

    public List<SymExpr> args() { return args; }

    public boolean isConstant() { return kind == Kind.CONSTANT; }

    public boolean isZero() { return kind == Kind.CONSTANT && value == 0.0; }

    /** Value when this is a constant, null otherwise. */
    public Double constantValue() {
        return (kind == Kind.CONSTANT) ? value : null;
    }

    public SymExpr base() { return requireKind(Kind.POWER).args.get(0); }

    public SymExpr exponent() { return requireKind(Kind.POWER).args.get(1); }

    public SymExpr operand() { return requireKind(Kind.NEGATION).args.get(0); }

    /** Names of every variable occurring in this expression, in first-occurrence order. */
    public Set<String> variables() {
        Set<String> out = new LinkedHashSet<>();
        collectVariables(out);
        return out;
    }

    private void collectVariables(Set<String> out) {
        if (kind == Kind.VARIABLE) out.add(name);
        for (SymExpr a : args) a.collectVariables(out);
    }

    public boolean containsTime() {
        if (kind == Kind.TIME) return true;
        for (SymExpr a : args) {
            if (a.containsTime()) return true;
        }
        return false;
    }

    /** Replaces variables by the mapped expressions and renormalizes. Unmapped variables stay. */
    public SymExpr substitute(Map<String, SymExpr> bindings) {
        switch (kind) {
            case CONSTANT:
            case TIME:
                return this;
            case VARIABLE: {
                SymExpr bound = bindings.get(name);
                return (bound == null) ? this : bound;
            }
            case SUM:
                return sum(substituteAll(bindings));
            case PRODUCT:
                return product(substituteAll(bindings));
            case POWER:
                return power(args.get(0).substitute(bindings), args.get(1).substitute(bindings));
            case NEGATION:
                return negate(args.get(0).substitute(bindings));
            case FUNCTION:
                return function(name, substituteAll(bindings));
            default:
                throw new IllegalStateException("unhandled kind " + kind);
        }
    }

    private List<SymExpr> substituteAll(Map<String, SymExpr> bindings) {
        List<SymExpr> out = new ArrayList<>(args.size());
        for (SymExpr a : args) out.add(a.substitute(bindings));
        return out;
    }

    private SymExpr requireKind(Kind expected) {
        if (kind != expected) throw new IllegalStateException("expected " + expected + " but was " + kind);
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymExpr)) return false;
        SymExpr other = (SymExpr) o;
        return kind == other.kind
                && Double.compare(value, other.value) == 0
                && Objects.equals(name, other.name)
                && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, name, args);
    }

    @Override
    public String toString() {
        return SymFormula.format(this);
    }
}
