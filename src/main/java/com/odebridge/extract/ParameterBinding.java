package com.odebridge.extract;

import com.odebridge.matlab.parser.SourcePosition;
import com.odebridge.symbolic.SymExpr;

/**
 * name = value, as seen by the extractor. A binding whose right-hand side could not be
 * turned into an expression (a string, an options struct, a time span vector) is kept
 * with the reason, so a later reference can report why the name has no value.
 */
public final class ParameterBinding {
    public final String name;
    public final SymExpr value;      // null when unusable
    public final SourcePosition position;
    public final String unusableReason;

    private ParameterBinding(String name, SymExpr value, SourcePosition position, String unusableReason) {
        this.name = name;
        this.value = value;
        this.position = position;
        this.unusableReason = unusableReason;
    }

    public static ParameterBinding of(String name, SymExpr value, SourcePosition position) {
        if (value == null) throw new IllegalArgumentException("value must not be null for " + name);
        return new ParameterBinding(name, value, position, null);
    }

    public static ParameterBinding unusable(String name, SourcePosition position, String reason) {
        return new ParameterBinding(name, null, position, reason);
    }

    public boolean isUsable() { return value != null; }

    /** A numeric constant, as opposed to an expression over other parameters. */
    public boolean isConstant() { return value != null && value.isConstant(); }

    @Override
    public String toString() {
        return name + " = " + (isUsable() ? value.toString() : "<" + unusableReason + ">");
    }
}
