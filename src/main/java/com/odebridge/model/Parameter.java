package com.odebridge.model;

import com.odebridge.symbolic.SymExpr;

/**
 * A bound name. Constant parameters carry a number; computed ones an expression over
 * other parameters.
 */
public final class Parameter {
    public final String id;
    public final SymExpr value;

    public Parameter(String id, SymExpr value) {
        this.id = id;
        this.value = value;
    }

    public boolean isComputed() {
        return !value.isConstant();
    }

    /** The numeric value, or null for a computed parameter. */
    public Double numericValue() {
        return value.constantValue();
    }

    @Override
    public String toString() {
        return "Parameter{" + id + " = " + value + "}";
    }
}
