package com.odebridge.model;

import com.odebridge.symbolic.SymExpr;

/**
 * One state variable. A species whose derivative is identically zero is a boundary
 * species that nothing changes.
 */
public final class Species {
    public final String id;
    public final String compartment;
    public final SymExpr initialValue;      // may be null
    public final boolean boundaryCondition;
    public final boolean constant;

    public Species(String id, String compartment, SymExpr initialValue, boolean constant) {
        this.id = id;
        this.compartment = compartment;
        this.initialValue = initialValue;
        this.boundaryCondition = constant;
        this.constant = constant;
    }

    /** Numeric initial concentration, or null when the initial value is an expression or missing. */
    public Double initialConcentration() {
        return (initialValue == null) ? null : initialValue.constantValue();
    }

    @Override
    public String toString() {
        return "Species{" + id + " in " + compartment + ", initial=" + initialValue + "}";
    }
}
