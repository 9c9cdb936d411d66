package com.odebridge.model;

import com.odebridge.symbolic.SymExpr;

public final class Rule {

    public enum Type { RATE, ASSIGNMENT }

    public final Type type;
    public final String variable;
    public final SymExpr math;

    public Rule(Type type, String variable, SymExpr math) {
        this.type = type;
        this.variable = variable;
        this.math = math;
    }

    public String formula() {
        return math.toString();
    }

    @Override
    public String toString() {
        return (type == Type.RATE ? "d" + variable + "/dt" : variable) + " = " + formula();
    }
}
