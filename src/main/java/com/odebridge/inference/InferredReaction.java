package com.odebridge.inference;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.odebridge.symbolic.SymExpr;
import com.odebridge.symbolic.SymFormula;

/**
 * A reaction found in the derivative terms. Reactant and product maps are keyed by
 * species in insertion order; a species on both sides is a catalyst.
 */
public final class InferredReaction {
    public final String id;
    public final Map<String, Double> reactants;
    public final Map<String, Double> products;
    public final List<String> modifiers;
    public final SymExpr kineticLaw;
    public final boolean fromMismatch;   // split off a pairing whose coefficients disagreed

    InferredReaction(String id, Map<String, Double> reactants, Map<String, Double> products,
                     List<String> modifiers, SymExpr kineticLaw, boolean fromMismatch) {
        this.id = id;
        this.reactants = Collections.unmodifiableMap(reactants);
        this.products = Collections.unmodifiableMap(products);
        this.modifiers = Collections.unmodifiableList(modifiers);
        this.kineticLaw = kineticLaw;
        this.fromMismatch = fromMismatch;
    }

    /** Product minus reactant stoichiometry of a species. */
    public double netChange(String species) {
        return products.getOrDefault(species, 0.0) - reactants.getOrDefault(species, 0.0);
    }

    @Override
    public String toString() {
        return id + ": " + side(reactants) + " -> " + side(products) + " ; " + kineticLaw;
    }

    private static String side(Map<String, Double> side) {
        if (side.isEmpty()) return "0";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Double> e : side.entrySet()) {
            if (sb.length() > 0) sb.append(" + ");
            if (e.getValue() != 1.0) sb.append(SymFormula.number(e.getValue())).append(' ');
            sb.append(e.getKey());
        }
        return sb.toString();
    }
}
