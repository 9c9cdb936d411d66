package com.odebridge.model;

import java.util.Collections;
import java.util.List;

import com.odebridge.symbolic.SymExpr;

/** An irreversible reaction with its kinetic law. */
public final class Reaction {
    public final String id;
    public final boolean reversible = false;
    public final List<SpeciesReference> reactants;
    public final List<SpeciesReference> products;
    public final List<String> modifiers;
    public final SymExpr kineticLaw;

    public Reaction(String id, List<SpeciesReference> reactants, List<SpeciesReference> products,
                    List<String> modifiers, SymExpr kineticLaw) {
        this.id = id;
        this.reactants = Collections.unmodifiableList(reactants);
        this.products = Collections.unmodifiableList(products);
        this.modifiers = Collections.unmodifiableList(modifiers);
        this.kineticLaw = kineticLaw;
    }

    public String formula() {
        return kineticLaw.toString();
    }

    @Override
    public String toString() {
        return id + ": " + reactants + " -> " + products + " ; " + formula();
    }
}
