package com.odebridge.model;

import java.util.Collections;
import java.util.List;

/**
 * The assembled model handed to exporters. Species and parameter ids are disjoint and
 * cover every name used by a rule, a reaction or an initial value.
 */
public final class StructuredModel {
    public final String id;
    private final List<Compartment> compartments;
    private final List<Species> species;
    private final List<Parameter> parameters;
    private final List<Rule> rules;
    private final List<Reaction> reactions;

    StructuredModel(String id, List<Compartment> compartments, List<Species> species, List<Parameter> parameters,
                    List<Rule> rules, List<Reaction> reactions) {
        this.id = id;
        this.compartments = Collections.unmodifiableList(compartments);
        this.species = Collections.unmodifiableList(species);
        this.parameters = Collections.unmodifiableList(parameters);
        this.rules = Collections.unmodifiableList(rules);
        this.reactions = Collections.unmodifiableList(reactions);
    }

    public List<Compartment> compartments() { return compartments; }

    public List<Species> species() { return species; }

    public List<Parameter> parameters() { return parameters; }

    public List<Rule> rules() { return rules; }

    public List<Reaction> reactions() { return reactions; }

    public Species species(String id) {
        for (Species s : species) {
            if (s.id.equals(id)) return s;
        }
        return null;
    }

    public Parameter parameter(String id) {
        for (Parameter p : parameters) {
            if (p.id.equals(id)) return p;
        }
        return null;
    }

    /** Rule for a variable, or null. */
    public Rule rule(String variable) {
        for (Rule r : rules) {
            if (r.variable.equals(variable)) return r;
        }
        return null;
    }

    public Reaction reaction(String id) {
        for (Reaction r : reactions) {
            if (r.id.equals(id)) return r;
        }
        return null;
    }

    @Override
    public String toString() {
        return "StructuredModel{" + id + ": " + species.size() + " species, " + parameters.size() + " parameters, "
                + rules.size() + " rules, " + reactions.size() + " reactions}";
    }
}
