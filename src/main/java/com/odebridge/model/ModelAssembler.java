package com.odebridge.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.odebridge.debug.Debug;
import com.odebridge.extract.OdeSystem;
import com.odebridge.extract.ParameterBinding;
import com.odebridge.inference.InferenceResult;
import com.odebridge.inference.InferredReaction;
import com.odebridge.symbolic.SymExpr;

/**
 * Builds the {@link StructuredModel}: one species per state variable in a single
 * compartment, one parameter per binding, then the rules and reactions. Finishes with a
 * consistency check; a failure there is a bug upstream and raises {@link AssemblyError}.
 */
public final class ModelAssembler {
    private static final String TAG = "odebridge.assembler";

    public static final String DEFAULT_COMPARTMENT = "comp";

    private final String compartmentId;

    public ModelAssembler() {
        this(DEFAULT_COMPARTMENT);
    }

    public ModelAssembler(String compartmentId) {
        if (compartmentId == null || !isIdentifier(compartmentId)) {
            throw new IllegalArgumentException("compartment id must be an identifier, got '" + compartmentId + "'");
        }
        this.compartmentId = compartmentId;
    }

    public StructuredModel assemble(OdeSystem system, InferenceResult inference) {
        String compartment = compartmentId;
        while (system.isState(compartment) || system.parameter(compartment) != null) compartment = compartment + "_";
        List<Compartment> compartments = new ArrayList<>();
        compartments.add(new Compartment(compartment, 1.0));

        List<Species> species = new ArrayList<>();
        for (String s : system.states()) {
            boolean constant = system.derivative(s).isZero();
            species.add(new Species(s, compartment, system.initialValue(s), constant));
        }

        List<Parameter> parameters = new ArrayList<>();
        for (ParameterBinding b : system.parameters().values()) {
            if (b.isUsable()) parameters.add(new Parameter(b.name, b.value));
        }

        List<Rule> rules = new ArrayList<>();
        for (Map.Entry<String, SymExpr> e : inference.assignmentRules().entrySet()) {
            rules.add(new Rule(Rule.Type.ASSIGNMENT, e.getKey(), e.getValue()));
        }
        for (Map.Entry<String, SymExpr> e : inference.rateRules().entrySet()) {
            rules.add(new Rule(Rule.Type.RATE, e.getKey(), e.getValue()));
        }

        List<Reaction> reactions = new ArrayList<>();
        for (InferredReaction r : inference.reactions()) {
            reactions.add(new Reaction(r.id, references(r.reactants), references(r.products),
                    new ArrayList<>(r.modifiers), r.kineticLaw));
        }

        StructuredModel model = new StructuredModel(modelId(system.sourceName), compartments, species, parameters,
                rules, reactions);
        check(model);
        Debug.get().d(TAG, "assembled " + model);
        return model;
    }

    private static List<SpeciesReference> references(Map<String, Double> side) {
        List<SpeciesReference> out = new ArrayList<>(side.size());
        for (Map.Entry<String, Double> e : side.entrySet()) out.add(new SpeciesReference(e.getKey(), e.getValue()));
        return out;
    }

    private void check(StructuredModel model) {
        Map<String, String> ids = new HashMap<>();
        for (Compartment c : model.compartments()) declare(ids, c.id, "compartment");
        for (Species s : model.species()) declare(ids, s.id, "species");
        for (Parameter p : model.parameters()) declare(ids, p.id, "parameter");

        Set<String> speciesIds = new HashSet<>();
        for (Species s : model.species()) speciesIds.add(s.id);

        for (Species s : model.species()) {
            if (s.initialValue != null) referenced(ids, s.initialValue, "initial value of " + s.id);
        }
        for (Parameter p : model.parameters()) referenced(ids, p.value, "parameter " + p.id);

        Set<String> ruled = new HashSet<>();
        for (Rule r : model.rules()) {
            if (!speciesIds.contains(r.variable)) {
                throw new AssemblyError("rule variable '" + r.variable + "' is not a species");
            }
            if (!ruled.add(r.variable)) throw new AssemblyError("species '" + r.variable + "' has more than one rule");
            referenced(ids, r.math, "rule for " + r.variable);
        }
        for (Reaction r : model.reactions()) {
            referenced(ids, r.kineticLaw, "kinetic law of " + r.id);
            List<String> participants = new ArrayList<>(r.modifiers);
            for (SpeciesReference ref : r.reactants) participants.add(ref.species);
            for (SpeciesReference ref : r.products) participants.add(ref.species);
            for (String p : participants) {
                if (!speciesIds.contains(p)) throw new AssemblyError("reaction " + r.id + " refers to unknown species '" + p + "'");
            }
            for (SpeciesReference ref : r.products) {
                if (ruled.contains(ref.species)) {
                    throw new AssemblyError("reaction " + r.id + " changes '" + ref.species + "', which has a rule");
                }
            }
        }
    }

    private static void declare(Map<String, String> ids, String id, String what) {
        String previous = ids.put(id, what);
        if (previous != null) throw new AssemblyError("id '" + id + "' is used by a " + previous + " and a " + what);
    }

    private static void referenced(Map<String, String> ids, SymExpr expr, String where) {
        for (String v : expr.variables()) {
            String what = ids.get(v);
            if (what == null || what.equals("compartment")) {
                throw new AssemblyError(where + " refers to '" + v + "', which is neither a species nor a parameter");
            }
        }
    }

    /** File name without directories and extension, made into an identifier. */
    static String modelId(String sourceName) {
        String name = (sourceName == null) ? "" : sourceName;
        name = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) name = name.substring(0, dot);
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        if (sb.length() == 0) return "model";
        if (!Character.isLetter(sb.charAt(0)) && sb.charAt(0) != '_') sb.insert(0, '_');
        return sb.toString();
    }

    private static boolean isIdentifier(String id) {
        if (id.isEmpty() || !(Character.isLetter(id.charAt(0)) || id.charAt(0) == '_')) return false;
        for (char c : id.toCharArray()) {
            if (!(Character.isLetterOrDigit(c) || c == '_')) return false;
        }
        return true;
    }
}
