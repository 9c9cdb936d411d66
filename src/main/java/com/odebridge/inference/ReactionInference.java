package com.odebridge.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.odebridge.Diagnostic.Severity;
import com.odebridge.debug.Debug;
import com.odebridge.extract.OdeSystem;
import com.odebridge.symbolic.SymExpr;

/**
 * Decomposes the derivatives of an {@link OdeSystem} into reactions.
 *
 * Every derivative is expanded into signed monomials. Walking the state variables in
 * declaration order, a term is paired with the first unused term of another state
 * variable that has the same monomial, the opposite sign and the same magnitude; further
 * same-monomial terms of equal magnitude join the group. Unpaired terms become one-species
 * reactions when that is chemically meaningful: a negative term must contain its own
 * species. A state variable that cannot be covered by reactions becomes a rate rule, and
 * since that removes its terms from every grouping the matching is repeated until no new
 * rate rule appears.
 *
 * Runs are deterministic: the same system always yields the same reactions in the same
 * order.
 */
public final class ReactionInference {
    private static final String TAG = "odebridge.inference";
    private static final int MAX_EXPANDED_POWER = 8;

    private final InferenceOptions options;

    public ReactionInference() {
        this(InferenceOptions.defaults());
    }

    public ReactionInference(InferenceOptions options) {
        if (options == null) throw new IllegalArgumentException("options must not be null");
        this.options = options;
    }

    public InferenceResult infer(OdeSystem system) {
        Debug.get().d(TAG, "inferring reactions for " + system.stateCount() + " state variable(s), " + options);
        Set<String> states = new HashSet<>(system.states());
        List<InferenceDiagnostic> diagnostics = new ArrayList<>();
        Map<String, SymExpr> assignmentRules = new LinkedHashMap<>();
        Set<String> ruled = new LinkedHashSet<>();
        Map<String, List<Term>> terms = new LinkedHashMap<>();

        for (String s : system.states()) {
            SymExpr d = system.derivative(s);
            if (d.kind() == SymExpr.Kind.TIME) {
                assignmentRules.put(s, d);
                diagnostics.add(diagnostic(Severity.INFO, InferenceDiagnostic.TIME_DERIVATIVE,
                        "d" + s + "/dt is the time itself; emitted as an assignment rule", s));
                continue;
            }
            if (d.isZero()) continue;
            if (!options.inferReactions) {
                ruled.add(s);
                continue;
            }
            List<Term> expanded = expand(d, states);
            if (expanded == null) {
                ruled.add(s);
                diagnostics.add(diagnostic(Severity.INFO, InferenceDiagnostic.NON_POLYNOMIAL,
                        "d" + s + "/dt = " + d + " is not a polynomial in the state variables; emitted as a rate rule", s));
                continue;
            }
            if (!expanded.isEmpty()) terms.put(s, expanded);
        }

        Matching matching;
        int round = 0;
        while (true) {
            round++;
            Set<String> fixed = new LinkedHashSet<>(assignmentRules.keySet());
            fixed.addAll(ruled);
            matching = new Matching(system.states(), terms, fixed);
            matching.run();
            if (matching.invalid.isEmpty()) break;
            for (Map.Entry<String, String> e : matching.invalid.entrySet()) {
                ruled.add(e.getKey());
                terms.remove(e.getKey());
                diagnostics.add(diagnostic(Severity.INFO, InferenceDiagnostic.UNREPRESENTABLE_TERM, e.getValue(), e.getKey()));
            }
        }
        diagnostics.addAll(matching.diagnostics);

        Map<String, SymExpr> rateRules = new LinkedHashMap<>();
        for (String s : system.states()) {
            if (ruled.contains(s)) rateRules.put(s, system.derivative(s));
        }
        Debug.get().d(TAG, matching.reactions.size() + " reaction(s), " + rateRules.size() + " rate rule(s), "
                + assignmentRules.size() + " assignment rule(s) after " + round + " round(s)");
        return new InferenceResult(matching.reactions, rateRules, assignmentRules, diagnostics);
    }

    // -------------------------
    // Polynomial expansion
    // -------------------------

    /** Signed monomials of expr in the state variables, or null when expr is not a polynomial in them. */
    static List<Term> expand(SymExpr expr, Set<String> states) {
        switch (expr.kind()) {
            case CONSTANT: {
                List<Term> out = new ArrayList<>();
                if (!expr.isZero()) out.add(Term.constant(expr.value()));
                return out;
            }
            case VARIABLE:
                return Collections.singletonList(states.contains(expr.name())
                        ? Term.species(expr.name(), 1)
                        : Term.factor(expr));
            case TIME:
                return Collections.singletonList(Term.factor(expr));
            case NEGATION: {
                List<Term> inner = expand(expr.operand(), states);
                if (inner == null) return null;
                List<Term> out = new ArrayList<>(inner.size());
                for (Term t : inner) out.add(t.negate());
                return out;
            }
            case SUM: {
                List<Term> out = new ArrayList<>();
                for (SymExpr a : expr.args()) {
                    List<Term> part = expand(a, states);
                    if (part == null) return null;
                    out.addAll(part);
                }
                return combine(out);
            }
            case PRODUCT: {
                List<Term> acc = Collections.singletonList(Term.constant(1.0));
                for (SymExpr a : expr.args()) {
                    List<Term> part = expand(a, states);
                    if (part == null) return null;
                    acc = multiply(acc, part);
                }
                return acc;
            }
            case POWER:
                return expandPower(expr, states);
            case FUNCTION:
                return mentions(expr, states) ? null : Collections.singletonList(Term.factor(expr));
            default:
                return null;
        }
    }

    private static List<Term> expandPower(SymExpr expr, Set<String> states) {
        if (!mentions(expr, states)) return Collections.singletonList(Term.factor(expr));
        Double e = expr.exponent().constantValue();
        if (e == null || e < 0 || e != Math.rint(e)) return null;
        int n = e.intValue();
        SymExpr base = expr.base();
        if (base.kind() == SymExpr.Kind.VARIABLE) return Collections.singletonList(Term.species(base.name(), n));
        if (n > MAX_EXPANDED_POWER) return null;
        List<Term> inner = expand(base, states);
        if (inner == null) return null;
        List<Term> acc = Collections.singletonList(Term.constant(1.0));
        for (int i = 0; i < n; i++) acc = multiply(acc, inner);
        return acc;
    }

    private static List<Term> multiply(List<Term> left, List<Term> right) {
        List<Term> out = new ArrayList<>(left.size() * right.size());
        for (Term l : left) {
            for (Term r : right) out.add(l.times(r));
        }
        return combine(out);
    }

    // like monomials are merged into the first one's slot; cancelled terms disappear
    private static List<Term> combine(List<Term> terms) {
        List<Term> out = new ArrayList<>(terms.size());
        for (Term t : terms) {
            boolean merged = false;
            for (int i = 0; i < out.size(); i++) {
                if (out.get(i).sameMonomial(t)) {
                    out.set(i, out.get(i).withCoefficient(out.get(i).coefficient + t.coefficient));
                    merged = true;
                    break;
                }
            }
            if (!merged) out.add(t);
        }
        out.removeIf(t -> t.coefficient == 0.0);
        return out;
    }

    private static boolean mentions(SymExpr expr, Set<String> states) {
        for (String v : expr.variables()) {
            if (states.contains(v)) return true;
        }
        return false;
    }

    private static InferenceDiagnostic diagnostic(Severity severity, String code, String message, String... species) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, species);
        InferenceDiagnostic d = new InferenceDiagnostic(severity, code, message, list);
        if (severity == Severity.WARNING) Debug.get().w(TAG, d.toString());
        else Debug.get().d(TAG, d.toString());
        return d;
    }

    // -------------------------
    // Term matching
    // -------------------------

    private static final class Entry {
        final String owner;
        final Term term;
        boolean used;

        Entry(String owner, Term term) {
            this.owner = owner;
            this.term = term;
        }

        boolean consumesOwner() {
            return term.coefficient > 0 || term.exponentOf(owner) > 0;
        }
    }

    /** One pass over the current term pool. Species governed by a rule are fixed: never reactants or products. */
    private final class Matching {
        final List<InferredReaction> reactions = new ArrayList<>();
        final List<InferenceDiagnostic> diagnostics = new ArrayList<>();
        final Map<String, String> invalid = new LinkedHashMap<>();

        private final Set<String> ruled;
        private final List<List<Entry>> pool = new ArrayList<>();

        Matching(List<String> order, Map<String, List<Term>> terms, Set<String> ruled) {
            this.ruled = ruled;
            for (String s : order) {
                List<Term> list = terms.get(s);
                if (list == null) continue;
                List<Entry> entries = new ArrayList<>(list.size());
                for (Term t : list) entries.add(new Entry(s, t));
                pool.add(entries);
            }
        }

        void run() {
            for (List<Entry> entries : pool) {
                for (Entry e : entries) {
                    if (!e.used) seed(e);
                }
            }
        }

        private void seed(Entry e) {
            e.used = true;
            if (!e.consumesOwner()) {
                single(e, false);
                return;
            }
            Entry partner = null;
            Entry mismatch = null;
            search:
            for (List<Entry> entries : pool) {
                if (entries.get(0).owner.equals(e.owner)) continue;
                for (Entry f : entries) {
                    if (f.used || !f.term.sameMonomial(e.term) || !f.consumesOwner()) continue;
                    if ((f.term.coefficient > 0) == (e.term.coefficient > 0)) continue;
                    if (options.sameMagnitude(f.term.coefficient, e.term.coefficient)) {
                        partner = f;
                        break search;
                    }
                    if (mismatch == null) mismatch = f;
                }
            }

            if (partner != null) {
                partner.used = true;
                List<Entry> group = new ArrayList<>();
                group.add(e);
                group.add(partner);
                absorb(group);
                reactions.add(reaction(group, false));
            } else if (mismatch != null) {
                mismatch.used = true;
                diagnostics.add(diagnostic(Severity.WARNING, InferenceDiagnostic.COEFFICIENT_MISMATCH,
                        "terms " + e.term + " of d" + e.owner + "/dt and " + mismatch.term + " of d" + mismatch.owner
                                + "/dt share a monomial but not a coefficient magnitude; emitted as separate reactions",
                        e.owner, mismatch.owner));
                single(e, true);
                single(mismatch, true);
            } else {
                single(e, false);
            }
        }

        // one more member per state variable that is not yet in the group
        private void absorb(List<Entry> group) {
            Term seed = group.get(0).term;
            for (List<Entry> entries : pool) {
                String owner = entries.get(0).owner;
                boolean present = false;
                for (Entry g : group) present |= g.owner.equals(owner);
                if (present) continue;
                for (Entry f : entries) {
                    if (f.used || !f.term.sameMonomial(seed) || !f.consumesOwner()) continue;
                    if (!options.sameMagnitude(f.term.coefficient, seed.coefficient)) continue;
                    f.used = true;
                    group.add(f);
                    break;
                }
            }
        }

        private void single(Entry e, boolean fromMismatch) {
            String reason = null;
            if (!e.consumesOwner()) {
                reason = "term " + e.term + " of d" + e.owner + "/dt consumes " + e.owner
                        + " at a rate that does not depend on it";
            } else {
                for (String sp : e.term.speciesNames()) {
                    if (ruled.contains(sp)) {
                        reason = "term " + e.term + " of d" + e.owner + "/dt depends on " + sp
                                + ", which is governed by a rule";
                        break;
                    }
                }
            }
            if (reason != null) {
                invalid.putIfAbsent(e.owner, reason + "; " + e.owner + " emitted as a rate rule");
                return;
            }
            List<Entry> group = new ArrayList<>();
            group.add(e);
            reactions.add(reaction(group, fromMismatch));
        }

        private InferredReaction reaction(List<Entry> group, boolean fromMismatch) {
            Term t = group.get(0).term;
            boolean bare = t.isPureConstant();
            SymExpr law = bare ? SymExpr.constant(Math.abs(t.coefficient)) : t.monomial();

            Map<String, Double> reactants = new LinkedHashMap<>();
            Map<String, Double> products = new LinkedHashMap<>();
            List<String> modifiers = new ArrayList<>();
            for (Map.Entry<String, Integer> sp : t.species().entrySet()) {
                if (ruled.contains(sp.getKey())) {
                    modifiers.add(sp.getKey());
                } else {
                    reactants.put(sp.getKey(), (double) sp.getValue());
                    products.put(sp.getKey(), (double) sp.getValue());
                }
            }
            for (Entry m : group) {
                double delta = bare ? Math.signum(m.term.coefficient) : m.term.coefficient;
                double in = Math.max(reactants.getOrDefault(m.owner, 0.0), -delta);
                reactants.put(m.owner, in);
                products.put(m.owner, in + delta);
            }
            reactants.values().removeIf(v -> v == 0.0);
            products.values().removeIf(v -> v == 0.0);

            String id = "r" + (reactions.size() + 1);
            InferredReaction r = new InferredReaction(id, reactants, products, modifiers, law, fromMismatch);
            Debug.get().t(TAG, r.toString());
            return r;
        }
    }
}
