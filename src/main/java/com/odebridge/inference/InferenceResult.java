package com.odebridge.inference;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.odebridge.symbolic.SymExpr;

/**
 * Reactions and rules found for one ODE system. Rule maps are keyed by state variable in
 * declaration order.
 */
public final class InferenceResult {
    private final List<InferredReaction> reactions;
    private final Map<String, SymExpr> rateRules;
    private final Map<String, SymExpr> assignmentRules;
    private final List<InferenceDiagnostic> diagnostics;

    InferenceResult(List<InferredReaction> reactions, Map<String, SymExpr> rateRules,
                    Map<String, SymExpr> assignmentRules, List<InferenceDiagnostic> diagnostics) {
        this.reactions = Collections.unmodifiableList(reactions);
        this.rateRules = Collections.unmodifiableMap(rateRules);
        this.assignmentRules = Collections.unmodifiableMap(assignmentRules);
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public List<InferredReaction> reactions() { return reactions; }

    public Map<String, SymExpr> rateRules() { return rateRules; }

    public Set<String> rateRuleSpecies() { return rateRules.keySet(); }

    public Map<String, SymExpr> assignmentRules() { return assignmentRules; }

    public List<InferenceDiagnostic> diagnostics() { return diagnostics; }
}
