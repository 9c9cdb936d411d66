package com.odebridge.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.odebridge.Diagnostic;
import com.odebridge.symbolic.SymExpr;

/**
 * The extracted system: state variables in declaration order with their derivative and
 * initial value, plus the parameter bindings the expressions refer to.
 *
 * Every variable in a derivative, initial value or parameter expression is a state or a
 * usable parameter; construction fails otherwise.
 */
public final class OdeSystem {
    public final String sourceName;
    public final String solver;        // null when built by hand
    public final String functionName;  // null when built by hand

    private final List<String> states;
    private final Map<String, SymExpr> derivatives;
    private final Map<String, SymExpr> initialValues;
    private final Map<String, ParameterBinding> parameters;
    private final List<Diagnostic> diagnostics;

    OdeSystem(String sourceName, String solver, String functionName, List<String> states,
              Map<String, SymExpr> derivatives, Map<String, SymExpr> initialValues,
              Map<String, ParameterBinding> parameters, List<Diagnostic> diagnostics) {
        this.sourceName = sourceName;
        this.solver = solver;
        this.functionName = functionName;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.derivatives = Collections.unmodifiableMap(new LinkedHashMap<>(derivatives));
        this.initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        validate();
    }

    public static Builder builder(String sourceName) {
        return new Builder(sourceName);
    }

    public List<String> states() { return states; }

    public int stateCount() { return states.size(); }

    public boolean isState(String name) { return derivatives.containsKey(name); }

    public SymExpr derivative(String state) { return derivatives.get(state); }

    public Map<String, SymExpr> derivatives() { return derivatives; }

    /** Initial value of a state, or null when none was given. */
    public SymExpr initialValue(String state) { return initialValues.get(state); }

    public Map<String, SymExpr> initialValues() { return initialValues; }

    public Map<String, ParameterBinding> parameters() { return parameters; }

    public ParameterBinding parameter(String name) { return parameters.get(name); }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    private void validate() {
        if (states.size() != derivatives.size()) {
            throw new IllegalArgumentException("state names must be unique: " + states);
        }
        for (Map.Entry<String, SymExpr> e : derivatives.entrySet()) {
            checkBound("d" + e.getKey() + "/dt", e.getValue().variables());
        }
        for (Map.Entry<String, SymExpr> e : initialValues.entrySet()) {
            if (!isState(e.getKey())) throw new IllegalArgumentException("initial value for unknown state " + e.getKey());
            checkBound("initial value of " + e.getKey(), e.getValue().variables());
        }
        for (ParameterBinding p : parameters.values()) {
            if (isState(p.name)) throw new IllegalArgumentException("'" + p.name + "' is both a state and a parameter");
            if (p.isUsable()) checkBound("parameter " + p.name, p.value.variables());
        }
    }

    private void checkBound(String where, Set<String> names) {
        for (String n : names) {
            if (isState(n)) continue;
            ParameterBinding p = parameters.get(n);
            if (p == null || !p.isUsable()) {
                throw new IllegalArgumentException(where + " refers to unbound identifier '" + n + "'");
            }
        }
    }

    /** Hand assembly of a system, mainly for callers that do not start from MATLAB text. */
    public static final class Builder {
        private final String sourceName;
        private final List<String> states = new ArrayList<>();
        private final Map<String, SymExpr> derivatives = new LinkedHashMap<>();
        private final Map<String, SymExpr> initialValues = new LinkedHashMap<>();
        private final Map<String, ParameterBinding> parameters = new LinkedHashMap<>();

        private Builder(String sourceName) {
            this.sourceName = sourceName;
        }

        public Builder state(String name, SymExpr derivative, double initialValue) {
            return state(name, derivative, SymExpr.constant(initialValue));
        }

        public Builder state(String name, SymExpr derivative, SymExpr initialValue) {
            states.add(name);
            derivatives.put(name, derivative);
            if (initialValue != null) initialValues.put(name, initialValue);
            return this;
        }

        public Builder parameter(String name, double value) {
            return parameter(name, SymExpr.constant(value));
        }

        public Builder parameter(String name, SymExpr value) {
            parameters.put(name, ParameterBinding.of(name, value, null));
            return this;
        }

        public OdeSystem build() {
            return new OdeSystem(sourceName, null, null, states, derivatives, initialValues, parameters,
                    Collections.emptyList());
        }
    }
}
