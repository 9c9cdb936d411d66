package com.odebridge.extract;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.odebridge.Diagnostic;
import com.odebridge.Stage;
import com.odebridge.debug.Debug;
import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.parser.CallKind;
import com.odebridge.matlab.parser.Expr.Binary;
import com.odebridge.matlab.parser.Expr.CellIndex;
import com.odebridge.matlab.parser.Expr.Colon;
import com.odebridge.matlab.parser.Expr.EndIndex;
import com.odebridge.matlab.parser.Expr.ExprInterface;
import com.odebridge.matlab.parser.Expr.ExprVisitor;
import com.odebridge.matlab.parser.Expr.FieldAccess;
import com.odebridge.matlab.parser.Expr.FunctionHandle;
import com.odebridge.matlab.parser.Expr.Identifier;
import com.odebridge.matlab.parser.Expr.IndexOrCall;
import com.odebridge.matlab.parser.Expr.MatrixLiteral;
import com.odebridge.matlab.parser.Expr.NumberLiteral;
import com.odebridge.matlab.parser.Expr.Range;
import com.odebridge.matlab.parser.Expr.SolverCall;
import com.odebridge.matlab.parser.Expr.StringLiteral;
import com.odebridge.matlab.parser.Expr.Unary;
import com.odebridge.matlab.parser.ParsedScript;
import com.odebridge.matlab.parser.SourcePosition;
import com.odebridge.matlab.parser.Statement.Assignment;
import com.odebridge.matlab.parser.Statement.Clause;
import com.odebridge.matlab.parser.Statement.ControlStmt;
import com.odebridge.matlab.parser.Statement.DeclarationStmt;
import com.odebridge.matlab.parser.Statement.ExprStmt;
import com.odebridge.matlab.parser.Statement.FunctionDef;
import com.odebridge.matlab.parser.Statement.KeywordStmt;
import com.odebridge.matlab.parser.Statement.Stmt;
import com.odebridge.matlab.parser.TokenType;
import com.odebridge.symbolic.SymExpr;

/**
 * Finds the ODE model in a parsed script.
 *
 * The solver call (ode45 and friends) names the right-hand-side function and the initial
 * condition. The initial condition fixes the number of states; the function's second
 * formal is the state vector and its first output holds the derivatives. Plain
 * assignments that precede the solver call in the same statement list are the parameter
 * bindings.
 *
 * Instances hold no per-script state and may be shared.
 */
public final class ModelExtractor {
    private static final String TAG = "odebridge.extract";

    public static final String MULTIPLE_SOLVER_CALLS = "MULTIPLE_SOLVER_CALLS";
    public static final String SHADOWED_BINDING = "SHADOWED_BINDING";
    public static final String IGNORED_STATEMENT = "IGNORED_STATEMENT";
    public static final String TOP_LEVEL_CONTROL_FLOW = "TOP_LEVEL_CONTROL_FLOW";
    public static final String UNSUPPORTED_CONSTRUCT = "UNSUPPORTED_CONSTRUCT";
    public static final String UNASSIGNED_DERIVATIVE = "UNASSIGNED_DERIVATIVE";
    public static final String UNUSED_ARGUMENT = "UNUSED_ARGUMENT";

    private final MatlabBuiltins builtins;
    private final boolean strict;

    public ModelExtractor(MatlabBuiltins builtins, boolean strict) {
        this.builtins = builtins;
        this.strict = strict;
    }

    public OdeSystem extract(ParsedScript script) {
        if (script.hasErrors()) {
            throw new IllegalArgumentException("script has " + script.errors().size() + " parse error(s)");
        }
        return new Run(script).extract();
    }

    /** Where a solver call sits: the statement list holding it and the statement's index there. */
    private static final class Site {
        final SolverCall call;
        final List<Stmt> holder;
        final int index;

        Site(SolverCall call, List<Stmt> holder, int index) {
            this.call = call;
            this.holder = holder;
            this.index = index;
        }
    }

    /** The right-hand-side function and how the solver feeds it. */
    private static final class Target {
        final FunctionDef function;
        final int timeIndex;
        final int stateIndex;
        final Map<Integer, ExprInterface> extraArgs = new LinkedHashMap<>();

        Target(FunctionDef function, int timeIndex, int stateIndex) {
            this.function = function;
            this.timeIndex = timeIndex;
            this.stateIndex = stateIndex;
        }
    }

    private final class Run {
        private final ParsedScript script;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Bindings bindings = new Bindings();
        private boolean controlFlowHidesCalls = false;

        Run(ParsedScript script) {
            this.script = script;
        }

        OdeSystem extract() {
            Debug.get().d(TAG, "extracting model from " + script.sourceName);
            Site site = locateSolverCall();
            SolverCall call = site.call;
            if (call.args.size() < 3) {
                throw new ExtractionError(call.name() + " needs a function, a time span and an initial condition",
                        call.position());
            }

            bindParameters(site);
            Target target = resolveTarget(call.args.get(0), site, 0);
            bindExtraArguments(call, target);

            List<SymExpr> initial = initialCondition(call.args.get(2));
            OdeFunction ode = new OdeFunction(target, initial.size());
            ode.read();

            Map<String, SymExpr> initialValues = new LinkedHashMap<>();
            for (int i = 0; i < ode.states.size(); i++) initialValues.put(ode.states.get(i), initial.get(i));

            Map<String, ParameterBinding> parameters = modelParameters(ode, initialValues);
            Debug.get().d(TAG, call.name() + " -> " + target.function.name() + ": " + ode.states.size()
                    + " state(s) " + ode.states + ", " + parameters.size() + " parameter(s), "
                    + diagnostics.size() + " diagnostic(s)");
            try {
                return new OdeSystem(script.sourceName, call.name(), target.function.name(), ode.states,
                        ode.derivatives(), initialValues, parameters, diagnostics);
            } catch (IllegalArgumentException e) {
                throw new ExtractionError("Inconsistent ODE system: " + e.getMessage(), call.position());
            }
        }

        // -------------------------
        // Solver call
        // -------------------------

        private Site locateSolverCall() {
            List<Site> sites = new ArrayList<>();
            collectSites(script.root.statements, sites);
            for (FunctionDef f : script.functions()) collectSites(f.body.statements, sites);

            if (sites.isEmpty()) {
                String hint = controlFlowHidesCalls ? " outside of control-flow blocks" : "";
                throw new ExtractionError("No call of an ODE solver " + builtins.solvers() + " found" + hint
                        + " in " + script.sourceName, null);
            }
            if (sites.size() > 1) {
                Site second = sites.get(1);
                String message = sites.size() + " solver calls found; only one model per script is supported";
                if (strict) throw new ExtractionError(message, second.call.position());
                warn(MULTIPLE_SOLVER_CALLS, message + ", using the first", second.call.position());
            }
            return sites.get(0);
        }

        private void collectSites(List<Stmt> statements, List<Site> out) {
            for (int i = 0; i < statements.size(); i++) {
                Stmt stmt = statements.get(i);
                ExprInterface expr = null;
                if (stmt instanceof Assignment) expr = ((Assignment) stmt).value;
                else if (stmt instanceof ExprStmt) expr = ((ExprStmt) stmt).expression;
                else if (stmt instanceof ControlStmt && !SolverCallFinder.find((ControlStmt) stmt).isEmpty()) {
                    controlFlowHidesCalls = true;
                }
                if (expr == null) continue;
                for (SolverCall call : SolverCallFinder.find(expr)) out.add(new Site(call, statements, i));
            }
        }

        // -------------------------
        // Parameter bindings
        // -------------------------

        private void bindParameters(Site site) {
            ExpressionLowering lowering = new ExpressionLowering(builtins, script.kinds(), bindings);
            for (int i = 0; i < site.index; i++) {
                Stmt stmt = site.holder.get(i);
                if (stmt instanceof Assignment) {
                    bindAssignment((Assignment) stmt, lowering);
                } else if (stmt instanceof ControlStmt) {
                    warn(TOP_LEVEL_CONTROL_FLOW, "'" + ((ControlStmt) stmt).keyword.lexeme
                            + "' block ignored; assignments inside it are not parameter bindings", stmt.position());
                }
            }
            // the solver only sees values assigned before it runs
            for (int i = site.index + 1; i < site.holder.size(); i++) {
                Stmt stmt = site.holder.get(i);
                if (stmt instanceof Assignment && ((Assignment) stmt).isPlain()) {
                    info(IGNORED_STATEMENT, "'" + ((Assignment) stmt).plainName()
                            + "' is assigned after the solver call; not a parameter binding", stmt.position());
                }
            }
        }

        private void bindAssignment(Assignment a, ExpressionLowering lowering) {
            if (a.isPlain()) {
                bindings.bind(a.plainName(), a.value, a.position(), lowering);
                return;
            }
            ExprInterface target = a.targets.get(0);
            if (!a.multiple && target instanceof IndexOrCall && bindings.isVector(((IndexOrCall) target).name())) {
                IndexOrCall node = (IndexOrCall) target;
                try {
                    bindings.updateElement(node.name(), lowering.constantIndex(node.args.get(0)),
                            lowering.lower(a.value), a.position());
                    return;
                } catch (ExtractionError e) {
                    bindings.invalidate(node.name(), a.position(), e.getMessage());
                    return;
                }
            }
            for (ExprInterface t : a.targets) {
                if (Assignment.isPlaceholder(t)) continue;
                String name = baseName(t);
                if (name != null) bindings.invalidate(name, a.position(), "assigned by an indexed or multi-output assignment");
            }
        }

        // -------------------------
        // Right-hand-side function
        // -------------------------

        private Target resolveTarget(ExprInterface ref, Site site, int depth) {
            if (ref instanceof FunctionHandle) {
                FunctionHandle h = (FunctionHandle) ref;
                if (!h.isAnonymous()) return new Target(function(h.name.lexeme, h.position()), 0, 1);
                return anonymousTarget(h);
            }
            if (ref instanceof StringLiteral) {
                StringLiteral s = (StringLiteral) ref;
                return new Target(function(s.value, s.position()), 0, 1);
            }
            if (ref instanceof Identifier && depth < 8) {
                // f = @rhs; ode45(f, ...)
                String name = ((Identifier) ref).name();
                for (int i = site.index - 1; i >= 0; i--) {
                    Stmt stmt = site.holder.get(i);
                    if (stmt instanceof Assignment && name.equals(((Assignment) stmt).plainName())) {
                        return resolveTarget(((Assignment) stmt).value, site, depth + 1);
                    }
                }
            }
            throw new ExtractionError("Cannot tell which function the solver integrates", ref.position());
        }

        private Target anonymousTarget(FunctionHandle h) {
            if (!(h.body instanceof IndexOrCall) || h.params.size() < 2) {
                throw new ExtractionError("An anonymous right-hand side must be @(t, y) f(...) with f defined in this script",
                        h.position());
            }
            IndexOrCall body = (IndexOrCall) h.body;
            String name = body.name();
            if (name == null || script.kindOf(body) != CallKind.CALL) {
                throw new ExtractionError("An anonymous right-hand side must call a function defined in this script",
                        body.position());
            }
            String timeParam = h.params.get(0).lexeme;
            String stateParam = h.params.get(1).lexeme;
            int timeIndex = -1;
            int stateIndex = -1;
            for (int k = 0; k < body.args.size(); k++) {
                ExprInterface arg = body.args.get(k);
                if (arg instanceof Identifier && ((Identifier) arg).name().equals(timeParam)) timeIndex = k;
                else if (arg instanceof Identifier && ((Identifier) arg).name().equals(stateParam)) stateIndex = k;
            }
            if (stateIndex < 0) {
                throw new ExtractionError("Anonymous function does not pass its state argument '" + stateParam
                        + "' to " + name, body.position());
            }
            Target target = new Target(function(name, body.position()), timeIndex, stateIndex);
            for (int k = 0; k < body.args.size(); k++) {
                if (k != timeIndex && k != stateIndex) target.extraArgs.put(k, body.args.get(k));
            }
            return target;
        }

        private FunctionDef function(String name, SourcePosition at) {
            FunctionDef f = script.function(name);
            if (f == null) {
                throw new ExtractionError("ODE function '" + name + "' is not defined in this script", at, name);
            }
            return f;
        }

        // legacy ode45(@f, tspan, y0, options, p1, p2, ...) passes p1, p2 to the third and later formals
        private void bindExtraArguments(SolverCall call, Target target) {
            if (target.extraArgs.isEmpty()) {
                for (int k = 4; k < call.args.size(); k++) target.extraArgs.put(k - 2, call.args.get(k));
            }
            int formals = target.function.params.size();
            List<Integer> dropped = new ArrayList<>();
            for (Integer k : target.extraArgs.keySet()) {
                if (k >= formals) dropped.add(k);
            }
            for (Integer k : dropped) {
                ExprInterface arg = target.extraArgs.remove(k);
                warn(UNUSED_ARGUMENT, "argument " + (k + 1) + " has no matching formal in "
                        + target.function.name(), arg.position());
            }
        }

        private List<SymExpr> initialCondition(ExprInterface expr) {
            ExpressionLowering lowering = new ExpressionLowering(builtins, script.kinds(), bindings.byValue());
            List<SymExpr> values = lowering.lowerVector(expr);
            if (values == null) {
                if (expr instanceof Range) throw new ExtractionError("Initial condition must be a vector", expr.position());
                values = new ArrayList<>();
                values.add(lowering.lower(expr));
            }
            if (values.isEmpty()) throw new ExtractionError("Initial condition is empty", expr.position());
            return values;
        }

        // -------------------------
        // Model parameters
        // -------------------------

        private Map<String, ParameterBinding> modelParameters(OdeFunction ode, Map<String, SymExpr> initialValues) {
            Map<String, ParameterBinding> pool = new LinkedHashMap<>();
            for (ParameterBinding b : bindings.scalars.values()) {
                if (b.isUsable()) pool.put(b.name, b);
            }
            for (ParameterBinding b : ode.localParameters.values()) {
                if (pool.remove(b.name) != null) {
                    info(SHADOWED_BINDING, "'" + b.name + "' is assigned inside " + ode.function.name()
                            + "; that value replaces the one at " + bindings.scalars.get(b.name).position, b.position);
                }
                pool.put(b.name, b);
            }
            for (String state : ode.states) {
                ParameterBinding clash = pool.remove(state);
                if (clash != null) {
                    warn(SHADOWED_BINDING, "'" + state + "' names a state variable; its binding is not a parameter",
                            clash.position);
                }
            }

            // everything the model expressions reach, directly or through other parameters
            Set<String> required = new HashSet<>();
            List<String> pending = new ArrayList<>();
            for (SymExpr e : ode.derivatives().values()) pending.addAll(e.variables());
            for (SymExpr e : initialValues.values()) pending.addAll(e.variables());
            for (ParameterBinding b : ode.localParameters.values()) pending.addAll(b.value.variables());
            while (!pending.isEmpty()) {
                String n = pending.remove(pending.size() - 1);
                if (!required.add(n)) continue;
                ParameterBinding b = pool.get(n);
                if (b != null) pending.addAll(b.value.variables());
            }

            Map<String, ParameterBinding> out = new LinkedHashMap<>();
            for (ParameterBinding b : pool.values()) {
                if (required.contains(b.name) || !bindings.isVectorElement(b.name)) out.put(b.name, b);
            }
            // unreferenced scalars may still depend on dropped vector elements
            boolean changed = true;
            while (changed) {
                changed = false;
                for (ParameterBinding b : new ArrayList<>(out.values())) {
                    for (String n : b.value.variables()) {
                        if (!out.containsKey(n) && !ode.isState(n)) {
                            out.remove(b.name);
                            changed = true;
                            break;
                        }
                    }
                }
            }
            return out;
        }

        // -------------------------
        // ODE function body
        // -------------------------

        private final class OdeFunction implements ExpressionLowering.Names {
            final FunctionDef function;
            final int count;
            final String timeName;
            final String stateName;
            final String outName;
            final List<String> states = new ArrayList<>();
            final Map<String, ParameterBinding> localParameters = new LinkedHashMap<>();

            private final Target target;
            private final List<SymExpr> stateVariables = new ArrayList<>();
            private final Map<String, SymExpr> locals = new HashMap<>();
            private final Map<String, List<SymExpr>> localVectors = new HashMap<>();
            private final Map<String, ExtractionError> failed = new HashMap<>();
            private final List<ExtractionError> errors = new ArrayList<>();
            private final Map<String, SymExpr> extraScalars = new HashMap<>();
            private final Map<String, List<SymExpr>> extraVectors = new HashMap<>();
            private final Map<String, Integer> aliases = new LinkedHashMap<>();
            private SymExpr[] slots;
            private final ExpressionLowering lowering;

            OdeFunction(Target target, int count) {
                this.target = target;
                this.function = target.function;
                this.count = count;
                if (function.outputs.isEmpty() || function.outputs.get(0).type != TokenType.IDENTIFIER) {
                    throw new ExtractionError("ODE function '" + function.name() + "' must return its derivatives",
                            function.position());
                }
                if (function.params.size() <= Math.max(target.stateIndex, target.timeIndex)) {
                    throw new ExtractionError("ODE function '" + function.name() + "' takes "
                            + function.params.size() + " argument(s); the solver passes at least 2", function.position());
                }
                if (function.params.get(target.stateIndex).type != TokenType.IDENTIFIER) {
                    throw new ExtractionError("State argument of '" + function.name() + "' must be a plain name",
                            function.params.get(target.stateIndex).position);
                }
                this.outName = function.outputs.get(0).lexeme;
                this.stateName = function.params.get(target.stateIndex).lexeme;
                this.timeName = (target.timeIndex >= 0 && function.params.get(target.timeIndex).type == TokenType.IDENTIFIER)
                        ? function.params.get(target.timeIndex).lexeme
                        : null;
                this.lowering = new ExpressionLowering(builtins, script.kinds(), this);
            }

            boolean isState(String name) {
                return states.contains(name);
            }

            void read() {
                bindFormals();
                nameStates();
                for (Map.Entry<String, Integer> alias : aliases.entrySet()) {
                    locals.put(alias.getKey(), stateVariables.get(alias.getValue() - 1));
                }

                for (Stmt stmt : function.body.statements) {
                    if (stmt instanceof KeywordStmt && ((KeywordStmt) stmt).keyword.type == TokenType.RETURN) break;
                    try {
                        statement(stmt);
                    } catch (ExtractionError e) {
                        errors.add(e);
                    }
                }

                if (!errors.isEmpty()) throw ExtractionError.of(errors);
                if (slots == null) {
                    throw new ExtractionError("Output '" + outName + "' of '" + function.name() + "' is never assigned",
                            function.position(), outName);
                }
                for (int i = 0; i < count; i++) {
                    if (slots[i] == null) {
                        slots[i] = SymExpr.ZERO;
                        warn(UNASSIGNED_DERIVATIVE, outName + "(" + (i + 1) + ") is never assigned; d"
                                + states.get(i) + "/dt is taken as 0", function.position());
                    }
                }
            }

            Map<String, SymExpr> derivatives() {
                Map<String, SymExpr> out = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) out.put(states.get(i), slots[i]);
                return out;
            }

            private void bindFormals() {
                ExpressionLowering outer = new ExpressionLowering(builtins, script.kinds(), bindings);
                for (Map.Entry<Integer, ExprInterface> e : target.extraArgs.entrySet()) {
                    if (function.params.get(e.getKey()).type != TokenType.IDENTIFIER) continue;
                    String formal = function.params.get(e.getKey()).lexeme;
                    List<SymExpr> vector = outer.lowerVector(e.getValue());
                    if (vector != null && vector.size() != 1) extraVectors.put(formal, vector);
                    else extraScalars.put(formal, (vector != null) ? vector.get(0) : outer.lower(e.getValue()));
                }
            }

            // name = y(i) gives state i its name, when name is assigned nowhere else
            private void nameStates() {
                Map<String, Integer> writes = new HashMap<>();
                for (Stmt stmt : function.body.statements) {
                    if (!(stmt instanceof Assignment)) continue;
                    for (ExprInterface t : ((Assignment) stmt).targets) {
                        String n = baseName(t);
                        if (n != null) writes.merge(n, 1, Integer::sum);
                    }
                }
                Set<Integer> taken = new HashSet<>();
                for (Stmt stmt : function.body.statements) {
                    if (!(stmt instanceof Assignment) || !((Assignment) stmt).isPlain()) continue;
                    Assignment a = (Assignment) stmt;
                    String name = a.plainName();
                    int index = stateIndexOf(a.value);
                    if (index < 1 || index > count || taken.contains(index)) continue;
                    if (writes.get(name) != 1 || name.equals(outName) || name.equals(stateName) || name.equals(timeName)) continue;
                    aliases.put(name, index);
                    taken.add(index);
                }

                Map<Integer, String> byIndex = new HashMap<>();
                for (Map.Entry<String, Integer> e : aliases.entrySet()) byIndex.put(e.getValue(), e.getKey());
                Set<String> used = new LinkedHashSet<>(aliases.keySet());
                for (int i = 1; i <= count; i++) {
                    String name = byIndex.get(i);
                    if (name == null) {
                        name = stateName + "_" + i;
                        for (int k = 2; used.contains(name); k++) name = stateName + "_" + i + "_" + k;
                        used.add(name);
                    }
                    states.add(name);
                    stateVariables.add(SymExpr.variable(name));
                }
            }

            /** i for y(i) (or y(i,1), y(1,i)) with a literal i, else -1. */
            private int stateIndexOf(ExprInterface expr) {
                if (!(expr instanceof IndexOrCall)) return -1;
                IndexOrCall node = (IndexOrCall) expr;
                if (!stateName.equals(node.name())) return -1;
                List<ExprInterface> args = node.args;
                if (args.size() == 1) return literalIndex(args.get(0));
                if (args.size() == 2) {
                    int a = literalIndex(args.get(0));
                    int b = literalIndex(args.get(1));
                    if (a == 1) return b;
                    if (b == 1) return a;
                }
                return -1;
            }

            private int literalIndex(ExprInterface expr) {
                if (!(expr instanceof NumberLiteral)) return -1;
                double v = ((NumberLiteral) expr).value;
                return (v == Math.rint(v) && v >= 1) ? (int) v : -1;
            }

            private void statement(Stmt stmt) {
                if (stmt instanceof Assignment) {
                    assignment((Assignment) stmt);
                } else if (stmt instanceof ControlStmt) {
                    unsupported("'" + ((ControlStmt) stmt).keyword.lexeme + "' block", stmt.position());
                } else if (stmt instanceof DeclarationStmt) {
                    if (!((DeclarationStmt) stmt).isGlobal()) unsupported("persistent variable", stmt.position());
                } else if (stmt instanceof ExprStmt) {
                    info(IGNORED_STATEMENT, "statement in " + function.name() + " does not affect the model",
                            stmt.position());
                } else if (stmt instanceof FunctionDef) {
                    info(IGNORED_STATEMENT, "nested function '" + ((FunctionDef) stmt).name() + "' ignored",
                            stmt.position());
                }
            }

            private void assignment(Assignment a) {
                if (a.multiple) {
                    unsupported("multi-output assignment", a.position());
                    return;
                }
                ExprInterface target = a.targets.get(0);
                if (a.isPlain()) {
                    String name = a.plainName();
                    if (name.equals(outName)) assignOutput(a.value);
                    else if (!aliases.containsKey(name)) assignLocal(name, a.value, a.position());
                    return;
                }
                if (target instanceof IndexOrCall) {
                    IndexOrCall node = (IndexOrCall) target;
                    String name = node.name();
                    if (outName.equals(name)) {
                        assignOutputElement(node, a.value);
                        return;
                    }
                    if (name != null && localVectors.containsKey(name) && node.args.size() == 1) {
                        int index = lowering.constantIndex(node.args.get(0));
                        List<SymExpr> vector = localVectors.get(name);
                        if (index > vector.size()) {
                            throw new ExtractionError("Index " + index + " exceeds the " + vector.size()
                                    + " element(s) of '" + name + "'", node.position(), name);
                        }
                        vector.set(index - 1, lowering.lower(a.value));
                        return;
                    }
                }
                unsupported("assignment to '" + baseName(target) + "'", a.position());
            }

            private void assignOutput(ExprInterface value) {
                if (isSelfReshape(value)) return;
                if (value instanceof IndexOrCall && isAllocation((IndexOrCall) value)) {
                    slots = new SymExpr[count];
                    for (int i = 0; i < count; i++) slots[i] = SymExpr.ZERO;
                    return;
                }
                List<SymExpr> vector = lowering.lowerVector(value, errors);
                if (vector == null) {
                    vector = new ArrayList<>();
                    vector.add(lowering.lower(value));
                }
                if (vector.size() != count) {
                    throw new ExtractionError("'" + outName + "' has " + vector.size()
                            + " element(s) but the initial condition has " + count, value.position(), outName);
                }
                slots = vector.toArray(new SymExpr[0]);
            }

            // dy = dy' and dy = dy(:) only change the shape
            private boolean isSelfReshape(ExprInterface value) {
                if (value instanceof Unary && ((Unary) value).isTranspose()) {
                    ExprInterface operand = ((Unary) value).operand;
                    return operand instanceof Identifier && ((Identifier) operand).name().equals(outName);
                }
                if (value instanceof IndexOrCall) {
                    IndexOrCall node = (IndexOrCall) value;
                    return outName.equals(node.name()) && node.args.size() == 1 && node.args.get(0) instanceof Colon;
                }
                return false;
            }

            // zeros(n, 1), zeros(1, n), zeros(size(y)), zeros(length(y), 1)
            private boolean isAllocation(IndexOrCall node) {
                if (!"zeros".equals(node.name()) || script.kindOf(node) != CallKind.CALL) return false;
                long elements = 1;
                for (ExprInterface arg : node.args) {
                    Double c;
                    try {
                        c = lowering.lower(arg).constantValue();
                    } catch (ExtractionError e) {
                        return true; // size(y) and friends: the shape follows the state vector
                    }
                    if (c == null) return true;
                    elements *= c.longValue();
                }
                if (node.args.size() == 1) elements *= elements; // zeros(n) is n-by-n
                if (elements != count) {
                    throw new ExtractionError("'" + outName + "' is allocated with " + elements
                            + " element(s) but the initial condition has " + count, node.position(), outName);
                }
                return true;
            }

            private void assignOutputElement(IndexOrCall node, ExprInterface value) {
                int index;
                if (node.args.size() == 1) {
                    index = lowering.constantIndex(node.args.get(0));
                } else if (node.args.size() == 2) {
                    int a = lowering.constantIndex(node.args.get(0));
                    int b = lowering.constantIndex(node.args.get(1));
                    if (a != 1 && b != 1) {
                        throw new ExtractionError("'" + outName + "' must be a vector", node.position(), outName);
                    }
                    index = (a == 1) ? b : a;
                } else {
                    throw new ExtractionError("'" + outName + "' must be a vector", node.position(), outName);
                }
                if (index > count) {
                    throw new ExtractionError(outName + "(" + index + ") is beyond the " + count
                            + " state variable(s)", node.position(), outName);
                }
                if (slots == null) slots = new SymExpr[count];
                slots[index - 1] = lowering.lower(value);
            }

            private void assignLocal(String name, ExprInterface value, SourcePosition at) {
                try {
                    List<SymExpr> vector = lowering.lowerVector(value);
                    if (vector != null && vector.size() != 1) {
                        forget(name);
                        localVectors.put(name, new ArrayList<>(vector));
                        return;
                    }
                    SymExpr v = (vector != null) ? vector.get(0) : lowering.lower(value);
                    ParameterBinding previous = localParameters.get(name);
                    if (previous != null && v.variables().contains(name)) {
                        // k = k * 2
                        Map<String, SymExpr> old = new HashMap<>();
                        old.put(name, previous.value);
                        v = v.substitute(old);
                    }
                    forget(name);
                    if (dependsOnState(v)) locals.put(name, v);
                    else localParameters.put(name, ParameterBinding.of(name, v, at));
                } catch (ExtractionError e) {
                    forget(name);
                    failed.put(name, e);
                }
            }

            private void forget(String name) {
                locals.remove(name);
                localVectors.remove(name);
                localParameters.remove(name);
                failed.remove(name);
            }

            private boolean dependsOnState(SymExpr v) {
                if (v.containsTime()) return true;
                for (String n : v.variables()) {
                    if (states.contains(n)) return true;
                }
                return false;
            }

            private void unsupported(String what, SourcePosition at) {
                String message = what + " inside ODE function '" + function.name() + "' is not supported";
                if (strict) throw new ExtractionError(message, at);
                warn(UNSUPPORTED_CONSTRUCT, message + "; skipped", at);
            }

            @Override
            public SymExpr scalar(String name, SourcePosition at) {
                SymExpr local = locals.get(name);
                if (local != null) return local;
                if (localParameters.containsKey(name)) return SymExpr.variable(name);
                ExtractionError broken = failed.get(name);
                if (broken != null) {
                    throw new ExtractionError("'" + name + "' has no usable value: " + broken.getMessage(), at, name);
                }
                if (name.equals(timeName)) return SymExpr.time();
                if (name.equals(stateName)) return (count == 1) ? stateVariables.get(0) : null;
                if (localVectors.containsKey(name)) return null;
                SymExpr extra = extraScalars.get(name);
                if (extra != null) return extra;
                if (extraVectors.containsKey(name)) return null;
                return bindings.scalar(name, at);
            }

            @Override
            public List<SymExpr> vector(String name, SourcePosition at) {
                if (name.equals(stateName)) return stateVariables;
                List<SymExpr> local = localVectors.get(name);
                if (local != null) return local;
                if (locals.containsKey(name) || localParameters.containsKey(name) || failed.containsKey(name)) return null;
                if (name.equals(timeName)) return null;
                List<SymExpr> extra = extraVectors.get(name);
                if (extra != null) return extra;
                if (extraScalars.containsKey(name)) return null;
                return bindings.vector(name, at);
            }
        }

        private void warn(String code, String message, SourcePosition at) {
            Diagnostic d = Diagnostic.warning(Stage.EXTRACT, code, message, at);
            diagnostics.add(d);
            Debug.get().w(TAG, d.toString());
        }

        private void info(String code, String message, SourcePosition at) {
            Diagnostic d = Diagnostic.info(Stage.EXTRACT, code, message, at);
            diagnostics.add(d);
            Debug.get().d(TAG, d.toString());
        }

        /** Parameter bindings made before the solver call. Vectors expand into p_1, p_2, ... */
        private final class Bindings implements ExpressionLowering.Names {
            final Map<String, ParameterBinding> scalars = new LinkedHashMap<>();
            private final Map<String, List<String>> vectorElements = new HashMap<>();
            private final Map<String, List<SymExpr>> vectorValues = new HashMap<>();
            private final Map<String, ParameterBinding> unusableVectors = new HashMap<>();
            private final Set<String> elementNames = new HashSet<>();

            void bind(String name, ExprInterface value, SourcePosition at, ExpressionLowering lowering) {
                SourcePosition earlier = positionOf(name);
                if (earlier != null) {
                    warn(SHADOWED_BINDING, "'" + name + "' is assigned again; the value assigned at " + earlier
                            + " is ignored", at);
                }
                ParameterBinding binding;
                List<SymExpr> vector;
                try {
                    vector = lowering.lowerVector(value);
                    if (vector == null || vector.size() == 1) {
                        SymExpr v = (vector != null) ? vector.get(0) : lowering.lower(value);
                        binding = ParameterBinding.of(name, v, at);
                        vector = null;
                    } else {
                        binding = null;
                    }
                } catch (ExtractionError e) {
                    Debug.get().t(TAG, "'" + name + "' has no model value: " + e.getMessage());
                    remove(name);
                    scalars.put(name, ParameterBinding.unusable(name, at, e.getMessage()));
                    return;
                }
                remove(name);
                if (binding != null) {
                    scalars.put(name, binding);
                    return;
                }
                List<String> elements = new ArrayList<>();
                for (int i = 0; i < vector.size(); i++) {
                    String element = name + "_" + (i + 1);
                    elements.add(element);
                    elementNames.add(element);
                    scalars.put(element, ParameterBinding.of(element, vector.get(i), at));
                }
                vectorElements.put(name, elements);
                vectorValues.put(name, new ArrayList<>(vector));
                unusableVectors.put(name, ParameterBinding.unusable(name, at, "vector"));
            }

            void updateElement(String name, int index, SymExpr value, SourcePosition at) {
                List<String> elements = vectorElements.get(name);
                if (index > elements.size()) {
                    throw new ExtractionError("Index " + index + " exceeds the " + elements.size()
                            + " element(s) of '" + name + "'", at, name);
                }
                String element = elements.get(index - 1);
                scalars.put(element, ParameterBinding.of(element, value, at));
                vectorValues.get(name).set(index - 1, value);
            }

            void invalidate(String name, SourcePosition at, String reason) {
                remove(name);
                scalars.put(name, ParameterBinding.unusable(name, at, reason));
            }

            boolean isVector(String name) {
                return name != null && vectorElements.containsKey(name);
            }

            boolean isVectorElement(String name) {
                return elementNames.contains(name);
            }

            private SourcePosition positionOf(String name) {
                ParameterBinding b = scalars.get(name);
                if (b == null) b = unusableVectors.get(name);
                return (b == null) ? null : b.position;
            }

            private void remove(String name) {
                scalars.remove(name);
                unusableVectors.remove(name);
                vectorValues.remove(name);
                List<String> elements = vectorElements.remove(name);
                if (elements != null) {
                    for (String e : elements) {
                        scalars.remove(e);
                        elementNames.remove(e);
                    }
                }
            }

            @Override
            public SymExpr scalar(String name, SourcePosition at) {
                if (vectorElements.containsKey(name)) return null;
                ParameterBinding b = scalars.get(name);
                if (b == null) return null;
                if (!b.isUsable()) {
                    throw new ExtractionError("'" + name + "' has no usable value: " + b.unusableReason, at, name);
                }
                return SymExpr.variable(name);
            }

            @Override
            public List<SymExpr> vector(String name, SourcePosition at) {
                List<String> elements = vectorElements.get(name);
                if (elements == null) return null;
                List<SymExpr> out = new ArrayList<>(elements.size());
                for (String e : elements) out.add(SymExpr.variable(e));
                return out;
            }

            /** Same names, but vectors yield their element values instead of element parameters. */
            ExpressionLowering.Names byValue() {
                return new ExpressionLowering.Names() {
                    @Override
                    public SymExpr scalar(String name, SourcePosition at) {
                        return Bindings.this.scalar(name, at);
                    }

                    @Override
                    public List<SymExpr> vector(String name, SourcePosition at) {
                        List<SymExpr> values = vectorValues.get(name);
                        return (values == null) ? null : new ArrayList<>(values);
                    }
                };
            }
        }
    }

    /** Name at the root of x, x(i), x{i} or x.f; null otherwise. */
    private static String baseName(ExprInterface expr) {
        while (true) {
            if (expr instanceof Identifier) return ((Identifier) expr).name();
            if (expr instanceof IndexOrCall) expr = ((IndexOrCall) expr).target;
            else if (expr instanceof CellIndex) expr = ((CellIndex) expr).target;
            else if (expr instanceof FieldAccess) expr = ((FieldAccess) expr).target;
            else return null;
        }
    }

    /** Collects every solver call inside an expression or a control block, outermost first. */
    static final class SolverCallFinder implements ExprVisitor<Void> {
        private final List<SolverCall> found = new ArrayList<>();

        static List<SolverCall> find(ExprInterface expr) {
            SolverCallFinder finder = new SolverCallFinder();
            expr.accept(finder);
            return finder.found;
        }

        static List<SolverCall> find(ControlStmt stmt) {
            SolverCallFinder finder = new SolverCallFinder();
            finder.scan(stmt);
            return finder.found;
        }

        private void scan(ControlStmt stmt) {
            for (Clause clause : stmt.clauses) {
                if (clause.header != null) clause.header.accept(this);
                for (Stmt s : clause.body.statements) {
                    if (s instanceof Assignment) ((Assignment) s).value.accept(this);
                    else if (s instanceof ExprStmt) ((ExprStmt) s).expression.accept(this);
                    else if (s instanceof ControlStmt) scan((ControlStmt) s);
                }
            }
        }

        private void all(List<ExprInterface> exprs) {
            for (ExprInterface e : exprs) e.accept(this);
        }

        @Override
        public Void visitNumberExpr(NumberLiteral expr) { return null; }

        @Override
        public Void visitStringExpr(StringLiteral expr) { return null; }

        @Override
        public Void visitIdentifierExpr(Identifier expr) { return null; }

        @Override
        public Void visitBinaryExpr(Binary expr) {
            expr.left.accept(this);
            expr.right.accept(this);
            return null;
        }

        @Override
        public Void visitUnaryExpr(Unary expr) {
            expr.operand.accept(this);
            return null;
        }

        @Override
        public Void visitMatrixExpr(MatrixLiteral expr) {
            all(expr.elements());
            return null;
        }

        @Override
        public Void visitRangeExpr(Range expr) {
            expr.start.accept(this);
            if (expr.step != null) expr.step.accept(this);
            expr.stop.accept(this);
            return null;
        }

        @Override
        public Void visitIndexOrCallExpr(IndexOrCall expr) {
            expr.target.accept(this);
            all(expr.args);
            return null;
        }

        @Override
        public Void visitCellIndexExpr(CellIndex expr) {
            expr.target.accept(this);
            all(expr.args);
            return null;
        }

        @Override
        public Void visitFieldExpr(FieldAccess expr) {
            expr.target.accept(this);
            return null;
        }

        @Override
        public Void visitSolverCallExpr(SolverCall expr) {
            found.add(expr);
            all(expr.args);
            return null;
        }

        @Override
        public Void visitFunctionHandleExpr(FunctionHandle expr) {
            if (expr.body != null) expr.body.accept(this);
            return null;
        }

        @Override
        public Void visitColonExpr(Colon expr) { return null; }

        @Override
        public Void visitEndExpr(EndIndex expr) { return null; }
    }
}
