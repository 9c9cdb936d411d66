package com.odebridge.matlab.parser;

import java.util.List;

import com.odebridge.debug.Debug;
import com.odebridge.matlab.MatlabBuiltins;
import com.odebridge.matlab.parser.Expr.Colon;
import com.odebridge.matlab.parser.Expr.EndIndex;
import com.odebridge.matlab.parser.Expr.ExprInterface;
import com.odebridge.matlab.parser.Expr.IndexOrCall;

/**
 * Decides, while the parser builds the tree, whether each name(args) is a call or an
 * array reference. Decisions use only what was seen earlier in the text plus the
 * enclosing scopes:
 *
 *  1. a name known as a variable (or global parameter) is indexed
 *  2. a known solver or built-in is called
 *  3. anything else is called for now and remembered; a later plain assignment to the
 *     same name in the same scope turns every remembered node into an index
 *
 * Whatever is still pending when a scope closes stays a call.
 */
public final class KindResolver {
    private static final String TAG = "odebridge.parser";

    private final MatlabBuiltins builtins;
    private final KindTable table;
    private Scope scope;

    public KindResolver(MatlabBuiltins builtins, KindTable table) {
        this.builtins = builtins;
        this.table = table;
        this.scope = new Scope("<script>", null);
    }

    public KindTable table() { return table; }

    public Scope currentScope() { return scope; }

    public void enterScope(String name) {
        scope = new Scope(name, scope);
    }

    /** Closes the innermost scope; names still pending keep their CALL resolution. */
    public void exitScope() {
        int pending = scope.tentativeCount();
        if (pending > 0) {
            Debug.get().t(TAG, "scope " + scope.name + " closed with " + pending + " unconfirmed call(s)");
        }
        scope.clearTentative();
        if (scope.parent != null) scope = scope.parent;
    }

    /** Registers a name(args) node and gives it its first resolution. */
    public CallKind resolve(IndexOrCall node) {
        String name = node.name();
        CallKind kind;
        if (name == null || hasArrayOnlySubscript(node.args)) {
            kind = CallKind.INDEX;
        } else if (isVariable(name)) {
            kind = CallKind.INDEX;
        } else if (builtins.isKnown(name) || scope.isDefinedFunction(name)) {
            kind = CallKind.CALL;
        } else {
            kind = CallKind.CALL;
            scope.addTentative(name, node.nodeId);
        }
        table.set(node.nodeId, kind);
        return kind;
    }

    /** The node is the target of an assignment, which only an array can be. */
    public void forceIndex(IndexOrCall node) {
        table.set(node.nodeId, CallKind.INDEX);
        String name = node.name();
        if (name != null) scope.dropTentative(name, node.nodeId);
    }

    /**
     * Records an assignment to a name in the current scope. A plain assignment also
     * confirms that earlier name(args) uses in this scope were array references.
     */
    public void assigned(String name, boolean plain) {
        if (plain) {
            List<Integer> ids = scope.takeTentative(name);
            for (int id : ids) table.set(id, CallKind.INDEX);
            if (!ids.isEmpty()) {
                Debug.get().d(TAG, "'" + name + "' reclassified as array (" + ids.size() + " node(s)) in " + scope.name);
            }
        }
        if (scope.lookupLocal(name) != Role.PARAMETER) scope.declare(name, Role.VARIABLE);
    }

    /** Function inputs and outputs, loop variables, multi-output targets. */
    public void declareVariable(String name) {
        assigned(name, true);
    }

    public void declareGlobal(String name) {
        scope.declare(name, Role.PARAMETER);
    }

    public void defineFunction(String name) {
        scope.defineFunction(name);
    }

    public boolean isVariable(String name) {
        Role r = scope.lookup(name);
        return r == Role.VARIABLE || r == Role.PARAMETER;
    }

    /** A solver name that no variable shadows. */
    public boolean isSolver(String name) {
        return builtins.isSolver(name) && !isVariable(name);
    }

    private static boolean hasArrayOnlySubscript(List<ExprInterface> args) {
        for (ExprInterface a : args) {
            if (a instanceof Colon || a instanceof EndIndex) return true;
        }
        return false;
    }
}
