package com.odebridge.matlab.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.odebridge.matlab.parser.Expr.IndexOrCall;

/**
 * Arena of call/index resolutions, indexed by {@link IndexOrCall#nodeId}.
 * The tree itself is never rewritten; reclassification only touches this table.
 */
public final class KindTable {
    private final List<CallKind> kinds = new ArrayList<>();

    /** Allocates the id for a new node. Its kind starts as UNKNOWN. */
    int register() {
        kinds.add(CallKind.UNKNOWN);
        return kinds.size() - 1;
    }

    void set(int nodeId, CallKind kind) {
        kinds.set(nodeId, kind);
    }

    public CallKind kindOf(int nodeId) {
        return kinds.get(nodeId);
    }

    public CallKind kindOf(IndexOrCall node) {
        return kinds.get(node.nodeId);
    }

    public boolean isIndex(IndexOrCall node) {
        return kindOf(node) == CallKind.INDEX;
    }

    public int size() {
        return kinds.size();
    }

    /** True when every node has been resolved to CALL or INDEX. */
    public boolean isComplete() {
        return !kinds.contains(CallKind.UNKNOWN);
    }

    public List<CallKind> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(kinds));
    }
}
