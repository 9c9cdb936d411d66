package com.odebridge.matlab.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symbol table of one function body (or of the script itself). Lookups that miss fall back
 * to the enclosing scope.
 */
public final class Scope {
    public final String name;
    public final Scope parent;

    private final Map<String, Role> roles = new LinkedHashMap<>();
    private final Set<String> definedFunctions = new HashSet<>();

    // name -> ids of IndexOrCall nodes still resolved as CALL only because the name was unknown
    private final Map<String, List<Integer>> tentative = new LinkedHashMap<>();

    public Scope(String name, Scope parent) {
        this.name = name;
        this.parent = parent;
    }

    public Role lookup(String symbol) {
        for (Scope s = this; s != null; s = s.parent) {
            Role r = s.roles.get(symbol);
            if (r != null) return r;
        }
        return Role.UNKNOWN;
    }

    public Role lookupLocal(String symbol) {
        return roles.getOrDefault(symbol, Role.UNKNOWN);
    }

    public void declare(String symbol, Role role) {
        roles.put(symbol, role);
    }

    /** A name introduced by a function definition. Never reclassified. */
    public void defineFunction(String symbol) {
        definedFunctions.add(symbol);
        roles.put(symbol, Role.FUNCTION);
    }

    public boolean isDefinedFunction(String symbol) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.definedFunctions.contains(symbol)) return true;
        }
        return false;
    }

    void addTentative(String symbol, int nodeId) {
        tentative.computeIfAbsent(symbol, k -> new ArrayList<>()).add(nodeId);
        roles.putIfAbsent(symbol, Role.FUNCTION);
    }

    /** Removes and returns the pending node ids of a name. */
    List<Integer> takeTentative(String symbol) {
        List<Integer> ids = tentative.remove(symbol);
        return (ids == null) ? Collections.emptyList() : ids;
    }

    void dropTentative(String symbol, int nodeId) {
        List<Integer> ids = tentative.get(symbol);
        if (ids == null) return;
        ids.remove(Integer.valueOf(nodeId));
        if (ids.isEmpty()) tentative.remove(symbol);
    }

    int tentativeCount() {
        int n = 0;
        for (List<Integer> ids : tentative.values()) n += ids.size();
        return n;
    }

    void clearTentative() {
        tentative.clear();
    }

    public Map<String, Role> symbols() {
        return Collections.unmodifiableMap(roles);
    }
}
