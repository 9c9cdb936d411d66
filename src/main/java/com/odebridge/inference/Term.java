package com.odebridge.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import com.odebridge.symbolic.SymExpr;

/**
 * One signed monomial of an expanded derivative: coefficient x non-species factors x
 * species powers. Factors are kept sorted so that k1*k2*A and k2*k1*A compare equal.
 */
public final class Term {
    private static final Comparator<SymExpr> FACTOR_ORDER = Comparator.comparing(SymExpr::toString);

    public final double coefficient;
    private final TreeMap<String, Integer> species;
    private final List<SymExpr> factors;

    private Term(double coefficient, TreeMap<String, Integer> species, List<SymExpr> factors) {
        this.coefficient = coefficient;
        this.species = species;
        this.factors = factors;
    }

    public static Term constant(double c) {
        return new Term(c, new TreeMap<>(), Collections.emptyList());
    }

    public static Term species(String name, int exponent) {
        TreeMap<String, Integer> s = new TreeMap<>();
        s.put(name, exponent);
        return new Term(1.0, s, Collections.emptyList());
    }

    public static Term factor(SymExpr factor) {
        List<SymExpr> f = new ArrayList<>();
        f.add(factor);
        return new Term(1.0, new TreeMap<>(), f);
    }

    public Term times(Term other) {
        TreeMap<String, Integer> s = new TreeMap<>(species);
        for (Map.Entry<String, Integer> e : other.species.entrySet()) s.merge(e.getKey(), e.getValue(), Integer::sum);
        List<SymExpr> f = new ArrayList<>(factors);
        f.addAll(other.factors);
        f.sort(FACTOR_ORDER);
        return new Term(coefficient * other.coefficient, s, Collections.unmodifiableList(f));
    }

    public Term withCoefficient(double c) {
        return new Term(c, species, factors);
    }

    public Term negate() {
        return withCoefficient(-coefficient);
    }

    /** Species exponents, sorted by name. */
    public Map<String, Integer> species() {
        return Collections.unmodifiableMap(species);
    }

    public Set<String> speciesNames() {
        return Collections.unmodifiableSet(species.keySet());
    }

    public int exponentOf(String name) {
        Integer e = species.get(name);
        return (e == null) ? 0 : e;
    }

    public List<SymExpr> factors() {
        return factors;
    }

    /** True when the term is a bare number. */
    public boolean isPureConstant() {
        return species.isEmpty() && factors.isEmpty();
    }

    /** Same species powers and the same factors; coefficients are ignored. */
    public boolean sameMonomial(Term other) {
        return species.equals(other.species) && factors.equals(other.factors);
    }

    /** The term without its coefficient: factors first, then species powers. */
    public SymExpr monomial() {
        List<SymExpr> parts = new ArrayList<>(factors);
        for (Map.Entry<String, Integer> e : species.entrySet()) {
            parts.add(SymExpr.power(SymExpr.variable(e.getKey()), SymExpr.constant(e.getValue())));
        }
        if (parts.isEmpty()) return SymExpr.ONE;
        return SymExpr.product(parts);
    }

    public SymExpr toExpr() {
        return SymExpr.product(SymExpr.constant(coefficient), monomial());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Term)) return false;
        Term t = (Term) o;
        return Double.compare(coefficient, t.coefficient) == 0 && sameMonomial(t);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficient, species, factors);
    }

    @Override
    public String toString() {
        return toExpr().toString();
    }
}
