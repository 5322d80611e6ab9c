package fol;

import fol.term.Term;
import fol.term.Variable;

import java.util.LinkedHashMap;
import java.util.Map;

public class Substitution {
    private final Map<Variable, Term> map;
    private final boolean congruent;

    public Substitution() {
        this(true);
    }

    /**
     * @param congruent whether the substitution also rewrites arguments of opaque function and
     *                  predicate applications (Leibniz equality) or only fragment positions (setoid equality)
     */
    public Substitution(boolean congruent) {
        this(new LinkedHashMap<>(), congruent);
    }

    private Substitution(Map<Variable, Term> map, boolean congruent) {
        this.map = map;
        this.congruent = congruent;
    }

    public static Substitution of(Variable var, Term term, boolean congruent) {
        Substitution sub = new Substitution(congruent);
        sub.put(var, term);
        return sub;
    }

    public Term getOrDefault(Variable var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public void put(Variable var, Term term) {
        if (var.sort() != term.sort()) {
            throw new IllegalArgumentException("Cannot bind " + var + " to " + term + " of sort " + term.sort());
        }
        map.put(var, term);
    }

    public boolean isCongruent() {
        return congruent;
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Map<Variable, Term> bindings() {
        return Map.copyOf(map);
    }

    public Substitution compose(Substitution other) {
        Map<Variable, Term> newMap = new LinkedHashMap<>();
        for (var e : other.map.entrySet()) {
            newMap.put(e.getKey(), e.getValue().applySub(this));
        }
        for (var e : map.entrySet()) {
            newMap.putIfAbsent(e.getKey(), e.getValue().applySub(other));
        }
        return new Substitution(newMap, congruent && other.congruent);
    }

    @Override
    public String toString() {
        return map.toString();
    }

    public Substitution copy() {
        return new Substitution(new LinkedHashMap<>(map), congruent);
    }
}
