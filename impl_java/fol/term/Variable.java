package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

public record Variable(String name, Sort sort) implements Term {

    /**
     * Creates a variable whose name is not in {@code taken} and records the new name there.
     */
    public static Variable fresh(String prefix, Sort sort, Set<String> taken) {
        int num = 1;
        while (taken.contains(prefix + num)) {
            ++num;
        }
        String name = prefix + num;
        taken.add(name);
        return new Variable(name, sort);
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public Set<Term> elementTerms() {
        return sort == Sort.ELEMENT ? Set.of(this) : Set.of();
    }

    @Override
    public int depth() {
        return 0;
    }
}
