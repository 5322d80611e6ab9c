package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.Set;

/**
 * An opaque symbol. Unlike a {@link Variable} it is never eliminated by substitution.
 */
public record Constant(String name, Sort sort) implements Term {
    @Override
    public Term applySub(Substitution substitution) {
        return this;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>();
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
