package fol.formula;

import fol.Substitution;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

public record IsEmpty(Term set) implements SetRelation {
    public IsEmpty {
        if (set.sort() != Sort.SET) {
            throw new IllegalArgumentException("Empty applied to a non-set: " + set);
        }
    }

    /** ∀x. ¬(x ∈ s) */
    @Override
    public Formula instantiate(Term element) {
        return new Not(new Member(element, set));
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new IsEmpty(set.applySub(substitution));
    }

    @Override
    public Set<Variable> freeVars() {
        return new HashSet<>(set.vars());
    }

    @Override
    public Set<Term> elementTerms() {
        return set.elementTerms();
    }

    @Override
    public String toString() {
        return "Empty(" + set + ")";
    }
}
