package fol.formula;

import fol.Substitution;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

public record Member(Term element, Term set) implements Atom {
    public Member {
        if (element.sort() != Sort.ELEMENT || set.sort() != Sort.SET) {
            throw new IllegalArgumentException("Ill-sorted membership: " + element + " ∈ " + set);
        }
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Member(element.applySub(substitution), set.applySub(substitution));
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new HashSet<>(element.vars());
        out.addAll(set.vars());
        return out;
    }

    @Override
    public Set<Term> elementTerms() {
        Set<Term> out = new HashSet<>(element.elementTerms());
        out.addAll(set.elementTerms());
        return out;
    }

    @Override
    public String toString() {
        return element + " ∈ " + set;
    }
}
