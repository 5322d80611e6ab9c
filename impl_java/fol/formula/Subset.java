package fol.formula;

import fol.Substitution;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

public record Subset(Term left, Term right) implements SetRelation {
    public Subset {
        if (left.sort() != Sort.SET || right.sort() != Sort.SET) {
            throw new IllegalArgumentException("Ill-sorted subset: " + left + " ⊆ " + right);
        }
    }

    /** ∀x. x ∈ s₁ → x ∈ s₂ */
    @Override
    public Formula instantiate(Term element) {
        return new Implies(new Member(element, left), new Member(element, right));
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Subset(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = new HashSet<>(left.vars());
        out.addAll(right.vars());
        return out;
    }

    @Override
    public Set<Term> elementTerms() {
        Set<Term> out = new HashSet<>(left.elementTerms());
        out.addAll(right.elementTerms());
        return out;
    }

    @Override
    public String toString() {
        return left + " ⊆ " + right;
    }
}
