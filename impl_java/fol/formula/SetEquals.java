package fol.formula;

import fol.Substitution;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

/**
 * Extensional equality of two sets. Symmetric, like {@link Equals}.
 */
public final class SetEquals implements SetRelation {
    private final Term left;
    private final Term right;

    public SetEquals(Term left, Term right) {
        if (left.sort() != Sort.SET || right.sort() != Sort.SET) {
            throw new IllegalArgumentException("Set equality between non-sets: " + left + ", " + right);
        }
        this.left = left;
        this.right = right;
    }

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    /** ∀x. x ∈ s₁ ↔ x ∈ s₂ */
    @Override
    public Formula instantiate(Term element) {
        return new Iff(new Member(element, left), new Member(element, right));
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new SetEquals(left.applySub(substitution), right.applySub(substitution));
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
        return left + " ≡ " + right;
    }

    @Override
    public int hashCode() {
        return left.hashCode() + right.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SetEquals other)) return false;
        return left.equals(other.left) && right.equals(other.right)
                || left.equals(other.right) && right.equals(other.left);
    }
}
