package fol.formula;

import fol.Substitution;
import fol.TermEquivalence;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

/**
 * Equality between two element terms. Argument order is irrelevant for equality and hashing.
 */
public final class Equals implements Atom {
    private final Term left;
    private final Term right;

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    public Equals(Term left, Term right) {
        if (left.sort() != Sort.ELEMENT || right.sort() != Sort.ELEMENT) {
            throw new IllegalArgumentException("Element equality between non-elements: " + left + ", " + right);
        }
        this.left = left;
        this.right = right;
    }

    public boolean isReflexive() {
        return left.equals(right);
    }

    public boolean isReflexive(TermEquivalence equivalence) {
        return equivalence.same(left, right);
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Equals(left.applySub(substitution), right.applySub(substitution));
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
        return left + " = " + right;
    }

    @Override
    public int hashCode() {
        // Commutative, so that a = b and b = a hash alike
        return left.hashCode() + right.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Equals other)) return false;
        return left.equals(other.left) && right.equals(other.right)
                || left.equals(other.right) && right.equals(other.left);
    }
}
