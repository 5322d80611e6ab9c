package fol;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.IsEmpty;
import fol.formula.Member;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.formula.SetEquals;
import fol.formula.Subset;
import fol.formula.Truth;
import fol.term.Term;
import java.util.List;

/**
 * Decides when two terms are the same expression. Two terms are the same iff their canonical forms
 * are equal records.
 * <p>
 * A non-structural equivalence must only identify terms that denote the same value under every
 * interpretation, otherwise verdicts become unsound.
 */
@FunctionalInterface
public interface TermEquivalence {

    /** Plain syntactic identity. */
    TermEquivalence STRUCTURAL = term -> term;

    /**
     * @return the representative of the term's class, of the same sort
     */
    Term canonical(Term term);

    default boolean same(Term left, Term right) {
        return left.equals(right) || canonical(left).equals(canonical(right));
    }

    /**
     * Replaces every term of the formula by its canonical form.
     */
    default Formula canonical(Formula formula) {
        if (this == STRUCTURAL || formula instanceof Truth) {
            return formula;
        } else if (formula instanceof Equals eq) {
            return new Equals(canonical(eq.left()), canonical(eq.right()));
        } else if (formula instanceof Member member) {
            return new Member(canonical(member.element()), canonical(member.set()));
        } else if (formula instanceof IsEmpty isEmpty) {
            return new IsEmpty(canonical(isEmpty.set()));
        } else if (formula instanceof Subset subset) {
            return new Subset(canonical(subset.left()), canonical(subset.right()));
        } else if (formula instanceof SetEquals setEq) {
            return new SetEquals(canonical(setEq.left()), canonical(setEq.right()));
        } else if (formula instanceof Predicate predicate) {
            List<Term> args = predicate.args().stream().map(this::canonical).toList();
            return new Predicate(predicate.symbol(), args);
        } else if (formula instanceof Not not) {
            return new Not(canonical(not.formula()));
        } else if (formula instanceof And and) {
            return new And(canonical(and.left()), canonical(and.right()));
        } else if (formula instanceof Or or) {
            return new Or(canonical(or.left()), canonical(or.right()));
        } else if (formula instanceof Implies implies) {
            return new Implies(canonical(implies.left()), canonical(implies.right()));
        } else if (formula instanceof Iff iff) {
            return new Iff(canonical(iff.left()), canonical(iff.right()));
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }
}
