package fol;

import java.util.Optional;

import fol.term.Term;
import fol.term.Variable;

/**
 * Solves a single equation between terms by binding a variable. Function symbols are uninterpreted,
 * so {@code f(a) = f(b)} says nothing about {@code a} and {@code b}: there is no decomposition.
 */
public class Unifier {
    public static Optional<Substitution> unify(Term t1, Term t2, boolean congruent) {
        return unify(t1, t2, new Substitution(congruent));
    }

    public static Optional<Substitution> unify(Term t1, Term t2, Substitution theta) {
        t1 = t1.applySub(theta);
        t2 = t2.applySub(theta);

        if (t1.equals(t2)) {
            return Optional.of(theta);
        } else if (t1 instanceof Variable var && !occursCheck(var, t2)) {
            return Optional.of(bind(var, t2, theta));
        } else if (t2 instanceof Variable var && !occursCheck(var, t1)) {
            return Optional.of(bind(var, t1, theta));
        } else {
            return Optional.empty();
        }
    }

    private static Substitution bind(Variable var, Term term, Substitution theta) {
        Substitution sigma = new Substitution(theta.isCongruent());
        sigma.put(var, term);
        return theta.compose(sigma);
    }

    static boolean occursCheck(Variable var, Term term) {
        return term.vars().contains(var);
    }
}
