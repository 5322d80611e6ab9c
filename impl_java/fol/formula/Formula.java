package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.Set;

public sealed interface Formula permits Atom, And, Or, Not, Implies, Iff, Truth {
    Formula applySub(Substitution substitution);

    /**
     * Get a set of the current free variables inside the formula
     * @return set of free variables in the current formula
     */
    Set<Variable> freeVars();

    /**
     * Get every atom occurring in the formula, regardless of polarity.
     */
    Set<Atom> atoms();

    /**
     * Get the element terms occurring in element positions of the formula's atoms.
     */
    Set<Term> elementTerms();

    int countNegations();

    int countLiterals();
}
