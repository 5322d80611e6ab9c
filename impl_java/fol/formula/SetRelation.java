package fol.formula;

import fol.term.Term;

/**
 * A set-level atom that abbreviates a statement quantified over all elements.
 */
public sealed interface SetRelation extends Atom permits IsEmpty, Subset, SetEquals {
    /**
     * The body of the universal statement at the given element.
     *
     * @param element the element term to instantiate at
     * @return the quantifier-free instance
     */
    Formula instantiate(Term element);
}
