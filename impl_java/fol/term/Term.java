package fol.term;

import fol.Substitution;

import java.util.Set;

public sealed interface Term permits Constant, Function, SetExpr, Variable {
    Term applySub(Substitution substitution);

    Sort sort();

    Set<Variable> vars();

    /**
     * Get the element terms sitting in element positions of this term. Opaque function
     * applications of element sort count as a single term; their arguments are not visited.
     *
     * @return element terms of the term
     */
    Set<Term> elementTerms();

    /**
     * Number of nested set constructors. Each set-operator rewrite produces memberships in sets of
     * strictly smaller depth.
     */
    int depth();
}
