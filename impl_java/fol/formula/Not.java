package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.Set;

public record Not(Formula formula) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public String toString() {
        return "¬" + formula;
    }

    @Override
    public int countLiterals() {
        return formula.countLiterals();
    }

    @Override
    public int countNegations() {
        return 1 + formula.countNegations();
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public Set<Atom> atoms() {
        return formula.atoms();
    }

    @Override
    public Set<Term> elementTerms() {
        return formula.elementTerms();
    }
}
