package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

public record Iff(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Iff(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public String toString() {
        return "(" + left + " ↔ " + right + ")";
    }

    @Override
    public int countLiterals() {
        return left.countLiterals() + right.countLiterals();
    }

    @Override
    public int countNegations() {
        return left.countNegations() + right.countNegations();
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }

    @Override
    public Set<Atom> atoms() {
        Set<Atom> out = left.atoms();
        out.addAll(right.atoms());
        return out;
    }

    @Override
    public Set<Term> elementTerms() {
        Set<Term> out = new HashSet<>(left.elementTerms());
        out.addAll(right.elementTerms());
        return out;
    }
}
