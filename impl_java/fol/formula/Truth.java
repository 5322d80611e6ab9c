package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.Set;

public record Truth(boolean value) implements Formula {
    public static final Truth TRUE = new Truth(true);
    public static final Truth FALSE = new Truth(false);

    @Override
    public Formula applySub(Substitution substitution) {
        return this;
    }

    @Override
    public String toString() {
        return value ? "⊤" : "⊥";
    }

    @Override
    public Set<Variable> freeVars() {
        return new HashSet<>();
    }

    @Override
    public Set<Atom> atoms() {
        return new HashSet<>();
    }

    @Override
    public Set<Term> elementTerms() {
        return Set.of();
    }

    @Override
    public int countNegations() {
        return 0;
    }

    @Override
    public int countLiterals() {
        return 0;
    }
}
