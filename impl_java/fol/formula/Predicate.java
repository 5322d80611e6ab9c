package fol.formula;

import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A caller-supplied atom outside the set grammar. It takes part in the decision only when the
 * decidability table vouches for its symbol.
 */
public final class Predicate implements Atom {

    private final PSymbol symbol;
    private final List<Term> args;

    public Predicate(PSymbol symbol, List<Term> args) {
        if (symbol.arity() != args.size()) {
            throw new IllegalArgumentException(symbol + " applied to " + args.size() + " arguments");
        }
        this.symbol = symbol;
        this.args = List.copyOf(args);
    }

    public Predicate(String symbolStr, List<Term> args) {
        this(new PSymbol(symbolStr, args.size()), args);
    }

    public PSymbol symbol() {
        return symbol;
    }

    public List<Term> args() {
        return args;
    }

    @Override
    public Formula applySub(Substitution substitution) {
        if (!substitution.isCongruent()) return this;
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Predicate(symbol, newArgs);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return symbol.name();
        }
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> freeVars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public Set<Term> elementTerms() {
        return Set.of();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Predicate other)) return false;
        return symbol.equals(other.symbol) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
