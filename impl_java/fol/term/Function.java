package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Application of an uninterpreted function symbol. Equal arguments are only ever exploited through
 * substitution; there is no congruence closure.
 */
public record Function(FSymbol symbol, List<Term> args) implements Term {
    public Function {
        if (symbol.arity() != args.size()) {
            throw new IllegalArgumentException(symbol + " applied to " + args.size() + " arguments");
        }
        args = List.copyOf(args);
    }

    @Override
    public Term applySub(Substitution substitution) {
        if (!substitution.isCongruent()) return this;
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new Function(symbol, newArgs);
    }

    public String name() {
        return symbol.name();
    }

    @Override
    public Sort sort() {
        return symbol.sort();
    }

    @Override
    public String toString() {
        return symbol.name() + "(" + String.join(", ", args.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> vars() {
        return args.stream()
                .map(Term::vars)
                .reduce(new HashSet<>(), (set1, set2) -> {
                    set1.addAll(set2);
                    return set1;
                });
    }

    @Override
    public Set<Term> elementTerms() {
        return sort() == Sort.ELEMENT ? Set.of(this) : Set.of();
    }

    @Override
    public int depth() {
        return 0;
    }
}
