package fol.term;

import fol.Substitution;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record SetExpr(SetOperator op, List<Term> args) implements Term {
    public SetExpr {
        if (op.arity() != args.size()) {
            throw new IllegalArgumentException(op + " expects " + op.arity() + " arguments, got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).sort() != op.signature().get(i)) {
                throw new IllegalArgumentException(op + " argument " + i + " must be of sort "
                        + op.signature().get(i) + ": " + args.get(i));
            }
        }
        args = List.copyOf(args);
    }

    public Term arg(int index) {
        return args.get(index);
    }

    @Override
    public Term applySub(Substitution substitution) {
        List<Term> newArgs = args.stream().map(t -> t.applySub(substitution)).toList();
        return new SetExpr(op, newArgs);
    }

    @Override
    public Sort sort() {
        return Sort.SET;
    }

    @Override
    public String toString() {
        return op.render(args);
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = new HashSet<>();
        for (Term t : args) out.addAll(t.vars());
        return out;
    }

    @Override
    public Set<Term> elementTerms() {
        Set<Term> out = new HashSet<>();
        for (Term t : args) out.addAll(t.elementTerms());
        return out;
    }

    @Override
    public int depth() {
        int max = 0;
        for (Term t : args) max = Math.max(max, t.depth());
        return max + 1;
    }
}
