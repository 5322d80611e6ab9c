package fol.term;

import java.util.List;

public enum SetOperator {
    EMPTY(List.of()),
    SINGLETON(List.of(Sort.ELEMENT)),
    ADD(List.of(Sort.ELEMENT, Sort.SET)),
    REMOVE(List.of(Sort.ELEMENT, Sort.SET)),
    UNION(List.of(Sort.SET, Sort.SET)),
    INTER(List.of(Sort.SET, Sort.SET)),
    DIFF(List.of(Sort.SET, Sort.SET));

    private final List<Sort> signature;

    SetOperator(List<Sort> signature) {
        this.signature = signature;
    }

    public List<Sort> signature() {
        return signature;
    }

    public int arity() {
        return signature.size();
    }

    String render(List<Term> args) {
        switch (this) {
            case EMPTY:
                return "∅";
            case SINGLETON:
                return "{" + args.get(0) + "}";
            case ADD:
                return "add(" + args.get(0) + ", " + args.get(1) + ")";
            case REMOVE:
                return "remove(" + args.get(0) + ", " + args.get(1) + ")";
            case UNION:
                return "(" + args.get(0) + " ∪ " + args.get(1) + ")";
            case INTER:
                return "(" + args.get(0) + " ∩ " + args.get(1) + ")";
            case DIFF:
                return "(" + args.get(0) + " \\ " + args.get(1) + ")";
            default:
                throw new IllegalStateException("Unexpected set operator: " + this);
        }
    }
}
