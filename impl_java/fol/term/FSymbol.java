package fol.term;

public record FSymbol(String name, int arity, Sort sort) {
    public String toString() {
        return name + "\\" + arity;
    }
}
