package fol.formula;

import java.util.HashSet;
import java.util.Set;

public sealed interface Atom extends Formula permits Equals, Member, Predicate, SetRelation {
    @Override
    default Set<Atom> atoms() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    default int countNegations() {
        return 0;
    }

    @Override
    default int countLiterals() {
        return 1;
    }
}
