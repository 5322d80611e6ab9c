package setDecision;

import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.IsEmpty;
import fol.formula.Member;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.formula.SetEquals;
import fol.formula.Subset;
import fol.formula.Truth;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps atom shapes to a decidability verdict. Classically valid negation rewrites consult this table
 * before they fire. Compound formulas are decidable when all of their atoms are.
 * <p>
 * Callers extend the table with their own predicate symbols; the built-in atom kinds cannot be
 * withdrawn.
 */
public class DecidabilityTable {
    private final Map<Class<? extends Atom>, Decidability> atomKinds;
    private final Map<PSymbol, Decidability> predicates;

    private DecidabilityTable(Map<Class<? extends Atom>, Decidability> atomKinds, Map<PSymbol, Decidability> predicates) {
        this.atomKinds = atomKinds;
        this.predicates = predicates;
    }

    public static DecidabilityTable standard() {
        Map<Class<? extends Atom>, Decidability> kinds = new HashMap<>();
        kinds.put(Equals.class, Decidability.decidable("element equality is decidable"));
        kinds.put(Member.class, Decidability.decidable("membership in a finite set is decidable"));
        kinds.put(IsEmpty.class, Decidability.decidable("emptiness of a finite set is decidable"));
        kinds.put(Subset.class, Decidability.decidable("inclusion of finite sets is decidable"));
        kinds.put(SetEquals.class, Decidability.decidable("extensional equality of finite sets is decidable"));
        return new DecidabilityTable(kinds, new HashMap<>());
    }

    /**
     * @return a copy of this table that also treats atoms built from {@code symbol} as decidable
     */
    public DecidabilityTable withDecidable(PSymbol symbol, String reason) {
        Objects.requireNonNull(symbol);
        Map<PSymbol, Decidability> newPredicates = new HashMap<>(predicates);
        newPredicates.put(symbol, Decidability.decidable(reason));
        return new DecidabilityTable(atomKinds, newPredicates);
    }

    public Decidability lookup(Atom atom) {
        if (atom instanceof Predicate predicate) {
            return predicates.getOrDefault(predicate.symbol(),
                    Decidability.undecidable("no decidability entry for " + predicate.symbol()));
        }
        return atomKinds.getOrDefault(atom.getClass(),
                Decidability.undecidable("no decidability entry for " + atom.getClass().getSimpleName()));
    }

    public Decidability of(Formula formula) {
        if (formula instanceof Truth) {
            return Decidability.decidable("constant");
        } else if (formula instanceof Atom atom) {
            return lookup(atom);
        } else if (formula instanceof Not not) {
            return of(not.formula());
        } else if (formula instanceof And and) {
            return both(of(and.left()), of(and.right()));
        } else if (formula instanceof Or or) {
            return both(of(or.left()), of(or.right()));
        } else if (formula instanceof Implies implies) {
            return both(of(implies.left()), of(implies.right()));
        } else if (formula instanceof Iff iff) {
            return both(of(iff.left()), of(iff.right()));
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    public boolean isDecidable(Formula formula) {
        return of(formula).decidable();
    }

    private static Decidability both(Decidability left, Decidability right) {
        if (!left.decidable()) return left;
        if (!right.decidable()) return right;
        return Decidability.decidable("connective over decidable formulas");
    }
}
