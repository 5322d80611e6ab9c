package setDecision.search.closure;

import fol.formula.Formula;
import setDecision.RuleApplication;

/**
 * Why a branch is contradictory.
 *
 * @param reason  which check found the contradiction
 * @param witness the formula that is contradicted
 */
public record Closure(Reason reason, Formula witness) implements RuleApplication {

    public enum Reason {
        /** {@code ¬(t = t)} */
        REFLEXIVITY,
        /** Both {@code A} and {@code ¬A}, or {@code ⊥}. */
        DIRECT_CONTRADICTION,
        /** A formula whose parts are decided so as to make it false. */
        REFUTATION
    }

    @Override
    public String getString(int indentation, String delim) {
        return RuleApplication.indent(indentation, delim) + "Closed by " + reason + " : " + witness;
    }

    @Override
    public String toString() {
        return getString(0, "");
    }
}
