package setDecision;

import fol.formula.Formula;
import java.util.Objects;

/**
 * A context entry with a stable name, so that steps and certificates can refer back to it.
 */
public record Hypothesis(String name, Formula formula) {
    public Hypothesis {
        Objects.requireNonNull(name);
        Objects.requireNonNull(formula);
    }

    public Hypothesis withFormula(Formula newFormula) {
        return new Hypothesis(name, newFormula);
    }

    @Override
    public String toString() {
        return name + ": " + formula;
    }
}
