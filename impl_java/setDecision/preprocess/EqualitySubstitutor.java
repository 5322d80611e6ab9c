package setDecision.preprocess;

import fol.Substitution;
import fol.Unifier;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.SetEquals;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * Stage 5. Eliminates variables bound by equality hypotheses.
 * <p>
 * With Leibniz equality the hypothesis is consumed, and set equalities with a variable side are
 * eliminated as well. With setoid equality the substitution leaves opaque applications alone, so the
 * hypothesis is kept as long as the variable still occurs somewhere.
 */
public class EqualitySubstitutor implements PreprocessingStep {
    private static final Logger log = LogManager.getFormatterLogger();

    @Override
    public boolean apply(final Context context) {
        boolean changed = false;
        Optional<Elimination> elimination;
        while ((elimination = eliminateOne(context)).isPresent()) {
            context.addRuleApplication(elimination.get());
            changed = true;
        }
        return changed;
    }

    private Optional<Elimination> eliminateOne(Context context) {
        boolean congruent = context.getOptions().congruentSubstitution();
        for (var hypothesis : context.getHypotheses()) {
            if (context.getAppliedEliminations().contains(hypothesis.formula())) continue;
            Optional<Substitution> sub = solve(hypothesis.formula(), congruent);
            if (sub.isEmpty()) continue;
            return Optional.of(eliminate(context, hypothesis, sub.get()));
        }
        return Optional.empty();
    }

    /**
     * @return the substitution that makes both sides of the equation syntactically equal, if the
     * formula is an equation that can be solved by binding a variable
     */
    public static Optional<Substitution> solve(Formula formula, boolean congruent) {
        if (formula instanceof Equals equals && !equals.isReflexive()) {
            return Unifier.unify(equals.left(), equals.right(), congruent).filter(s -> !s.isEmpty());
        } else if (formula instanceof SetEquals equals && congruent) {
            return Unifier.unify(equals.left(), equals.right(), true).filter(s -> !s.isEmpty());
        }
        return Optional.empty();
    }

    private Elimination eliminate(Context context, Hypothesis hypothesis, Substitution sub) {
        context.applySubstitution(sub, hypothesis);

        List<Hypothesis> others = new ArrayList<>(context.getHypotheses());
        others.remove(hypothesis);
        context.setHypotheses(others);

        boolean kept = false;
        if (!sub.isCongruent()) {
            for (Variable var : sub.bindings().keySet()) {
                if (context.occurs(var)) {
                    kept = true;
                    break;
                }
            }
        }
        if (kept) {
            others.add(hypothesis);
            context.setHypotheses(others);
            context.getAppliedEliminations().add(hypothesis.formula());
        }
        log.debug("Eliminated %s using %s%s", sub, hypothesis.name(), kept ? " (kept)" : "");
        return new Elimination(hypothesis.name(), hypothesis.formula(), sub, kept);
    }

    public record Elimination(String name, Formula input, Substitution substitution, boolean kept) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "EqElim " + name + " : " + input + " -> " + substitution
                    + (kept ? " (kept)" : "");
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
