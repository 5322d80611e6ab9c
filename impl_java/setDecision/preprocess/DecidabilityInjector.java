package setDecision.preprocess;

import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Truth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.DecidabilityTable;
import setDecision.RuleApplication;

/**
 * Stage 6. Records {@code A ∨ ¬A} for every decidable atom that occurs negatively, so that the
 * closure search may split on it.
 */
public class DecidabilityInjector implements PreprocessingStep {
    private static final Logger log = LogManager.getFormatterLogger();

    private final DecidabilityTable decidability;

    public DecidabilityInjector(DecidabilityTable decidability) {
        this.decidability = decidability;
    }

    @Override
    public boolean apply(final Context context) {
        Set<Atom> candidates = new LinkedHashSet<>();
        for (var hypothesis : context.getHypotheses()) {
            candidates.addAll(negativeAtoms(hypothesis.formula()));
        }
        candidates.addAll(negativeAtoms(new Not(context.getGoal())));

        List<Atom> injected = new ArrayList<>();
        for (Atom atom : candidates) {
            if (atom instanceof Equals equals && equals.isReflexive(context.getOptions().termEquivalence())) continue;
            if (!decidability.isDecidable(atom)) {
                log.debug("Not injecting %s: %s", atom, decidability.lookup(atom).reason());
                continue;
            }
            if (context.contains(atom) || context.contains(new Not(atom))) continue;
            if (context.getDecidabilityFacts().add(atom)) injected.add(atom);
        }
        if (injected.isEmpty()) return false;
        context.addRuleApplication(new Injection(injected));
        return true;
    }

    /**
     * Atoms that occur under a negation, in the antecedent of an implication, or inside an equivalence.
     */
    public static Set<Atom> negativeAtoms(Formula formula) {
        Set<Atom> out = new LinkedHashSet<>();
        collect(formula, false, out);
        return out;
    }

    private static void collect(Formula formula, boolean negative, Set<Atom> out) {
        if (formula instanceof Atom atom) {
            if (negative) out.add(atom);
        } else if (formula instanceof Not not) {
            collect(not.formula(), true, out);
        } else if (formula instanceof And and) {
            collect(and.left(), negative, out);
            collect(and.right(), negative, out);
        } else if (formula instanceof Or or) {
            collect(or.left(), negative, out);
            collect(or.right(), negative, out);
        } else if (formula instanceof Implies implies) {
            collect(implies.left(), true, out);
            collect(implies.right(), negative, out);
        } else if (formula instanceof Iff iff) {
            collect(iff.left(), true, out);
            collect(iff.right(), true, out);
        } else if (!(formula instanceof Truth)) {
            throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
        }
    }

    public record Injection(List<Atom> atoms) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "Decidable " + atoms;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
