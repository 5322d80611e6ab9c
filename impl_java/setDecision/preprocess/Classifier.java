package setDecision.preprocess;

import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Member;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.formula.SetRelation;
import fol.formula.Truth;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.DecidabilityTable;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * Stage 1. Introduces goal implications and negations, splits conjunctive hypotheses and drops
 * everything outside the set fragment. Dropping is never unsound; it may lose proofs that need
 * reasoning outside the fragment.
 */
public class Classifier implements PreprocessingStep {
    private static final Logger log = LogManager.getFormatterLogger();

    private final DecidabilityTable decidability;

    public Classifier(DecidabilityTable decidability) {
        this.decidability = decidability;
    }

    @Override
    public boolean apply(final Context context) {
        boolean changed = introduce(context);
        changed |= splitConjunctions(context);

        List<Hypothesis> kept = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            if (isRelevant(hypothesis.formula(), true)) {
                kept.add(hypothesis);
            } else {
                log.debug("Discarding %s: outside the set fragment", hypothesis);
                context.addRuleApplication(new Discard(hypothesis.name(), hypothesis.formula()));
                changed = true;
            }
        }
        context.setHypotheses(kept);

        if (!isRelevant(context.getGoal(), true)) {
            log.debug("Goal %s is outside the set fragment, refuting the hypotheses instead", context.getGoal());
            context.addRuleApplication(new Discard("goal", context.getGoal()));
            context.setGoal(Truth.FALSE);
            changed = true;
        }
        return changed;
    }

    /**
     * Checks that a formula is built from the supported grammar. Set relations are only accepted at
     * the top level of a hypothesis or goal, possibly under a single negation.
     *
     * @param formula  the formula to classify
     * @param topLevel whether the formula is a whole hypothesis or goal
     * @return whether the formula lies in the fragment
     */
    public boolean isRelevant(Formula formula, boolean topLevel) {
        if (formula instanceof Truth || formula instanceof Equals || formula instanceof Member) {
            return true;
        } else if (formula instanceof Predicate predicate) {
            return decidability.lookup(predicate).decidable();
        } else if (formula instanceof SetRelation) {
            return topLevel;
        } else if (formula instanceof Not not) {
            if (topLevel && not.formula() instanceof SetRelation) return true;
            return isRelevant(not.formula(), false);
        } else if (formula instanceof And and) {
            return isRelevant(and.left(), false) && isRelevant(and.right(), false);
        } else if (formula instanceof Or or) {
            return isRelevant(or.left(), false) && isRelevant(or.right(), false);
        } else if (formula instanceof Implies implies) {
            return isRelevant(implies.left(), false) && isRelevant(implies.right(), false);
        } else if (formula instanceof Iff iff) {
            return isRelevant(iff.left(), false) && isRelevant(iff.right(), false);
        } else if (formula instanceof Atom) {
            return false;
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    private boolean introduce(Context context) {
        boolean changed = false;
        while (true) {
            Formula goal = context.getGoal();
            Formula assumption;
            if (goal instanceof Implies implies) {
                assumption = implies.left();
                context.setGoal(implies.right());
            } else if (goal instanceof Not not) {
                assumption = not.formula();
                context.setGoal(Truth.FALSE);
            } else {
                return changed;
            }
            var hypothesis = new Hypothesis(context.freshHypothesisName("intro"), assumption);
            context.addHypothesis(hypothesis);
            context.addRuleApplication(new Intro(hypothesis.name(), goal, context.getGoal()));
            changed = true;
        }
    }

    private boolean splitConjunctions(Context context) {
        boolean changed = false;
        List<Hypothesis> split = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            if (hypothesis.formula() instanceof And) {
                List<Formula> conjuncts = new ArrayList<>();
                flatten(hypothesis.formula(), conjuncts);
                for (int i = 0; i < conjuncts.size(); i++) {
                    split.add(new Hypothesis(hypothesis.name() + "." + (i + 1), conjuncts.get(i)));
                }
                context.addRuleApplication(new Split(hypothesis.name(), hypothesis.formula(), conjuncts));
                changed = true;
            } else {
                split.add(hypothesis);
            }
        }
        context.setHypotheses(split);
        return changed;
    }

    private static void flatten(Formula formula, List<Formula> out) {
        if (formula instanceof And and) {
            flatten(and.left(), out);
            flatten(and.right(), out);
        } else {
            out.add(formula);
        }
    }

    public record Discard(String name, Formula input) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "Discard " + name + " : " + input;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }

    public record Intro(String name, Formula goal, Formula newGoal) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "Intro " + name + " : " + goal + " -> ⊢ " + newGoal;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }

    public record Split(String name, Formula input, List<Formula> output) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "AndSplit " + name + " : " + input + " -> " + output;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
