package setDecision.preprocess;

import fol.Unifier;
import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.SetEquals;
import fol.formula.SetRelation;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * Stage 2. Reads {@code Empty}, {@code Subset} and {@code SetEq} as statements about all elements.
 * Universal hypotheses are instantiated at every term of the relevant-element-set; negated ones and
 * a universal goal are replaced by their instance at a fresh witness.
 * <p>
 * Universal statements are kept aside after their first round so that later rounds can instantiate
 * them at terms that appear only after rewriting or substitution.
 */
public class QuantifierInstantiator implements PreprocessingStep {
    private static final Logger log = LogManager.getFormatterLogger();

    @Override
    public boolean apply(final Context context) {
        boolean changed = introduceWitnesses(context);

        List<Hypothesis> remaining = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            if (hypothesis.formula() instanceof SetRelation relation && !isEliminable(relation, context)) {
                context.addUniversal(hypothesis.name(), relation);
                changed = true;
            } else {
                remaining.add(hypothesis);
            }
        }
        context.setHypotheses(remaining);

        List<Term> terms = context.relevantElements();
        for (var universal : context.getUniversals()) {
            Map<Term, Formula> instances = new LinkedHashMap<>();
            for (Term term : terms) {
                if (!universal.instantiatedAt().add(term)) continue;
                Formula instance = universal.relation().instantiate(term);
                if (context.addHypothesis(new Hypothesis(universal.name() + "@" + term, instance))) {
                    instances.put(term, instance);
                }
            }
            if (instances.isEmpty()) continue;
            log.debug("Instantiated %s at %d terms", universal.relation(), instances.size());
            context.addRuleApplication(new Instantiation(universal.name(), universal.relation(), instances));
            changed = true;
        }
        return changed;
    }

    /**
     * A top-level set equality with a variable side is left to the substitutor when substitution is
     * congruent, since eliminating the variable subsumes all of its instances.
     */
    static boolean isEliminable(SetRelation relation, Context context) {
        if (!(relation instanceof SetEquals equals) || !context.getOptions().congruentSubstitution()) {
            return false;
        }
        return Unifier.unify(equals.left(), equals.right(), true)
                .filter(sub -> !sub.isEmpty())
                .isPresent();
    }

    private boolean introduceWitnesses(Context context) {
        boolean changed = false;
        if (context.getGoal() instanceof SetRelation relation) {
            Variable witness = context.freshElement();
            Formula instance = relation.instantiate(witness);
            context.setGoal(instance);
            context.addRuleApplication(new Witness("goal", relation, witness, instance));
            changed = true;
        }
        List<Hypothesis> updated = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            if (hypothesis.formula() instanceof Not not && not.formula() instanceof SetRelation relation) {
                Variable witness = context.freshElement();
                Formula instance = new Not(relation.instantiate(witness));
                updated.add(hypothesis.withFormula(instance));
                context.addRuleApplication(new Witness(hypothesis.name(), hypothesis.formula(), witness, instance));
                changed = true;
            } else {
                updated.add(hypothesis);
            }
        }
        context.setHypotheses(updated);
        return changed;
    }

    public record Instantiation(String name, SetRelation input, Map<Term, Formula> outputFormulas) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "∀Elim " + name + " : " + input + " -> " + outputFormulas;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }

    public record Witness(String name, Formula input, Variable witness, Formula output) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "∃Elim " + name + " : " + input + " -> " + witness + ": " + output;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
