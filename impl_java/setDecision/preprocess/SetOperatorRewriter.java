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
import fol.formula.Truth;
import fol.term.SetExpr;
import fol.term.Term;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * Stage 3. Replaces membership in a compound set by a Boolean combination of memberships in its
 * operands, until every membership atom ranges over an atomic set. Every rule lowers the constructor
 * depth of the set argument, so the rewrite terminates.
 */
public class SetOperatorRewriter implements PreprocessingStep {

    @Override
    public boolean apply(final Context context) {
        boolean changed = false;
        List<Hypothesis> updated = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            Formula rewritten = rewrite(hypothesis.formula());
            if (!rewritten.equals(hypothesis.formula())) {
                context.addRuleApplication(new Rewrite(hypothesis.name(), hypothesis.formula(), rewritten));
                changed = true;
            }
            updated.add(hypothesis.withFormula(rewritten));
        }
        context.setHypotheses(updated);

        Formula goal = context.getGoal();
        Formula rewrittenGoal = rewrite(goal);
        if (!rewrittenGoal.equals(goal)) {
            context.addRuleApplication(new Rewrite("goal", goal, rewrittenGoal));
            context.setGoal(rewrittenGoal);
            changed = true;
        }
        return changed;
    }

    /**
     * Rewrites every membership atom of the formula to normal form.
     */
    public Formula rewrite(Formula formula) {
        if (formula instanceof Member member) {
            return rewriteMember(member).map(this::rewrite).orElse(member);
        } else if (formula instanceof Atom || formula instanceof Truth) {
            return formula;
        } else if (formula instanceof Not not) {
            return new Not(rewrite(not.formula()));
        } else if (formula instanceof And and) {
            return new And(rewrite(and.left()), rewrite(and.right()));
        } else if (formula instanceof Or or) {
            return new Or(rewrite(or.left()), rewrite(or.right()));
        } else if (formula instanceof Implies implies) {
            return new Implies(rewrite(implies.left()), rewrite(implies.right()));
        } else if (formula instanceof Iff iff) {
            return new Iff(rewrite(iff.left()), rewrite(iff.right()));
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    /**
     * Applies the rewrite rule of the outermost set constructor once.
     *
     * @param member the membership atom
     * @return the equivalent formula, or empty if the set argument is not a constructor application
     */
    public Optional<Formula> rewriteMember(Member member) {
        if (!(member.set() instanceof SetExpr set)) {
            return Optional.empty();
        }
        Term x = member.element();
        switch (set.op()) {
            case EMPTY:
                return Optional.of(Truth.FALSE);
            case SINGLETON:
                return Optional.of(new Equals(x, set.arg(0)));
            case ADD:
                return Optional.of(new Or(new Equals(x, set.arg(0)), new Member(x, set.arg(1))));
            case REMOVE:
                return Optional.of(new And(new Not(new Equals(x, set.arg(0))), new Member(x, set.arg(1))));
            case UNION:
                return Optional.of(new Or(new Member(x, set.arg(0)), new Member(x, set.arg(1))));
            case INTER:
                return Optional.of(new And(new Member(x, set.arg(0)), new Member(x, set.arg(1))));
            case DIFF:
                return Optional.of(new And(new Member(x, set.arg(0)), new Not(new Member(x, set.arg(1)))));
            default:
                throw new IllegalStateException("Unexpected set operator: " + set.op());
        }
    }

    public record Rewrite(String name, Formula input, Formula output) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "SetRewrite " + name + " : " + input + " -> " + output;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
