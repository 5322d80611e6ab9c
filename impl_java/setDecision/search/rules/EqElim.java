package setDecision.search.rules;

import fol.Substitution;
import fol.Unifier;
import fol.formula.Equals;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import setDecision.RuleApplication;
import setDecision.search.Branch;

/**
 * Rewrites the branch with an equality literal that binds a variable. The literal itself is kept.
 */
public class EqElim implements InferenceRule {
    @Override
    public boolean apply(final Branch branch) {
        var application = getRuleApplication(getEqs(branch), branch);
        if (application.isEmpty()) return false;
        branch.applySubstitution(application.get().sub(), application.get().input());
        branch.addRuleApplications(List.of(application.get()));
        return true;
    }

    public List<Equals> getEqs(Branch branch) {
        return branch.getFormulas().stream()
                .filter(Equals.class::isInstance)
                .map(Equals.class::cast)
                .filter(eq -> !branch.isReflexive(eq))
                .collect(Collectors.toList());
    }

    private Optional<EqElimRuleApplication> getRuleApplication(List<Equals> eqForms, Branch branch) {
        boolean congruent = branch.getSubstitution().isCongruent();
        for (Equals eq : eqForms) {
            var maybeSub = Unifier.unify(eq.left(), eq.right(), congruent);
            if (maybeSub.isEmpty())
                continue;
            var application = new EqElimRuleApplication(eq, maybeSub.get());
            if (branch.hasApplied(application))
                continue;
            return Optional.of(application);
        }
        return Optional.empty();
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    public record EqElimRuleApplication(Equals input, Substitution sub) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof EqElimRuleApplication other && input.equals(other.input);
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "EqElim : " + input + " -> " + sub;
        }

        @Override
        public int hashCode() {
            return input.hashCode();
        }
    }
}
