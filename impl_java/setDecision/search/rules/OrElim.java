package setDecision.search.rules;

import fol.formula.Or;
import java.util.List;
import java.util.Optional;
import setDecision.RuleApplication;
import setDecision.search.Branch;
import setDecision.search.Value;

/**
 * Splits on a disjunction neither side of which is decided on the branch.
 */
public class OrElim implements InferenceRule {

    @Override
    public boolean apply(Branch branch) {
        var or = getOr(branch);
        if (or.isEmpty()) return false;
        // Marks that the formula was already split, inherited by both children
        OrElimRuleApplication emptyApplication = new OrElimRuleApplication(or.get(), List.of());
        var leftExtension = branch.extend(or.get().left());
        var rightExtension = branch.extend(or.get().right());
        leftExtension.addRuleApplications(List.of(emptyApplication));
        rightExtension.addRuleApplications(List.of(emptyApplication));
        var application = new OrElimRuleApplication(or.get(), List.of(leftExtension, rightExtension));
        branch.addExtension(application, application.outputExtensions());
        branch.addRuleApplications(List.of(application));
        return true;
    }

    @Override
    public boolean isBranching() {
        return true;
    }

    private Optional<Or> getOr(Branch branch) {
        return branch.getFormulas().stream()
                .filter(Or.class::isInstance)
                .map(Or.class::cast)
                .filter(or -> !branch.hasApplied(new OrElimRuleApplication(or, List.of())))
                .filter(or -> branch.valueOf(or.left()) == Value.UNKNOWN && branch.valueOf(or.right()) == Value.UNKNOWN)
                .findFirst();
    }

    public record OrElimRuleApplication(Or input, List<Branch> outputExtensions) implements RuleApplication {
        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof OrElimRuleApplication other && input.equals(other.input);
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "OrElim : " + input;
        }

        @Override
        public int hashCode() {
            return input.hashCode();
        }
    }
}
