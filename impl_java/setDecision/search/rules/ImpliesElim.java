package setDecision.search.rules;

import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import setDecision.RuleApplication;
import setDecision.search.Branch;
import setDecision.search.Value;

/**
 * Modus ponens, and modus tollens once the consequent is refuted.
 */
public class ImpliesElim implements InferenceRule {

    @Override
    public boolean apply(final Branch branch) {
        Set<ImpliesElimRuleApplication> applications = new LinkedHashSet<>();
        for (var formula : branch.getFormulas()) {
            if (!(formula instanceof Implies implies)) continue;
            getOutput(implies, branch)
                    .filter(output -> !branch.contains(output))
                    .ifPresent(output -> applications.add(new ImpliesElimRuleApplication(implies, output)));
        }
        if (applications.isEmpty()) return false;
        applications.forEach(a -> branch.addFormulas(Set.of(a.output())));
        branch.addRuleApplications(applications);
        return true;
    }

    private Optional<Formula> getOutput(Implies implies, Branch branch) {
        Value antecedent = branch.valueOf(implies.left());
        if (antecedent == Value.TRUE) {
            return Optional.of(implies.right());
        }
        if (antecedent == Value.UNKNOWN && branch.valueOf(implies.right()) == Value.FALSE) {
            return Optional.of(new Not(implies.left()));
        }
        return Optional.empty();
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    public record ImpliesElimRuleApplication(Implies input, Formula output) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "ImpliesElim : " + input + " -> " + output;
        }
    }
}
