package setDecision.search.rules;

import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import setDecision.RuleApplication;
import setDecision.search.Branch;

public class IffElim implements InferenceRule {

    @Override
    public boolean apply(final Branch branch) {
        Set<IffElimRuleApplication> applications = new LinkedHashSet<>();
        for (var formula : branch.getFormulas()) {
            if (!(formula instanceof Iff iff)) continue;
            List<Formula> products = List.of(new Implies(iff.left(), iff.right()), new Implies(iff.right(), iff.left()));
            if (products.stream().allMatch(branch::contains)) continue;
            applications.add(new IffElimRuleApplication(iff, products));
        }
        if (applications.isEmpty()) return false;
        applications.forEach(a -> branch.addFormulas(a.output()));
        branch.addRuleApplications(applications);
        return true;
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    public record IffElimRuleApplication(Iff input, List<Formula> output) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "IffElim : " + input + " -> " + output;
        }
    }
}
