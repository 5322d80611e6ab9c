package setDecision.search.rules;

import fol.formula.Formula;
import fol.formula.Or;
import java.util.LinkedHashSet;
import java.util.Set;
import setDecision.RuleApplication;
import setDecision.search.Branch;
import setDecision.search.Value;

/**
 * A disjunction with one refuted side asserts the other side.
 */
public class UnitOrElim implements InferenceRule {

    @Override
    public boolean apply(final Branch branch) {
        Set<UnitOrElimRuleApplication> applications = new LinkedHashSet<>();
        for (var formula : branch.getFormulas()) {
            if (!(formula instanceof Or or)) continue;
            Formula output = null;
            if (branch.valueOf(or.left()) == Value.FALSE) {
                output = or.right();
            } else if (branch.valueOf(or.right()) == Value.FALSE) {
                output = or.left();
            }
            if (output != null && !branch.contains(output)) {
                applications.add(new UnitOrElimRuleApplication(or, output));
            }
        }
        if (applications.isEmpty()) return false;
        applications.forEach(a -> branch.addFormulas(Set.of(a.output())));
        branch.addRuleApplications(applications);
        return true;
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    public record UnitOrElimRuleApplication(Or input, Formula output) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "UnitOrElim : " + input + " -> " + output;
        }
    }
}
