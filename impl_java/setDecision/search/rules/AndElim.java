package setDecision.search.rules;

import fol.formula.And;
import fol.formula.Formula;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import setDecision.RuleApplication;
import setDecision.search.Branch;

public class AndElim implements InferenceRule {

    @Override
    public boolean apply(final Branch branch) {
        var applications = getRuleApplications(getAnds(branch), branch);
        if (applications.isEmpty()) return false;
        branch.addFormulas(
                applications.stream()
                        .map(AndElimRuleApplication::output)
                        .flatMap(Collection::stream)
                        .collect(Collectors.toCollection(LinkedHashSet::new))
        );
        branch.addRuleApplications(applications);
        return true;
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    private Set<AndElimRuleApplication> getRuleApplications(Set<And> ands, Branch branch) {
        Set<Formula> allProducts = new HashSet<>();
        Set<AndElimRuleApplication> applications = new LinkedHashSet<>();
        for (And and : ands) {
            Set<Formula> products = new LinkedHashSet<>();
            for (Formula part : new Formula[]{and.left(), and.right()}) {
                if (!branch.contains(part) && allProducts.add(part)) {
                    products.add(part);
                }
            }
            if (!products.isEmpty()) {
                applications.add(new AndElimRuleApplication(and, products));
            }
        }
        return applications;
    }

    private Set<And> getAnds(Branch branch) {
        return branch.getFormulas().stream()
                .filter(And.class::isInstance)
                .map(And.class::cast)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public record AndElimRuleApplication(And input, Set<Formula> output) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof AndElimRuleApplication other && input.equals(other.input);
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "AndElim : " + input + " -> " + output;
        }

        @Override
        public int hashCode() {
            return input.hashCode();
        }
    }
}
