package setDecision.search.rules;

import fol.formula.Formula;
import fol.formula.Not;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import setDecision.RuleApplication;
import setDecision.preprocess.NegationNormalizer;
import setDecision.search.Branch;

/**
 * Moves a negation one level down, with the same decidability gates as the normalizer.
 */
public class NotElim implements InferenceRule {
    private final NegationNormalizer normalizer;

    public NotElim(NegationNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public boolean apply(Branch branch) {
        Set<NotElimRuleApplication> applications = getRuleApplications(getNots(branch), branch);
        if (applications.isEmpty()) return false;
        branch.addFormulas(
                applications.stream()
                        .map(NotElimRuleApplication::output)
                        .collect(Collectors.toCollection(LinkedHashSet::new))
        );
        branch.addRuleApplications(applications);
        return true;
    }

    @Override
    public boolean isBranching() {
        return false;
    }

    private Set<NotElimRuleApplication> getRuleApplications(Set<Not> nots, Branch branch) {
        Set<Formula> allProducts = new HashSet<>();
        Set<NotElimRuleApplication> applications = new LinkedHashSet<>();
        for (Not not : nots) {
            var maybeOutput = normalizer.pushStep(not);
            if (maybeOutput.isEmpty()) continue;
            Formula output = maybeOutput.get();
            if (!branch.contains(output) && allProducts.add(output)) {
                applications.add(new NotElimRuleApplication(not, output));
            }
        }
        return applications;
    }

    private Set<Not> getNots(Branch branch) {
        return branch.getFormulas().stream()
                .filter(Not.class::isInstance)
                .map(Not.class::cast)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public record NotElimRuleApplication(Not input, Formula output) implements RuleApplication {

        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof NotElimRuleApplication other && input.equals(other.input);
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "NotElim : " + input + " -> " + output;
        }

        @Override
        public int hashCode() {
            return input.hashCode();
        }
    }
}
