package setDecision.search.rules;

import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Formula;
import fol.formula.Not;
import java.util.List;
import java.util.Optional;
import setDecision.RuleApplication;
import setDecision.search.Branch;
import setDecision.search.Value;

/**
 * Case split {@code A ∨ ¬A} on an injected decidability fact. A fact is only used once it matters,
 * i.e. while some undecided compound formula of the branch mentions it.
 */
public class DecidabilitySplit implements InferenceRule {

    @Override
    public boolean apply(Branch branch) {
        var atom = getAtom(branch);
        if (atom.isEmpty()) return false;
        var positive = branch.extend(atom.get());
        var negative = branch.extend(new Not(atom.get()));
        positive.getDecidabilityFacts().remove(atom.get());
        negative.getDecidabilityFacts().remove(atom.get());
        var application = new DecidabilitySplitRuleApplication(atom.get(), List.of(positive, negative));
        branch.addExtension(application, application.outputExtensions());
        branch.addRuleApplications(List.of(application));
        return true;
    }

    @Override
    public boolean isBranching() {
        return true;
    }

    private Optional<Atom> getAtom(Branch branch) {
        for (Atom atom : branch.getDecidabilityFacts()) {
            if (branch.valueOf(atom) != Value.UNKNOWN) continue;
            for (Formula formula : branch.getFormulas()) {
                if (isLiteral(formula) || formula instanceof And) continue;
                if (branch.evaluate(formula) != Value.UNKNOWN) continue;
                if (formula.atoms().contains(atom)) return Optional.of(atom);
            }
        }
        return Optional.empty();
    }

    private static boolean isLiteral(Formula formula) {
        return formula instanceof Atom || formula instanceof Not not && not.formula() instanceof Atom;
    }

    public record DecidabilitySplitRuleApplication(Atom input, List<Branch> outputExtensions) implements RuleApplication {
        @Override
        public String toString() {
            return getString(0, "");
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof DecidabilitySplitRuleApplication other && input.equals(other.input);
        }

        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "Decide : " + input + " ∨ ¬" + input;
        }

        @Override
        public int hashCode() {
            return input.hashCode();
        }
    }
}
