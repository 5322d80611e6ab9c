package setDecision.search.closure;

import java.util.Optional;
import setDecision.search.Branch;
import setDecision.search.Value;

/**
 * Closes a branch holding a formula that its other formulas already refute, e.g. {@code a ∨ b}
 * together with {@code ¬a} and {@code ¬b}.
 */
public class Refutation implements ClosureCheck {
    @Override
    public Optional<Closure> check(Branch branch) {
        for (var formula : branch.getFormulas()) {
            if (branch.evaluate(formula) == Value.FALSE) {
                return Optional.of(new Closure(Closure.Reason.REFUTATION, formula));
            }
        }
        return Optional.empty();
    }
}
