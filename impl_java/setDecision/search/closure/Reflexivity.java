package setDecision.search.closure;

import fol.formula.Equals;
import fol.formula.Not;
import java.util.Optional;
import setDecision.search.Branch;

public class Reflexivity implements ClosureCheck {
    @Override
    public Optional<Closure> check(Branch branch) {
        for (var formula : branch.getFormulas()) {
            if (formula instanceof Not not && not.formula() instanceof Equals eq && branch.isReflexive(eq)) {
                return Optional.of(new Closure(Closure.Reason.REFLEXIVITY, formula));
            }
        }
        return Optional.empty();
    }
}
