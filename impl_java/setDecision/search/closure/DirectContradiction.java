package setDecision.search.closure;

import fol.formula.Not;
import fol.formula.Truth;
import java.util.Optional;
import setDecision.search.Branch;

public class DirectContradiction implements ClosureCheck {
    @Override
    public Optional<Closure> check(Branch branch) {
        if (branch.contains(Truth.FALSE)) {
            return Optional.of(new Closure(Closure.Reason.DIRECT_CONTRADICTION, Truth.FALSE));
        }
        for (var formula : branch.getFormulas()) {
            // !a; a
            if (formula instanceof Not not && branch.contains(not.formula())) {
                return Optional.of(new Closure(Closure.Reason.DIRECT_CONTRADICTION, not.formula()));
            }
        }
        return Optional.empty();
    }
}
