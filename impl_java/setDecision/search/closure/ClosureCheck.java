package setDecision.search.closure;

import java.util.Optional;
import setDecision.search.Branch;

public interface ClosureCheck {
    /**
     * @return the reason the branch is contradictory, or empty if this check finds nothing
     */
    Optional<Closure> check(Branch branch);
}
