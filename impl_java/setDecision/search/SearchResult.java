package setDecision.search;

import java.util.Optional;

/**
 * @param outcome        how the search ended
 * @param root           the root of the explored tree
 * @param openBranch     a saturated branch that could not be closed, if the outcome is {@link Outcome#OPEN}
 * @param steps          number of branches processed
 * @param closedBranches number of branches closed
 */
public record SearchResult(Outcome outcome, Branch root, Optional<Branch> openBranch, int steps, int closedBranches) {

    public enum Outcome {
        /** Every branch is closed. */
        REFUTED,
        /** Some branch is saturated and still consistent. */
        OPEN,
        /** The step budget ran out first. */
        EXHAUSTED
    }
}
