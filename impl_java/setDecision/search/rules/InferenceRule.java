package setDecision.search.rules;

import setDecision.search.Branch;

public interface InferenceRule {

    /**
     * Applies the rule to the branch if it is applicable, extending the branch in place or, for a
     * branching rule, attaching its children as an extension.
     *
     * @param branch the branch to apply the rule to
     * @return whether the rule changed the branch
     */
    boolean apply(final Branch branch);

    boolean isBranching();
}
