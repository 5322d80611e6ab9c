package setDecision.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.preprocess.NegationNormalizer;
import setDecision.search.closure.ClosureCheck;
import setDecision.search.closure.DirectContradiction;
import setDecision.search.closure.Reflexivity;
import setDecision.search.closure.Refutation;
import setDecision.search.rules.AndElim;
import setDecision.search.rules.DecidabilitySplit;
import setDecision.search.rules.EqElim;
import setDecision.search.rules.IffElim;
import setDecision.search.rules.ImpliesElim;
import setDecision.search.rules.InferenceRule;
import setDecision.search.rules.NotElim;
import setDecision.search.rules.OrElim;
import setDecision.search.rules.UnitOrElim;

/**
 * Stage 7. Tries to close every branch of a refutation tree.
 * <p>
 * Each branch is saturated with the non-branching rules, then checked for a contradiction, and only
 * then split by the first applicable branching rule. A branch that is saturated, consistent and
 * cannot be split ends the search.
 */
public class ClosureSearch {
    private static final Logger log = LogManager.getFormatterLogger();

    private final Branch root;
    private final PriorityQueue<Branch> searchTree;
    private final List<InferenceRule> rulesBranching;
    private final List<InferenceRule> rulesNonBranching;
    private final List<ClosureCheck> closureChecks;
    private final int maxSteps;
    private int steps = 0;
    private int closedBranches = 0;

    public ClosureSearch(Branch root, Comparator<Branch> heuristic, List<InferenceRule> inferenceRules,
            List<ClosureCheck> closureChecks, int maxSteps) {
        this.root = root;
        this.rulesBranching = inferenceRules.stream().filter(InferenceRule::isBranching).toList();
        this.rulesNonBranching = inferenceRules.stream().filter(rule -> !rule.isBranching()).toList();
        this.closureChecks = List.copyOf(closureChecks);
        this.maxSteps = maxSteps;
        this.searchTree = new PriorityQueue<>(heuristic);
        searchTree.add(root);
    }

    public ClosureSearch(Branch root, Comparator<Branch> heuristic, NegationNormalizer normalizer, int maxSteps) {
        this(root, heuristic, getDefaultInferenceRules(normalizer), getDefaultClosureChecks(), maxSteps);
    }

    public static List<InferenceRule> getDefaultInferenceRules(NegationNormalizer normalizer) {
        return List.of(new AndElim(), new NotElim(normalizer), new ImpliesElim(), new IffElim(), new UnitOrElim(),
                new EqElim(), new DecidabilitySplit(), new OrElim());
    }

    public static List<ClosureCheck> getDefaultClosureChecks() {
        return List.of(new Reflexivity(), new DirectContradiction(), new Refutation());
    }

    public SearchResult search() {
        while (!searchTree.isEmpty()) {
            if (maxSteps > 0 && steps >= maxSteps) {
                log.debug("Step budget of %d exhausted with %d open branches", maxSteps, searchTree.size());
                return new SearchResult(SearchResult.Outcome.EXHAUSTED, root, Optional.empty(), steps, closedBranches);
            }
            Branch branch = searchTree.poll();
            steps++;
            List<Branch> children = processBranch(branch);
            if (branch.isClosed()) continue;
            if (children.isEmpty()) {
                log.debug("Branch %d is saturated and open after %d steps", branch.id, steps);
                return new SearchResult(SearchResult.Outcome.OPEN, root, Optional.of(branch), steps, closedBranches);
            }
            searchTree.addAll(children);
        }
        log.debug("Closed all %d branches in %d steps", closedBranches, steps);
        return new SearchResult(SearchResult.Outcome.REFUTED, root, Optional.empty(), steps, closedBranches);
    }

    private List<Branch> processBranch(Branch branch) {
        for (boolean done = false; !done; ) {
            done = true;
            for (var rule : rulesNonBranching) {
                if (!rule.apply(branch)) continue;
                done = false;
            }
        }

        for (var check : closureChecks) {
            var closure = check.check(branch);
            if (closure.isPresent()) {
                log.trace("Branch %d at depth %d closed: %s", branch.id, branch.getDepth(), closure.get());
                branch.close(closure.get());
                closedBranches++;
                return List.of();
            }
        }

        for (var rule : rulesBranching) {
            if (!rule.apply(branch)) continue;
            List<Branch> children = new ArrayList<>();
            for (var extension : branch.getExtensions().values()) {
                children.addAll(extension);
            }
            return children;
        }
        return List.of();
    }
}
