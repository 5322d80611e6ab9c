package setDecision;

import fol.formula.Formula;
import java.util.List;
import setDecision.search.Branch;

/**
 * Evidence for a {@link Verdict#PROVED} answer: for every conjunct of the goal, the preprocessing
 * steps that were taken and a refutation tree all of whose leaves are closed.
 */
public record Certificate(List<Proof> proofs) {

    public Certificate {
        proofs = List.copyOf(proofs);
    }

    /**
     * @param steps the number of branches the search processed
     */
    public record Proof(Formula goal, List<RuleApplication> preprocessing, Branch refutation, int steps) {
        public Proof {
            preprocessing = List.copyOf(preprocessing);
        }

        public int closedBranchCount() {
            return (int) refutation.leaves().stream().filter(Branch::isClosed).count();
        }

        public String render() {
            StringBuilder sb = new StringBuilder("⊢ ").append(goal).append('\n');
            for (var step : preprocessing) {
                sb.append(step.getString(1, "-")).append('\n');
            }
            sb.append(refutation.createString(1, "*"));
            return sb.toString();
        }
    }

    public int closedBranchCount() {
        return proofs.stream().mapToInt(Proof::closedBranchCount).sum();
    }

    public int steps() {
        return proofs.stream().mapToInt(Proof::steps).sum();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (var proof : proofs) {
            sb.append(proof.render());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
