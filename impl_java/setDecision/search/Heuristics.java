package setDecision.search;

import java.util.Comparator;
import setDecision.DecisionOptions;

public class Heuristics {

    public interface Heuristic extends Comparator<Branch> {
        public String getName();
    }

    public static Heuristic forOrder(DecisionOptions.SearchOrder order) {
        return switch (order) {
            case DEPTH_FIRST -> new DFS();
            case BREADTH_FIRST -> new BFS();
        };
    }

    public static class BFS implements Heuristic {
        @Override
        public int compare(Branch branch, Branch t1) {
            return Long.compare(branch.id, t1.id);
        }

        @Override
        public String getName() {
            return "BFS";
        }
    }

    public static class DFS implements Heuristic {
        @Override
        public int compare(Branch branch, Branch t1) {
            return Long.compare(t1.id, branch.id);
        }

        @Override
        public String getName() {
            return "DFS";
        }
    }
}
