package setDecision;

import fol.TermEquivalence;
import java.util.Objects;
import java.util.Properties;

/**
 * Tunable parameters of {@link SetDecider}. None of them affects soundness.
 */
public class DecisionOptions {

    public static final String MAX_STEPS = "fsetdec.maxSteps";
    public static final String EQUALITY = "fsetdec.equality";
    public static final String SEARCH_ORDER = "fsetdec.searchOrder";
    public static final String PULL_NEGATIONS = "fsetdec.pullNegations";

    /**
     * How element equality relates to syntactic term equality.
     */
    public enum Equality {
        /** Equal elements are interchangeable everywhere, including inside opaque applications. */
        LEIBNIZ,
        /** Equality is only respected by the set operations and membership. */
        SETOID
    }

    public enum SearchOrder {
        DEPTH_FIRST,
        BREADTH_FIRST
    }

    private int maxSteps = 0;
    private Equality equality = Equality.LEIBNIZ;
    private SearchOrder searchOrder = SearchOrder.DEPTH_FIRST;
    private boolean pullNegations = true;
    private DecidabilityTable decidability = DecidabilityTable.standard();
    private TermEquivalence termEquivalence = TermEquivalence.STRUCTURAL;

    public static DecisionOptions fromProperties(Properties properties) {
        DecisionOptions options = new DecisionOptions();
        String maxSteps = properties.getProperty(MAX_STEPS);
        if (maxSteps != null) {
            try {
                options.setMaxSteps(Integer.parseInt(maxSteps.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(MAX_STEPS + " must be an integer, got '" + maxSteps + "'", e);
            }
        }
        String equality = properties.getProperty(EQUALITY);
        if (equality != null) {
            options.setEquality(Equality.valueOf(equality.trim().toUpperCase()));
        }
        String order = properties.getProperty(SEARCH_ORDER);
        if (order != null) {
            options.setSearchOrder(SearchOrder.valueOf(order.trim().toUpperCase()));
        }
        String pull = properties.getProperty(PULL_NEGATIONS);
        if (pull != null) {
            options.setPullNegations(Boolean.parseBoolean(pull.trim()));
        }
        return options;
    }

    /**
     * @return the maximal number of search steps, 0 if unbounded
     */
    public int maxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public Equality equality() {
        return equality;
    }

    public void setEquality(Equality equality) {
        this.equality = Objects.requireNonNull(equality);
    }

    public boolean congruentSubstitution() {
        return equality == Equality.LEIBNIZ;
    }

    public SearchOrder searchOrder() {
        return searchOrder;
    }

    public void setSearchOrder(SearchOrder searchOrder) {
        this.searchOrder = Objects.requireNonNull(searchOrder);
    }

    public boolean pullNegations() {
        return pullNegations;
    }

    public void setPullNegations(boolean pullNegations) {
        this.pullNegations = pullNegations;
    }

    public DecidabilityTable decidability() {
        return decidability;
    }

    public void setDecidability(DecidabilityTable decidability) {
        this.decidability = Objects.requireNonNull(decidability);
    }

    /**
     * @return the check deciding when two terms are the same expression, structural by default
     */
    public TermEquivalence termEquivalence() {
        return termEquivalence;
    }

    public void setTermEquivalence(TermEquivalence termEquivalence) {
        this.termEquivalence = Objects.requireNonNull(termEquivalence);
    }

    @Override
    public String toString() {
        return String.format("DecisionOptions[maxSteps=%d, equality=%s, searchOrder=%s, pullNegations=%b]",
                maxSteps, equality, searchOrder, pullNegations);
    }
}
