package setDecision;

/**
 * One recorded step of a decision: a preprocessing rewrite or a tableau rule firing on a branch.
 */
public interface RuleApplication {
    String getString(int indentation, String delim);

    static String indent(int indentation, String delim) {
        if (indentation == 0) return "";
        return "  ".repeat(indentation) + delim + " ";
    }
}
