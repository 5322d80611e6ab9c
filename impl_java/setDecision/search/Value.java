package setDecision.search;

/**
 * What a branch knows about a formula.
 */
public enum Value {
    TRUE,
    FALSE,
    UNKNOWN;

    public Value negate() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }
}
