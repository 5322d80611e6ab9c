package setDecision;

public enum Verdict {
    PROVED,
    NOT_PROVED
}
