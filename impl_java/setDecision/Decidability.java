package setDecision;

/**
 * Entry of the decidability table: whether an atom shape is decidable, and why.
 */
public record Decidability(boolean decidable, String reason) {
    public static Decidability decidable(String reason) {
        return new Decidability(true, reason);
    }

    public static Decidability undecidable(String reason) {
        return new Decidability(false, reason);
    }
}
