package setDecision;

import java.util.Objects;
import java.util.Optional;

/**
 * The answer of {@link SetDecider}. A certificate is present exactly when the verdict is
 * {@link Verdict#PROVED}; a failure reason exactly when it is not.
 */
public record Decision(Verdict verdict, Optional<Certificate> certificate, Optional<Failure> failure) {

    public enum Failure {
        /** Some branch could not be closed and no rule applies to it any more. */
        STUCK,
        /** The step budget ran out before every branch was closed. */
        BUDGET_EXHAUSTED
    }

    public Decision {
        Objects.requireNonNull(verdict);
        if ((verdict == Verdict.PROVED) != certificate.isPresent() || certificate.isPresent() == failure.isPresent()) {
            throw new IllegalArgumentException("Inconsistent decision: " + verdict + ", " + certificate + ", " + failure);
        }
    }

    public static Decision proved(Certificate certificate) {
        return new Decision(Verdict.PROVED, Optional.of(certificate), Optional.empty());
    }

    public static Decision notProved(Failure failure) {
        return new Decision(Verdict.NOT_PROVED, Optional.empty(), Optional.of(failure));
    }

    public boolean isProved() {
        return verdict == Verdict.PROVED;
    }

    @Override
    public String toString() {
        return isProved() ? verdict.toString() : verdict + " (" + failure.get() + ")";
    }
}
