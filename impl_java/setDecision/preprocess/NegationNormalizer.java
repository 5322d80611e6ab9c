package setDecision.preprocess;

import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Truth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.DecidabilityTable;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * Stage 4. Moves negations either down to the atoms (push) or up towards the root (pull).
 * <p>
 * Every rule is an equivalence. Those that only hold classically fire only when the decidability
 * table vouches for the formula they need; otherwise the rule is skipped and the negation stays.
 */
public class NegationNormalizer implements PreprocessingStep {
    private static final Logger log = LogManager.getFormatterLogger();

    private final DecidabilityTable decidability;
    private final boolean pullEnabled;

    public NegationNormalizer(DecidabilityTable decidability, boolean pullEnabled) {
        this.decidability = decidability;
        this.pullEnabled = pullEnabled;
    }

    @Override
    public boolean apply(final Context context) {
        boolean changed = false;
        List<Hypothesis> updated = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            Formula normal = normalize(hypothesis.formula());
            if (!normal.equals(hypothesis.formula())) {
                context.addRuleApplication(new Normalization(hypothesis.name(), hypothesis.formula(), normal));
                changed = true;
            }
            updated.add(hypothesis.withFormula(normal));
        }
        context.setHypotheses(updated);

        Formula goal = context.getGoal();
        Formula normalGoal = normalize(goal);
        if (!normalGoal.equals(goal)) {
            context.addRuleApplication(new Normalization("goal", goal, normalGoal));
            context.setGoal(normalGoal);
            changed = true;
        }
        return changed;
    }

    /**
     * Pushes negations down, then keeps the pulled form instead when it has fewer negations.
     */
    public Formula normalize(Formula formula) {
        Formula pushed = push(formula);
        if (!pullEnabled) return pushed;
        Formula pulled = pull(pushed);
        if (pulled.countNegations() < pushed.countNegations()) {
            log.trace("Pulled %s to %s", pushed, pulled);
            return pulled;
        }
        return pushed;
    }

    public Formula push(Formula formula) {
        if (formula instanceof Not not) {
            Optional<Formula> step = pushStep(not);
            if (step.isPresent()) return push(step.get());
            return new Not(push(not.formula()));
        } else if (formula instanceof And and) {
            return new And(push(and.left()), push(and.right()));
        } else if (formula instanceof Or or) {
            return new Or(push(or.left()), push(or.right()));
        } else if (formula instanceof Implies implies) {
            return contrapose(new Implies(push(implies.left()), push(implies.right())));
        } else if (formula instanceof Iff iff) {
            return new Iff(push(iff.left()), push(iff.right()));
        } else if (formula instanceof Atom || formula instanceof Truth) {
            return formula;
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    /**
     * Moves a negation one level down.
     *
     * @param not the negated formula
     * @return the rewritten formula, or empty if the negation sits on an atom or the required
     * decidability is not available
     */
    public Optional<Formula> pushStep(Not not) {
        Formula inner = not.formula();
        if (inner instanceof Truth truth) {
            return Optional.of(truth.value() ? Truth.FALSE : Truth.TRUE);
        } else if (inner instanceof Not doubleNot) {
            // ¬¬A ↔ A
            if (!decidable(doubleNot.formula())) return Optional.empty();
            return Optional.of(doubleNot.formula());
        } else if (inner instanceof Or or) {
            // ¬(A ∨ B) ↔ ¬A ∧ ¬B
            return Optional.of(new And(new Not(or.left()), new Not(or.right())));
        } else if (inner instanceof And and) {
            // ¬(A ∧ B) ↔ ¬A ∨ ¬B
            if (!decidable(and.left())) return Optional.empty();
            return Optional.of(new Or(new Not(and.left()), new Not(and.right())));
        } else if (inner instanceof Implies implies) {
            // ¬(A → B) ↔ A ∧ ¬B
            if (!decidable(implies.left())) return Optional.empty();
            return Optional.of(new And(implies.left(), new Not(implies.right())));
        } else if (inner instanceof Iff iff) {
            // ¬(A ↔ B) ↔ (A ↔ ¬B)
            if (!decidable(iff.left()) || !decidable(iff.right())) return Optional.empty();
            return Optional.of(new Iff(iff.left(), new Not(iff.right())));
        }
        return Optional.empty();
    }

    public Formula pull(Formula formula) {
        Formula current = formula;
        while (true) {
            Formula next = pullOnce(current);
            if (next.equals(current)) return current;
            current = next;
        }
    }

    private Formula pullOnce(Formula formula) {
        Formula rebuilt;
        if (formula instanceof Not not) {
            rebuilt = new Not(pullOnce(not.formula()));
        } else if (formula instanceof And and) {
            rebuilt = new And(pullOnce(and.left()), pullOnce(and.right()));
        } else if (formula instanceof Or or) {
            rebuilt = new Or(pullOnce(or.left()), pullOnce(or.right()));
        } else if (formula instanceof Implies implies) {
            rebuilt = new Implies(pullOnce(implies.left()), pullOnce(implies.right()));
        } else if (formula instanceof Iff iff) {
            rebuilt = new Iff(pullOnce(iff.left()), pullOnce(iff.right()));
        } else {
            return formula;
        }
        return pullStep(rebuilt).orElse(rebuilt);
    }

    /**
     * Applies one negation-reducing rule at the root.
     *
     * @return the rewritten formula, or empty if no rule applies
     */
    public Optional<Formula> pullStep(Formula formula) {
        if (formula instanceof Not not && not.formula() instanceof Not doubleNot) {
            // ¬¬A ↔ A
            if (decidable(doubleNot.formula())) return Optional.of(doubleNot.formula());
        } else if (formula instanceof And and && and.left() instanceof Not l && and.right() instanceof Not r) {
            // ¬A ∧ ¬B ↔ ¬(A ∨ B)
            return Optional.of(new Not(new Or(l.formula(), r.formula())));
        } else if (formula instanceof Or or) {
            if (or.left() instanceof Not l && or.right() instanceof Not r) {
                // ¬A ∨ ¬B ↔ ¬(A ∧ B)
                if (decidable(l.formula())) return Optional.of(new Not(new And(l.formula(), r.formula())));
            } else if (or.left() instanceof Not l) {
                // ¬A ∨ B ↔ A → B
                if (decidable(l.formula())) return Optional.of(new Implies(l.formula(), or.right()));
            } else if (or.right() instanceof Not r) {
                // A ∨ ¬B ↔ B → A
                if (decidable(r.formula())) return Optional.of(new Implies(r.formula(), or.left()));
            }
        } else if (formula instanceof Implies implies) {
            return Optional.of(contrapose(implies)).filter(f -> !f.equals(implies));
        }
        return Optional.empty();
    }

    /**
     * (¬A → ¬B) ↔ (B → A)
     */
    private Formula contrapose(Implies implies) {
        if (implies.left() instanceof Not l && implies.right() instanceof Not r && decidable(l.formula())) {
            return new Implies(r.formula(), l.formula());
        }
        return implies;
    }

    private boolean decidable(Formula formula) {
        boolean decidable = decidability.isDecidable(formula);
        if (!decidable) {
            log.trace("Not rewriting around %s: %s", formula, decidability.of(formula).reason());
        }
        return decidable;
    }

    public record Normalization(String name, Formula input, Formula output) implements RuleApplication {
        @Override
        public String getString(int indentation, String delim) {
            return RuleApplication.indent(indentation, delim) + "NotNormalize " + name + " : " + input + " -> " + output;
        }

        @Override
        public String toString() {
            return getString(0, "");
        }
    }
}
