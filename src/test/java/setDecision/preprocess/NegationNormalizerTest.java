package setDecision.preprocess;

import static fol.Language.Formulas.*;
import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Predicate;
import fol.formula.Truth;
import fol.term.Variable;
import java.util.List;
import java.util.Optional;
import org.junit.Test;
import setDecision.DecidabilityTable;
import setDecision.DecisionOptions;
import setDecision.Hypothesis;

public class NegationNormalizerTest {
    private final Variable x = elem("x");
    private final Variable s = set("s");
    private final Variable t = set("t");
    private final Formula a = in(x, s);
    private final Formula b = in(x, t);
    private final Formula p = new Predicate("P", List.of(x));

    private final NegationNormalizer normalizer = new NegationNormalizer(DecidabilityTable.standard(), true);

    @Test
    public void pushesThroughEveryConnective() {
        assertEquals(a, normalizer.push(not(not(a))));
        assertEquals(new And(new Not(a), new Not(b)), normalizer.push(not(or(a, b))));
        assertEquals(new Or(new Not(a), new Not(b)), normalizer.push(not(and(a, b))));
        assertEquals(new And(a, new Not(b)), normalizer.push(not(implies(a, b))));
        assertEquals(new Iff(a, new Not(b)), normalizer.push(not(iff(a, b))));
        assertEquals(Truth.TRUE, normalizer.push(not(Truth.FALSE)));
    }

    @Test
    public void pushesRecursively() {
        Formula f = not(or(a, not(and(a, b))));
        assertEquals(new And(new Not(a), new And(a, b)), normalizer.push(f));
    }

    @Test
    public void negatedAtomIsNormal() {
        assertEquals(Optional.empty(), normalizer.pushStep(new Not(a)));
        assertEquals(not(a), normalizer.push(not(a)));
    }

    @Test
    public void pushContraposes() {
        assertEquals(new Implies(b, a), normalizer.push(implies(not(a), not(b))));
    }

    @Test
    public void classicalRulesNeedDecidability() {
        assertEquals(not(not(p)), normalizer.push(not(not(p))));
        assertEquals(not(and(p, a)), normalizer.push(not(and(p, a))));
        assertEquals(not(implies(p, a)), normalizer.push(not(implies(p, a))));
        // valid without excluded middle
        assertEquals(new And(new Not(p), new Not(a)), normalizer.push(not(or(p, a))));
    }

    @Test
    public void decidablePredicatesUnlockClassicalRules() {
        var table = DecidabilityTable.standard().withDecidable(((Predicate) p).symbol(), "finite domain");
        var classical = new NegationNormalizer(table, true);
        assertEquals(p, classical.push(not(not(p))));
    }

    @Test
    public void pullsNegationsUp() {
        assertEquals(not(or(a, b)), normalizer.pull(and(not(a), not(b))));
        assertEquals(not(and(a, b)), normalizer.pull(or(not(a), not(b))));
        assertEquals(implies(a, b), normalizer.pull(or(not(a), b)));
        assertEquals(implies(b, a), normalizer.pull(or(a, not(b))));
        assertEquals(implies(b, a), normalizer.pull(implies(not(a), not(b))));
    }

    @Test
    public void pullReachesFixpoint() {
        Formula f = and(not(a), and(not(b), not(a)));
        Formula pulled = normalizer.pull(f);
        assertEquals(1, pulled.countNegations());
        assertEquals(pulled, normalizer.pull(pulled));
    }

    @Test
    public void normalizeKeepsFormWithFewerNegations() {
        assertEquals(not(or(a, or(b, a))), normalizer.normalize(not(or(a, or(b, a)))));
        var pushOnly = new NegationNormalizer(DecidabilityTable.standard(), false);
        assertEquals(and(not(a), and(not(b), not(a))), pushOnly.normalize(not(or(a, or(b, a)))));
    }

    @Test
    public void recordsNormalizationSteps() {
        Context ctx = new Context(List.of(new Hypothesis("H1", not(not(a)))), not(or(a, b)),
                new DecisionOptions());
        assertTrue(normalizer.apply(ctx));
        assertEquals(a, ctx.getHypotheses().get(0).formula());
        assertEquals(not(or(a, b)), ctx.getGoal());
        assertEquals(1, ctx.getTrace().size());
        assertFalse(normalizer.apply(ctx));
    }
}
