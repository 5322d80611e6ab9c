package setDecision.preprocess;

import static fol.Language.Formulas.*;
import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.formula.Formula;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import setDecision.DecisionOptions;
import setDecision.Hypothesis;

public class QuantifierInstantiatorTest {
    private final QuantifierInstantiator instantiator = new QuantifierInstantiator();
    private final Variable x = elem("x");
    private final Variable y = elem("y");
    private final Variable w = elem("_w1");
    private final Variable r = set("r");
    private final Variable s = set("s");
    private final Variable t = set("t");

    private static Context context(DecisionOptions options, Formula goal, Formula... hypotheses) {
        List<Hypothesis> named = new ArrayList<>();
        for (int i = 0; i < hypotheses.length; i++) {
            named.add(new Hypothesis("H" + (i + 1), hypotheses[i]));
        }
        return new Context(named, goal, options);
    }

    @Test
    public void instantiatesAtRelevantElements() {
        Context ctx = context(new DecisionOptions(), in(x, t), subset(s, t), in(y, s));
        assertTrue(instantiator.apply(ctx));
        assertEquals(1, ctx.getUniversals().size());
        assertTrue(ctx.contains(implies(in(x, s), in(x, t))));
        assertTrue(ctx.contains(implies(in(y, s), in(y, t))));
        assertFalse(ctx.contains(subset(s, t)));
    }

    @Test
    public void doesNotInstantiateTwice() {
        Context ctx = context(new DecisionOptions(), in(x, t), empty(s));
        assertTrue(instantiator.apply(ctx));
        assertFalse(instantiator.apply(ctx));
        assertEquals(1, ctx.getHypotheses().size());
    }

    @Test
    public void instantiatesAtLaterTerms() {
        Context ctx = context(new DecisionOptions(), in(x, t), empty(s));
        instantiator.apply(ctx);
        ctx.addHypothesis(new Hypothesis("H9", in(y, r)));
        assertTrue(instantiator.apply(ctx));
        assertTrue(ctx.contains(not(in(y, s))));
    }

    @Test
    public void introducesWitnessForGoal() {
        Context ctx = context(new DecisionOptions(), subset(s, t));
        assertTrue(instantiator.apply(ctx));
        assertEquals(implies(in(w, s), in(w, t)), ctx.getGoal());
    }

    @Test
    public void introducesWitnessForNegatedHypothesis() {
        Context ctx = context(new DecisionOptions(), in(x, t), not(setEq(s, t)));
        instantiator.apply(ctx);
        assertTrue(ctx.contains(not(iff(in(w, s), in(w, t)))));
        assertTrue(ctx.getUniversals().isEmpty());
    }

    @Test
    public void leavesEliminableSetEqualityToSubstitution() {
        Context ctx = context(new DecisionOptions(), in(x, t), setEq(s, union(r, t)));
        instantiator.apply(ctx);
        assertTrue(ctx.contains(setEq(s, union(r, t))));
        assertTrue(ctx.getUniversals().isEmpty());

        DecisionOptions setoid = new DecisionOptions();
        setoid.setEquality(DecisionOptions.Equality.SETOID);
        Context ctx2 = context(setoid, in(x, t), setEq(s, union(r, t)));
        instantiator.apply(ctx2);
        assertEquals(1, ctx2.getUniversals().size());
        assertTrue(ctx2.contains(iff(in(x, s), in(x, union(r, t)))));
    }
}
