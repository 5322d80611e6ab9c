package setDecision.preprocess;

import static fol.Language.Formulas.*;
import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.formula.Formula;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import setDecision.DecisionOptions;
import setDecision.Hypothesis;

public class EqualitySubstitutorTest {
    private final EqualitySubstitutor substitutor = new EqualitySubstitutor();
    private final Variable x = elem("x");
    private final Variable y = elem("y");
    private final Variable z = elem("z");
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
    public void eliminatesChainsOfEqualities() {
        Context ctx = context(new DecisionOptions(), in(z, s), eq(x, y), eq(y, z), in(x, s));
        assertTrue(substitutor.apply(ctx));
        assertEquals(List.of(new Hypothesis("H3", in(z, s))), ctx.getHypotheses());
        assertEquals(in(z, s), ctx.getGoal());
        assertEquals(2, ctx.getTrace().size());
    }

    @Test
    public void occursCheckBlocksElimination() {
        Term fx = apply("f", Sort.ELEMENT, x);
        Context ctx = context(new DecisionOptions(), in(x, s), eq(x, fx), in(fx, s));
        assertFalse(substitutor.apply(ctx));
        assertEquals(2, ctx.getHypotheses().size());
    }

    @Test
    public void eliminatesSetVariablesUnderLeibnizEquality() {
        Context ctx = context(new DecisionOptions(), in(x, union(t, r)), setEq(s, union(t, r)), in(x, s));
        assertTrue(substitutor.apply(ctx));
        assertEquals(List.of(new Hypothesis("H2", in(x, union(t, r)))), ctx.getHypotheses());
    }

    @Test
    public void setoidEqualityKeepsHypothesisWhileVariableIsOpaque() {
        DecisionOptions options = new DecisionOptions();
        options.setEquality(DecisionOptions.Equality.SETOID);
        Term fx = apply("f", Sort.ELEMENT, x);
        Context ctx = context(options, in(fx, s), eq(x, y), in(fx, s), in(x, t));
        assertTrue(substitutor.apply(ctx));
        assertTrue(ctx.contains(eq(x, y)));
        assertTrue(ctx.contains(in(fx, s)));
        assertTrue(ctx.contains(in(y, t)));
        assertFalse(ctx.contains(in(x, t)));
        assertFalse(substitutor.apply(ctx));
    }

    @Test
    public void setoidEqualityDropsHypothesisOnceVariableIsGone() {
        DecisionOptions options = new DecisionOptions();
        options.setEquality(DecisionOptions.Equality.SETOID);
        Context ctx = context(options, in(y, t), eq(x, y), in(x, t));
        assertTrue(substitutor.apply(ctx));
        assertEquals(List.of(new Hypothesis("H2", in(y, t))), ctx.getHypotheses());
    }

    @Test
    public void setoidEqualityLeavesSetEqualitiesAlone() {
        DecisionOptions options = new DecisionOptions();
        options.setEquality(DecisionOptions.Equality.SETOID);
        Context ctx = context(options, in(x, t), setEq(s, t), in(x, s));
        assertFalse(substitutor.apply(ctx));
    }

    @Test
    public void substitutesIntoUniversals() {
        Context ctx = context(new DecisionOptions(), in(y, t), eq(x, y));
        ctx.addUniversal("U", subset(s, add(x, t)));
        substitutor.apply(ctx);
        assertEquals(subset(s, add(y, t)), ctx.getUniversals().get(0).relation());
    }
}
