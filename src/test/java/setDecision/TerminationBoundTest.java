package setDecision;

import static fol.Language.Formulas.*;
import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.formula.Formula;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

/**
 * Growing families of valid goals. Each is decided under a step budget polynomial in the number of
 * set constructors plus the number of distinct negated atoms, so a blow-up in the search shows up as
 * an exhausted budget.
 */
public class TerminationBoundTest {
    private final Variable x = elem("x");
    private final Variable y = elem("y");
    private final Variable t = set("t");

    private static List<Variable> sets(int n) {
        List<Variable> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) out.add(set("s" + i));
        return out;
    }

    private static int bound(int constructors, int negatedAtoms) {
        int size = constructors + negatedAtoms;
        return size * size;
    }

    private static void assertProvedWithin(int maxSteps, Formula goal, List<Formula> hypotheses) {
        DecisionOptions options = new DecisionOptions();
        options.setMaxSteps(maxSteps);
        Decision decision = new SetDecider(options).decide(goal, hypotheses.toArray(new Formula[0]));
        assertEquals("goal " + goal, Verdict.PROVED, decision.verdict());
        int steps = decision.certificate().orElseThrow().steps();
        assertTrue(steps >= 1);
        assertTrue("took " + steps + " steps, bound " + maxSteps, steps <= maxSteps);
    }

    @Test
    public void nestedUnionWithAdd() {
        for (int n = 2; n <= 16; n++) {
            List<Variable> s = sets(n);
            Term nested = add(y, s.get(n - 1));
            for (int i = n - 2; i >= 0; i--) nested = union(s.get(i), nested);
            Formula hypothesis = not(in(x, nested));

            Formula[] rest = new Formula[n];
            for (int i = 1; i < n; i++) rest[i - 1] = in(x, s.get(i));
            rest[n - 1] = eq(y, x);
            Formula goal = not(or(in(x, s.get(0)), rest));

            assertProvedWithin(bound(n, n + 1), goal, List.of(hypothesis));
        }
    }

    @Test
    public void subsetChain() {
        for (int n = 2; n <= 12; n++) {
            List<Variable> s = sets(n);
            List<Formula> hypotheses = new ArrayList<>();
            for (int i = 0; i + 1 < n; i++) hypotheses.add(subset(s.get(i), s.get(i + 1)));
            assertProvedWithin(bound(0, n), subset(s.get(0), s.get(n - 1)), hypotheses);
        }
    }

    @Test
    public void membershipInUnionOfSubsets() {
        for (int n = 2; n <= 12; n++) {
            List<Variable> s = sets(n);
            Term union = s.get(n - 1);
            for (int i = n - 2; i >= 0; i--) union = union(s.get(i), union);
            List<Formula> hypotheses = new ArrayList<>();
            hypotheses.add(in(x, union));
            for (var si : s) hypotheses.add(subset(si, t));
            assertProvedWithin(bound(n - 1, n + 1), in(x, t), hypotheses);
        }
    }
}
