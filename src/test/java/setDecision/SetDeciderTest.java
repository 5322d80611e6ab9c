package setDecision;

import static fol.Language.Formulas.*;
import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.formula.Formula;
import fol.formula.PSymbol;
import fol.formula.Predicate;
import fol.TermEquivalence;
import fol.formula.Truth;
import fol.term.Function;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.junit.Test;

public class SetDeciderTest {
    private final Variable x = elem("x");
    private final Variable y = elem("y");
    private final Variable z = elem("z");
    private final Variable a = elem("a");
    private final Variable b = elem("b");
    private final Variable r = set("r");
    private final Variable s = set("s");
    private final Variable t = set("t");
    private final Variable s1 = set("s1");
    private final Variable s2 = set("s2");
    private final Variable s3 = set("s3");
    private final Variable s4 = set("s4");

    private final SetDecider decider = new SetDecider();

    @Test
    public void elementOfItsSingleton() {
        Decision decision = decider.decide(in(x, singleton(x)));
        assertEquals(Verdict.PROVED, decision.verdict());
        assertTrue(decision.certificate().isPresent());
        assertFalse(decision.failure().isPresent());
    }

    @Test
    public void rewritesWithEqualities() {
        Decision decision = decider.decide(in(z, s), eq(x, y), not(not(eq(z, y))), in(x, s));
        assertEquals(Verdict.PROVED, decision.verdict());
    }

    @Test
    public void addAfterRemoveRestoresSet() {
        assertTrue(decider.decide(subset(s, add(x, remove(x, s)))).isProved());
    }

    @Test
    public void negatedMembershipInNestedUnion() {
        Formula hypothesis = not(in(x, union(s1, union(s2, union(s3, add(y, s4))))));
        Formula goal = not(or(in(x, s1), in(x, s4), eq(y, x)));
        assertTrue(decider.decide(goal, hypothesis).isProved());
    }

    @Test
    public void subsetDoesNotGiveMembership() {
        Decision decision = decider.decide(in(x, s), eq(x, y), subset(r, s));
        assertEquals(Verdict.NOT_PROVED, decision.verdict());
        assertEquals(Decision.Failure.STUCK, decision.failure().get());
        assertFalse(decision.certificate().isPresent());
    }

    @Test
    public void opaqueApplicationsAreNotUnified() {
        Term fa = apply("f", Sort.ELEMENT, a);
        Term gb = apply("g", Sort.ELEMENT, b);
        Decision decision = decider.decide(in(gb, s), in(fa, s), eq(fa, gb));
        assertEquals(Verdict.NOT_PROVED, decision.verdict());
    }

    @Test
    public void substitutesIntoApplicationsUnderLeibnizEquality() {
        Term fx = apply("f", Sort.ELEMENT, x);
        Term fy = apply("f", Sort.ELEMENT, y);
        assertTrue(decider.decide(in(fy, s), eq(x, y), in(fx, s)).isProved());

        DecisionOptions options = new DecisionOptions();
        options.setEquality(DecisionOptions.Equality.SETOID);
        assertFalse(new SetDecider(options).decide(in(fy, s), eq(x, y), in(fx, s)).isProved());
    }

    @Test
    public void setoidEqualityStillRespectsSetOperations() {
        DecisionOptions options = new DecisionOptions();
        options.setEquality(DecisionOptions.Equality.SETOID);
        SetDecider setoid = new SetDecider(options);
        assertTrue(setoid.decide(in(y, add(x, s)), eq(x, y)).isProved());
        assertTrue(setoid.decide(subset(s, t), setEq(s, t)).isProved());
    }

    @Test
    public void extensionality() {
        assertTrue(decider.decide(setEq(union(s, t), union(t, s))).isProved());
        assertTrue(decider.decide(subset(s, t), setEq(s, t)).isProved());
        assertTrue(decider.decide(subset(inter(s, t), s)).isProved());
        assertFalse(decider.decide(subset(s, t)).isProved());
    }

    @Test
    public void emptySetHasNoElements() {
        assertTrue(decider.decide(not(in(x, EMPTY))).isProved());
        assertTrue(decider.decide(not(in(x, s)), empty(s)).isProved());
        assertTrue(decider.decide(empty(diff(s, s))).isProved());
    }

    @Test
    public void differenceIsDisjoint() {
        assertTrue(decider.decide(not(in(x, t)), in(x, diff(s, t))).isProved());
        assertTrue(decider.decide(not(in(x, remove(x, s)))).isProved());
    }

    @Test
    public void conjunctiveGoalsNeedEveryConjunct() {
        Decision proved = decider.decide(and(in(x, s), in(x, t)), in(x, inter(s, t)));
        assertTrue(proved.isProved());
        assertEquals(2, proved.certificate().get().proofs().size());

        Decision notProved = decider.decide(and(in(x, s), in(x, r)), in(x, inter(s, t)));
        assertEquals(Verdict.NOT_PROVED, notProved.verdict());
    }

    @Test
    public void contradictoryHypothesesProveAnything() {
        assertTrue(decider.decide(in(y, r), in(x, s), not(in(x, union(s, t)))).isProved());
    }

    @Test
    public void caseSplitOnDecidableMembership() {
        Formula h1 = iff(in(x, s), in(x, t));
        Formula h2 = iff(in(x, s), not(in(x, t)));
        assertTrue(decider.decide(Truth.FALSE, h1, h2).isProved());
    }

    @Test
    public void exhaustsStepBudget() {
        DecisionOptions options = new DecisionOptions();
        options.setMaxSteps(1);
        Formula h1 = iff(in(x, s), in(x, t));
        Formula h2 = iff(in(x, s), not(in(x, t)));
        Decision decision = new SetDecider(options).decide(Truth.FALSE, h1, h2);
        assertEquals(Verdict.NOT_PROVED, decision.verdict());
        assertEquals(Decision.Failure.BUDGET_EXHAUSTED, decision.failure().get());
    }

    @Test
    public void searchOrderDoesNotChangeVerdicts() {
        DecisionOptions options = new DecisionOptions();
        options.setSearchOrder(DecisionOptions.SearchOrder.BREADTH_FIRST);
        SetDecider bfs = new SetDecider(options);
        assertTrue(bfs.decide(setEq(union(s, t), union(t, s))).isProved());
        assertFalse(bfs.decide(in(x, s), eq(x, y), subset(r, s)).isProved());
    }

    @Test
    public void callerPredicatesNeedDecidability() {
        Predicate p = new Predicate("P", List.of(x));
        assertFalse(decider.decide(p, p).isProved());

        DecisionOptions options = new DecisionOptions();
        options.setDecidability(DecidabilityTable.standard().withDecidable(new PSymbol("P", 1), "finite"));
        assertTrue(new SetDecider(options).decide(p, p).isProved());
    }

    @Test
    public void ignoresHypothesesOutsideTheFragment() {
        Predicate q = new Predicate("Q", List.of(x));
        assertTrue(decider.decide(in(x, union(s, t)), q, in(x, s)).isProved());
    }

    @Test
    public void certificateShowsPreprocessingAndClosure() {
        Decision decision = decider.decide(List.of(new Hypothesis("member", in(x, s))), in(x, add(y, s)));
        String rendered = decision.certificate().get().render();
        assertTrue(rendered.contains("Rewrite"));
        assertTrue(rendered.contains("Closed by"));
        assertEquals(1, decision.certificate().get().closedBranchCount());
    }

    private static SetDecider commutativePlusDecider() {
        DecisionOptions options = new DecisionOptions();
        options.setTermEquivalence(term -> {
            if (term instanceof Function f && f.name().equals("plus")) {
                return new Function(f.symbol(), f.args().stream().sorted(Comparator.comparing(Object::toString)).toList());
            }
            return term;
        });
        return new SetDecider(options);
    }

    @Test
    public void membershipUpToTermEquivalence() {
        Term ab = apply("plus", Sort.ELEMENT, a, b);
        Term ba = apply("plus", Sort.ELEMENT, b, a);
        assertFalse(decider.decide(in(ba, s), in(ab, s)).isProved());
        assertTrue(commutativePlusDecider().decide(in(ba, s), in(ab, s)).isProved());
    }

    @Test
    public void reflexivityUpToTermEquivalence() {
        Term ab = apply("plus", Sort.ELEMENT, a, b);
        Term ba = apply("plus", Sort.ELEMENT, b, a);
        assertFalse(decider.decide(eq(ab, ba)).isProved());
        Decision decision = commutativePlusDecider().decide(eq(ab, ba));
        assertTrue(decision.isProved());
        assertTrue(decision.certificate().get().render().contains("Closed by"));
    }

    @Test
    public void structuralEquivalenceByDefault() {
        assertSame(TermEquivalence.STRUCTURAL, new DecisionOptions().termEquivalence());
    }

    @Test(expected = IllegalArgumentException.class)
    public void decisionRequiresCertificateForProof() {
        new Decision(Verdict.PROVED, Optional.empty(), Optional.empty());
    }
}
