package fol.term;

import static fol.Language.Terms.*;
import static org.junit.Assert.*;

import fol.Substitution;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;

public class TermTest {
    private final Variable x = elem("x");
    private final Variable y = elem("y");
    private final Variable s = set("s");
    private final Variable t = set("t");

    @Test(expected = IllegalArgumentException.class)
    public void setOperatorRejectsElementWhereSetExpected() {
        union(s, x);
    }

    @Test(expected = IllegalArgumentException.class)
    public void setOperatorRejectsWrongArity() {
        new SetExpr(SetOperator.ADD, List.of(x));
    }

    @Test(expected = IllegalArgumentException.class)
    public void functionRejectsWrongArity() {
        new Function(new FSymbol("f", 2, Sort.ELEMENT), List.of(x));
    }

    @Test
    public void elementTermsStopAtFunctionApplications() {
        Term fx = apply("f", Sort.ELEMENT, x);
        assertEquals(Set.of(fx), fx.elementTerms());
        assertEquals(Set.of(x, y), add(x, remove(y, s)).elementTerms());
        assertEquals(Set.of(), union(s, t).elementTerms());
    }

    @Test
    public void congruentSubstitutionEntersFunctionArguments() {
        Term fx = apply("f", Sort.ELEMENT, x);
        assertEquals(apply("f", Sort.ELEMENT, y), fx.applySub(Substitution.of(x, y, true)));
        assertEquals(fx, fx.applySub(Substitution.of(x, y, false)));
        assertEquals(singleton(y), singleton(x).applySub(Substitution.of(x, y, false)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void substitutionRejectsIllSortedBinding() {
        Substitution.of(x, s, true);
    }

    @Test
    public void freshVariablesAvoidTakenNames() {
        Set<String> taken = new HashSet<>(Set.of("_w1", "_w2"));
        Variable fresh = Variable.fresh("_w", Sort.ELEMENT, taken);
        assertEquals("_w3", fresh.name());
        assertTrue(taken.contains("_w3"));
    }

    @Test
    public void constantsAreNotSubstituted() {
        Constant a = new Constant("a", Sort.ELEMENT);
        assertEquals(a, a.applySub(Substitution.of(x, y, true)));
        assertTrue(a.vars().isEmpty());
    }

    @Test
    public void depthCountsNestedSetOperators() {
        assertEquals(0, s.depth());
        assertEquals(1, EMPTY.depth());
        assertEquals(3, union(s, inter(t, singleton(x))).depth());
    }
}
