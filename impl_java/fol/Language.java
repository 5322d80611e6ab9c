package fol;

import fol.formula.And;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.IsEmpty;
import fol.formula.Member;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.SetEquals;
import fol.formula.Subset;
import fol.term.FSymbol;
import fol.term.Function;
import fol.term.SetExpr;
import fol.term.SetOperator;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for writing problems in the supported grammar.
 */
public class Language {
    public static class Terms {
        public static final SetExpr EMPTY = new SetExpr(SetOperator.EMPTY, List.of());

        public static Variable elem(String name) {
            return new Variable(name, Sort.ELEMENT);
        }

        public static Variable set(String name) {
            return new Variable(name, Sort.SET);
        }

        public static SetExpr singleton(Term x) {
            return new SetExpr(SetOperator.SINGLETON, List.of(x));
        }

        public static SetExpr add(Term x, Term s) {
            return new SetExpr(SetOperator.ADD, List.of(x, s));
        }

        public static SetExpr remove(Term x, Term s) {
            return new SetExpr(SetOperator.REMOVE, List.of(x, s));
        }

        public static SetExpr union(Term s, Term t) {
            return new SetExpr(SetOperator.UNION, List.of(s, t));
        }

        public static SetExpr inter(Term s, Term t) {
            return new SetExpr(SetOperator.INTER, List.of(s, t));
        }

        public static SetExpr diff(Term s, Term t) {
            return new SetExpr(SetOperator.DIFF, List.of(s, t));
        }

        public static Function apply(String name, Sort sort, Term... args) {
            return new Function(new FSymbol(name, args.length, sort), Arrays.asList(args));
        }
    }

    public static class Formulas {
        public static Equals eq(Term left, Term right) {
            return new Equals(left, right);
        }

        public static Member in(Term element, Term set) {
            return new Member(element, set);
        }

        public static IsEmpty empty(Term set) {
            return new IsEmpty(set);
        }

        public static Subset subset(Term left, Term right) {
            return new Subset(left, right);
        }

        public static SetEquals setEq(Term left, Term right) {
            return new SetEquals(left, right);
        }

        public static Not not(Formula formula) {
            return new Not(formula);
        }

        public static Formula and(Formula first, Formula... rest) {
            Formula out = first;
            for (Formula f : rest) out = new And(out, f);
            return out;
        }

        public static Formula or(Formula first, Formula... rest) {
            Formula out = first;
            for (Formula f : rest) out = new Or(out, f);
            return out;
        }

        public static Implies implies(Formula left, Formula right) {
            return new Implies(left, right);
        }

        public static Iff iff(Formula left, Formula right) {
            return new Iff(left, right);
        }
    }
}
