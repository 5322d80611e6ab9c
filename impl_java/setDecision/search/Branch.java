package setDecision.search;

import fol.Substitution;
import fol.TermEquivalence;
import fol.formula.And;
import fol.formula.Atom;
import fol.formula.Equals;
import fol.formula.Formula;
import fol.formula.Iff;
import fol.formula.Implies;
import fol.formula.Not;
import fol.formula.Or;
import fol.formula.Truth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import setDecision.RuleApplication;
import setDecision.search.closure.Closure;

/**
 * A node of the refutation tree: the formulas assumed on the path from the root, the decidability
 * facts not yet used, and the rules that fired here.
 */
public class Branch {
    private final Set<Formula> formulas;
    private final Set<Atom> decidabilityFacts;
    private final Set<RuleApplication> ruleApplications;
    private final Map<RuleApplication, List<Branch>> extensions;
    private Substitution substitution;
    private Closure closure;
    private final Branch parent;
    private final AtomicLong ids;
    private final TermEquivalence equivalence;
    private final int depth;
    public final long id;

    /**
     * Creates a root branch. Branches created from it share its id sequence.
     */
    public Branch(Collection<Formula> formulas, Collection<Atom> decidabilityFacts, boolean congruent) {
        this(formulas, decidabilityFacts, congruent, TermEquivalence.STRUCTURAL);
    }

    /**
     * Creates a root branch that compares terms up to {@code equivalence}.
     */
    public Branch(Collection<Formula> formulas, Collection<Atom> decidabilityFacts, boolean congruent,
            TermEquivalence equivalence) {
        this(formulas.stream().map(f -> equivalence.canonical(f)).toList(),
                decidabilityFacts.stream().map(atom -> (Atom) equivalence.canonical(atom)).toList(), Set.of(),
                new Substitution(congruent), null, new AtomicLong(), 0, equivalence);
    }

    private Branch(Collection<Formula> formulas, Collection<Atom> decidabilityFacts, Set<RuleApplication> ruleApplications,
            Substitution substitution, Branch parent, AtomicLong ids, int depth, TermEquivalence equivalence) {
        this.equivalence = equivalence;
        this.formulas = new LinkedHashSet<>(formulas);
        this.decidabilityFacts = new LinkedHashSet<>(decidabilityFacts);
        this.ruleApplications = new LinkedHashSet<>(ruleApplications);
        this.extensions = new LinkedHashMap<>();
        this.substitution = substitution.copy();
        this.parent = parent;
        this.ids = ids;
        this.depth = depth;
        this.id = ids.getAndIncrement();
    }

    /**
     * @return a child of this branch that additionally assumes {@code formula}
     */
    public Branch extend(Formula formula) {
        Branch child = new Branch(formulas, decidabilityFacts, ruleApplications, substitution, this, ids, depth + 1,
                equivalence);
        child.formulas.add(equivalence.canonical(formula));
        return child;
    }

    public Set<Formula> getFormulas() {
        return formulas;
    }

    public boolean contains(Formula formula) {
        return formulas.contains(equivalence.canonical(formula));
    }

    public void addFormulas(Collection<Formula> newFormulas) {
        for (var formula : newFormulas) formulas.add(equivalence.canonical(formula));
    }

    public TermEquivalence getTermEquivalence() {
        return equivalence;
    }

    /**
     * Whether both sides of the equality are the same expression.
     */
    public boolean isReflexive(Equals equals) {
        return equals.isReflexive(equivalence);
    }

    public Set<Atom> getDecidabilityFacts() {
        return decidabilityFacts;
    }

    public Set<RuleApplication> getRuleApplications() {
        return new LinkedHashSet<>(ruleApplications);
    }

    public boolean hasApplied(RuleApplication application) {
        return ruleApplications.contains(application);
    }

    public void addRuleApplications(Collection<? extends RuleApplication> applications) {
        ruleApplications.addAll(applications);
    }

    public Map<RuleApplication, List<Branch>> getExtensions() {
        return Collections.unmodifiableMap(extensions);
    }

    public void addExtension(RuleApplication application, List<Branch> children) {
        extensions.put(application, List.copyOf(children));
    }

    public Substitution getSubstitution() {
        return substitution.copy();
    }

    /**
     * Rewrites every formula except {@code keep} and every decidability fact with the substitution.
     */
    public void applySubstitution(Substitution sub, Formula keep) {
        var fCopy = List.copyOf(formulas);
        formulas.clear();
        for (var formula : fCopy) {
            formulas.add(formula.equals(keep) ? formula : equivalence.canonical(formula.applySub(sub)));
        }
        var dCopy = List.copyOf(decidabilityFacts);
        decidabilityFacts.clear();
        for (var atom : dCopy) {
            Formula substituted = atom.applySub(sub);
            if (substituted instanceof Atom a && !(a instanceof Equals eq && isReflexive(eq))) {
                decidabilityFacts.add((Atom) equivalence.canonical(a));
            }
        }
        substitution = substitution.compose(sub);
    }

    public Optional<Closure> getClosure() {
        return Optional.ofNullable(closure);
    }

    public void close(Closure closure) {
        this.closure = closure;
    }

    public boolean isClosed() {
        return closure != null;
    }

    public Branch getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Three-valued evaluation against the formulas of this branch. Only consequences that hold
     * without excluded middle are reported as known.
     */
    public Value valueOf(Formula formula) {
        if (contains(formula)) return Value.TRUE;
        if (contains(new Not(formula))) return Value.FALSE;
        if (formula instanceof Not not && contains(not.formula())) return Value.FALSE;
        return evaluate(formula);
    }

    /**
     * Like {@link #valueOf(Formula)}, but only looks at the parts of the formula, never at the formula
     * itself.
     */
    public Value evaluate(Formula formula) {
        if (formula instanceof Truth truth) {
            return truth.value() ? Value.TRUE : Value.FALSE;
        } else if (formula instanceof Atom atom) {
            if (atom instanceof Equals eq && isReflexive(eq)) return Value.TRUE;
            return contains(new Not(atom)) ? Value.FALSE : Value.UNKNOWN;
        } else if (formula instanceof Not not) {
            return valueOf(not.formula()).negate();
        } else if (formula instanceof And and) {
            Value left = valueOf(and.left());
            Value right = valueOf(and.right());
            if (left == Value.FALSE || right == Value.FALSE) return Value.FALSE;
            if (left == Value.TRUE && right == Value.TRUE) return Value.TRUE;
            return Value.UNKNOWN;
        } else if (formula instanceof Or or) {
            Value left = valueOf(or.left());
            Value right = valueOf(or.right());
            if (left == Value.TRUE || right == Value.TRUE) return Value.TRUE;
            if (left == Value.FALSE && right == Value.FALSE) return Value.FALSE;
            return Value.UNKNOWN;
        } else if (formula instanceof Implies implies) {
            Value left = valueOf(implies.left());
            Value right = valueOf(implies.right());
            if (left == Value.FALSE || right == Value.TRUE) return Value.TRUE;
            if (left == Value.TRUE && right == Value.FALSE) return Value.FALSE;
            return Value.UNKNOWN;
        } else if (formula instanceof Iff iff) {
            Value left = valueOf(iff.left());
            Value right = valueOf(iff.right());
            if (left == Value.UNKNOWN || right == Value.UNKNOWN) return Value.UNKNOWN;
            return left == right ? Value.TRUE : Value.FALSE;
        }
        throw new IllegalStateException("Unexpected formula type: " + formula.getClass());
    }

    /**
     * @return the branches below this one that were not split any further
     */
    public List<Branch> leaves() {
        if (extensions.isEmpty()) return List.of(this);
        List<Branch> out = new ArrayList<>();
        for (var children : extensions.values()) {
            for (var child : children) out.addAll(child.leaves());
        }
        return out;
    }

    public String createString(int indentation, String delim) {
        StringBuilder sb = new StringBuilder();
        String outerIndent = "  ".repeat(Math.max(0, indentation)) + delim + " ";
        String nestedIndent = "  ".repeat(Math.max(0, indentation + 1)) + delim + " ";
        sb.append(outerIndent).append("Branch %d:\n".formatted(id));
        var ownFormulas = formulas.stream()
                .filter(f -> parent == null || !parent.formulas.contains(f))
                .sorted((Formula f1, Formula f2) -> {
                    int cmp = Integer.compare(f1.countLiterals(), f2.countLiterals());
                    if (cmp != 0)
                        return cmp;
                    return f1.toString().compareTo(f2.toString());
                })
                .map(Object::toString)
                .collect(Collectors.toList());
        if (!ownFormulas.isEmpty()) {
            sb.append(nestedIndent)
                    .append("Assumes: ")
                    .append(String.join(", ", ownFormulas))
                    .append("\n");
        }
        var ownApplications = ruleApplications.stream()
                .filter(ra -> parent == null || !parent.ruleApplications.contains(ra))
                .filter(ra -> !extensions.containsKey(ra))
                .toList();
        for (var application : ownApplications) {
            sb.append(application.getString(indentation + 1, delim)).append("\n");
        }
        if (closure != null) {
            sb.append(closure.getString(indentation + 1, delim)).append("\n");
        }
        for (var extension : extensions.entrySet()) {
            sb.append(extension.getKey().getString(indentation + 1, delim)).append("\n");
            for (var child : extension.getValue()) {
                sb.append(child.createString(indentation + 2, delim));
            }
        }
        return sb.toString();
    }

    public String createString(int indentation) {
        return createString(indentation, "*");
    }

    @Override
    public String toString() {
        return createString(0);
    }
}
