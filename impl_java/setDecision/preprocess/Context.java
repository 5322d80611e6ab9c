package setDecision.preprocess;

import fol.Substitution;
import fol.formula.Atom;
import fol.formula.Formula;
import fol.formula.SetRelation;
import fol.term.Sort;
import fol.term.Term;
import fol.term.Variable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import setDecision.DecisionOptions;
import setDecision.Hypothesis;
import setDecision.RuleApplication;

/**
 * The working set of a single proof attempt: hypotheses, the goal, and everything the
 * preprocessing stages accumulate on the way to the closure search.
 */
public class Context {
    private final List<Hypothesis> hypotheses;
    private Formula goal;
    private final List<Universal> universals;
    private final Set<Atom> decidabilityFacts;
    private final Set<Formula> appliedEliminations;
    private final List<RuleApplication> trace;
    private final Set<String> takenNames;
    private final DecisionOptions options;
    private int introductions = 0;

    /**
     * A set relation whose universal reading has been taken out of the hypotheses, with the element
     * terms it has already been instantiated at.
     */
    public static final class Universal {
        private final String name;
        private SetRelation relation;
        private Set<Term> instantiatedAt;

        Universal(String name, SetRelation relation) {
            this.name = name;
            this.relation = relation;
            this.instantiatedAt = new HashSet<>();
        }

        public String name() {
            return name;
        }

        public SetRelation relation() {
            return relation;
        }

        public Set<Term> instantiatedAt() {
            return instantiatedAt;
        }

        void applySub(Substitution substitution) {
            relation = (SetRelation) relation.applySub(substitution);
            instantiatedAt = instantiatedAt.stream()
                    .map(t -> t.applySub(substitution))
                    .collect(Collectors.toCollection(HashSet::new));
        }
    }

    /**
     * Terms of the hypotheses and the goal are replaced by their canonical forms under the
     * configured term equivalence.
     */
    public Context(List<Hypothesis> hypotheses, Formula goal, DecisionOptions options) {
        var equivalence = options.termEquivalence();
        this.hypotheses = new ArrayList<>();
        for (var hypothesis : hypotheses) {
            this.hypotheses.add(hypothesis.withFormula(equivalence.canonical(hypothesis.formula())));
        }
        this.goal = equivalence.canonical(goal);
        this.options = options;
        this.universals = new ArrayList<>();
        this.decidabilityFacts = new LinkedHashSet<>();
        this.appliedEliminations = new HashSet<>();
        this.trace = new ArrayList<>();
        this.takenNames = new HashSet<>();
        for (var hypothesis : hypotheses) {
            takenNames.add(hypothesis.name());
            hypothesis.formula().freeVars().forEach(v -> takenNames.add(v.name()));
        }
        goal.freeVars().forEach(v -> takenNames.add(v.name()));
    }

    public DecisionOptions getOptions() {
        return options;
    }

    public List<Hypothesis> getHypotheses() {
        return List.copyOf(hypotheses);
    }

    public void setHypotheses(List<Hypothesis> newHypotheses) {
        hypotheses.clear();
        hypotheses.addAll(newHypotheses);
    }

    /**
     * Adds a hypothesis unless an identical formula is already present.
     *
     * @return whether the hypothesis was added
     */
    public boolean addHypothesis(Hypothesis hypothesis) {
        if (contains(hypothesis.formula())) return false;
        hypotheses.add(hypothesis);
        takenNames.add(hypothesis.name());
        return true;
    }

    /**
     * Whether some hypothesis is the formula, up to the configured term equivalence.
     */
    public boolean contains(Formula formula) {
        var equivalence = options.termEquivalence();
        Formula canonical = equivalence.canonical(formula);
        for (var hypothesis : hypotheses) {
            if (equivalence.canonical(hypothesis.formula()).equals(canonical)) return true;
        }
        return false;
    }

    public Formula getGoal() {
        return goal;
    }

    public void setGoal(Formula goal) {
        this.goal = goal;
    }

    public List<Universal> getUniversals() {
        return universals;
    }

    public void addUniversal(String name, SetRelation relation) {
        universals.add(new Universal(name, relation));
    }

    public Set<Atom> getDecidabilityFacts() {
        return decidabilityFacts;
    }

    public Set<Formula> getAppliedEliminations() {
        return appliedEliminations;
    }

    public List<RuleApplication> getTrace() {
        return List.copyOf(trace);
    }

    public void addRuleApplication(RuleApplication application) {
        trace.add(application);
    }

    /**
     * Applies the substitution to every hypothesis except {@code keep}, to the goal and to the
     * universal statements.
     */
    public void applySubstitution(Substitution substitution, Hypothesis keep) {
        List<Hypothesis> updated = new ArrayList<>(hypotheses.size());
        for (var hypothesis : hypotheses) {
            if (hypothesis == keep) {
                updated.add(hypothesis);
            } else {
                updated.add(hypothesis.withFormula(hypothesis.formula().applySub(substitution)));
            }
        }
        setHypotheses(updated);
        goal = goal.applySub(substitution);
        universals.forEach(u -> u.applySub(substitution));
    }

    /**
     * The relevant-element-set: every element term in an element position of a hypothesis, the goal
     * or a universal statement, in a stable order.
     */
    public List<Term> relevantElements() {
        Set<Term> terms = new HashSet<>(goal.elementTerms());
        for (var hypothesis : hypotheses) terms.addAll(hypothesis.formula().elementTerms());
        for (var universal : universals) terms.addAll(universal.relation().elementTerms());
        return terms.stream().sorted(Comparator.comparing(Object::toString)).toList();
    }

    public Set<Variable> variables() {
        Set<Variable> out = new HashSet<>(goal.freeVars());
        for (var hypothesis : hypotheses) out.addAll(hypothesis.formula().freeVars());
        for (var universal : universals) out.addAll(universal.relation().freeVars());
        return out;
    }

    public Variable freshElement() {
        return Variable.fresh("_w", Sort.ELEMENT, takenNames);
    }

    public String freshHypothesisName(String prefix) {
        String name;
        do {
            ++introductions;
            name = prefix + introductions;
        } while (takenNames.contains(name));
        takenNames.add(name);
        return name;
    }

    /**
     * Whether the term still occurs anywhere, including opaque positions.
     */
    public boolean occurs(Variable variable) {
        return variables().contains(variable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (var hypothesis : hypotheses) sb.append(hypothesis).append('\n');
        for (var universal : universals) sb.append(universal.name()).append(": ∀ ").append(universal.relation()).append('\n');
        sb.append("⊢ ").append(goal);
        return sb.toString();
    }
}
