package setDecision;

import fol.formula.And;
import fol.formula.Formula;
import fol.formula.Not;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import setDecision.preprocess.Classifier;
import setDecision.preprocess.Context;
import setDecision.preprocess.DecidabilityInjector;
import setDecision.preprocess.EqualitySubstitutor;
import setDecision.preprocess.NegationNormalizer;
import setDecision.preprocess.PreprocessingStep;
import setDecision.preprocess.QuantifierInstantiator;
import setDecision.preprocess.SetOperatorRewriter;
import setDecision.search.Branch;
import setDecision.search.ClosureSearch;
import setDecision.search.Heuristics;
import setDecision.search.SearchResult;

/**
 * Decides goals of the quantifier-free theory of finite sets over an element type with decidable
 * equality.
 * <p>
 * {@code PROVED} answers are always backed by a certificate. {@code NOT_PROVED} means that no proof
 * was found, not that the goal is false: hypotheses outside the set fragment are ignored, and
 * function applications are treated as opaque.
 */
public class SetDecider {
    private static final Logger log = LogManager.getFormatterLogger();

    private final DecisionOptions options;
    private final Classifier classifier;
    private final QuantifierInstantiator instantiator;
    private final SetOperatorRewriter rewriter;
    private final NegationNormalizer normalizer;
    private final EqualitySubstitutor substitutor;
    private final DecidabilityInjector injector;

    public SetDecider() {
        this(new DecisionOptions());
    }

    public SetDecider(DecisionOptions options) {
        this.options = Objects.requireNonNull(options);
        DecidabilityTable decidability = options.decidability();
        this.classifier = new Classifier(decidability);
        this.instantiator = new QuantifierInstantiator();
        this.rewriter = new SetOperatorRewriter();
        this.normalizer = new NegationNormalizer(decidability, options.pullNegations());
        this.substitutor = new EqualitySubstitutor();
        this.injector = new DecidabilityInjector(decidability);
    }

    public DecisionOptions getOptions() {
        return options;
    }

    /**
     * Decides the goal under hypotheses named {@code H1}, {@code H2}, ...
     */
    public Decision decide(Formula goal, Formula... hypotheses) {
        List<Hypothesis> named = new ArrayList<>();
        for (int i = 0; i < hypotheses.length; i++) {
            named.add(new Hypothesis("H" + (i + 1), hypotheses[i]));
        }
        return decide(named, goal);
    }

    /**
     * Decides the goal under the given hypotheses. A conjunctive goal is proved one conjunct at a
     * time, each within its own step budget.
     */
    public Decision decide(List<Hypothesis> hypotheses, Formula goal) {
        Objects.requireNonNull(hypotheses);
        Objects.requireNonNull(goal);
        List<Formula> conjuncts = new ArrayList<>();
        splitGoal(goal, conjuncts);
        List<Certificate.Proof> proofs = new ArrayList<>();
        for (var conjunct : conjuncts) {
            Context context = preprocess(hypotheses, conjunct);
            Branch root = new Branch(searchFormulas(context), context.getDecidabilityFacts(),
                    options.congruentSubstitution(), options.termEquivalence());
            Heuristics.Heuristic heuristic = Heuristics.forOrder(options.searchOrder());
            log.debug("Searching for a refutation of %s (%s)", conjunct, heuristic.getName());
            SearchResult result = new ClosureSearch(root, heuristic, normalizer, options.maxSteps()).search();
            switch (result.outcome()) {
                case REFUTED:
                    proofs.add(new Certificate.Proof(conjunct, context.getTrace(), root, result.steps()));
                    break;
                case OPEN:
                    log.debug("No proof of %s, open branch:%n%s", conjunct, result.openBranch().map(Branch::toString).orElse(""));
                    return Decision.notProved(Decision.Failure.STUCK);
                case EXHAUSTED:
                    log.debug("No proof of %s within %d steps", conjunct, options.maxSteps());
                    return Decision.notProved(Decision.Failure.BUDGET_EXHAUSTED);
                default:
                    throw new IllegalStateException("Unexpected search outcome: " + result.outcome());
            }
        }
        log.debug("Proved %s with %d hypotheses", goal, hypotheses.size());
        return Decision.proved(new Certificate(proofs));
    }

    /**
     * Runs stages 1 to 6. The instantiation, rewriting, normalization and substitution stages are
     * repeated together until none of them changes the context, since substituting or rewriting
     * can expose new terms to instantiate at.
     */
    public Context preprocess(List<Hypothesis> hypotheses, Formula goal) {
        Context context = new Context(hypotheses, goal, options);
        classifier.apply(context);

        List<PreprocessingStep> joint = List.of(instantiator, rewriter, normalizer, substitutor);
        int maxRounds = 2 + context.variables().size();
        boolean changed = true;
        for (int round = 0; changed; round++) {
            if (round == maxRounds) {
                log.warn("Preprocessing still changing after %d rounds, searching with:%n%s", maxRounds, context);
                break;
            }
            changed = false;
            for (var step : joint) {
                changed |= step.apply(context);
            }
        }

        injector.apply(context);
        log.trace("Preprocessed context:%n%s", context);
        return context;
    }

    private List<Formula> searchFormulas(Context context) {
        List<Formula> formulas = new ArrayList<>();
        for (var hypothesis : context.getHypotheses()) {
            formulas.add(hypothesis.formula());
        }
        formulas.add(normalizer.push(new Not(context.getGoal())));
        return formulas;
    }

    private static void splitGoal(Formula goal, List<Formula> out) {
        if (goal instanceof And and) {
            splitGoal(and.left(), out);
            splitGoal(and.right(), out);
        } else {
            out.add(goal);
        }
    }
}
