package setDecision.preprocess;

public interface PreprocessingStep {

    /**
     * Rewrites the context in place. Inapplicability is not an error: the step simply reports
     * that nothing changed.
     *
     * @param context the context to transform
     * @return whether the context changed
     */
    boolean apply(final Context context);
}
